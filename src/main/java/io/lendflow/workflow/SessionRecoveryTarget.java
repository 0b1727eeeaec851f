package io.lendflow.workflow;

import io.lendflow.model.SessionStatus;
import io.lendflow.pattern.StepDefinition;
import io.lendflow.recovery.ErrorRecord;
import io.lendflow.recovery.RecoveryTarget;

/**
 * Applies recovery actions to one failed step of one session. Every method runs on
 * the thread that holds the session lock and only rearranges session state; the drive
 * loop then acts on the resulting status.
 */
final class SessionRecoveryTarget implements RecoveryTarget {
    enum EscalationRoute {
        ORCHESTRATOR,
        HUMAN
    }

    private final CollaborationManager manager;
    private final WorkflowSession session;
    private final StepDefinition step;
    private final EscalationRoute route;
    private final String fallback;

    SessionRecoveryTarget(
            CollaborationManager manager,
            WorkflowSession session,
            StepDefinition step,
            EscalationRoute route,
            String fallback
    ) {
        this.manager = manager;
        this.session = session;
        this.step = step;
        this.route = route;
        this.fallback = fallback;
    }

    @Override
    public boolean retry(ErrorRecord record) {
        session.grantRetry(step.name());
        session.status(SessionStatus.RETRYING_STEP);
        return true;
    }

    @Override
    public boolean fallback(ErrorRecord record) throws Exception {
        return manager.applyFallback(session, step, fallback, record);
    }

    @Override
    public boolean revert(ErrorRecord record) {
        session.grantRetry(step.name());
        session.rewindTo(Math.max(0, session.currentStepIndex() - 1));
        session.status(SessionStatus.RETRYING_STEP);
        return true;
    }

    @Override
    public boolean restart(ErrorRecord record) {
        session.grantRetry(step.name());
        session.rewindTo(0);
        session.status(SessionStatus.RETRYING_STEP);
        return true;
    }

    @Override
    public boolean alternate(ErrorRecord record) {
        return manager.alternateAgentFor(session, step)
                .map(agentId -> {
                    session.grantRetry(step.name());
                    session.agentOverride(agentId);
                    session.status(SessionStatus.RETRYING_STEP);
                    return true;
                })
                .orElse(false);
    }

    @Override
    public boolean diagnostic(ErrorRecord record) {
        manager.recordDiagnostic(session, step, record);
        return true;
    }

    @Override
    public boolean escalate(ErrorRecord record) {
        if (route == EscalationRoute.HUMAN) {
            manager.notifyHuman(session, step, record);
            session.status(SessionStatus.AWAITING_HUMAN_INTERVENTION);
            return true;
        }
        if (!manager.notifyOrchestrator(session, step, record)) {
            return false;
        }
        session.status(SessionStatus.AWAITING_ORCHESTRATOR_INSTRUCTION);
        return true;
    }

    @Override
    public boolean suspend(ErrorRecord record) {
        if (!manager.suspendApplication(session, record)) {
            return false;
        }
        session.status(SessionStatus.AWAITING_HUMAN_INTERVENTION);
        return true;
    }

    @Override
    public boolean ignore(ErrorRecord record) {
        manager.skipCurrentStep(session, "ignored after " + record.errorId());
        return true;
    }
}
