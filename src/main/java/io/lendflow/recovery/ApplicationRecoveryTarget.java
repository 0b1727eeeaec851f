package io.lendflow.recovery;

import io.lendflow.model.ApplicationState;
import io.lendflow.observability.AuditLog;
import io.lendflow.state.ApplicationStateMachine;
import io.lendflow.state.StateTransition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recovery target for failures raised outside a workflow session. It can only act on
 * the application's lifecycle state; actions that need a step to re-run report false.
 */
public final class ApplicationRecoveryTarget implements RecoveryTarget {
    private static final Logger log = LoggerFactory.getLogger(ApplicationRecoveryTarget.class);

    private final ApplicationStateMachine stateMachine;
    private final AuditLog auditLog;

    public ApplicationRecoveryTarget(ApplicationStateMachine stateMachine, AuditLog auditLog) {
        this.stateMachine = stateMachine;
        this.auditLog = auditLog;
    }

    @Override
    public boolean retry(ErrorRecord record) {
        log.info("No step bound to error {}; retry is not applicable", record.errorId());
        return false;
    }

    @Override
    public boolean fallback(ErrorRecord record) {
        log.info("No fallback declared for session-less error {}", record.errorId());
        return false;
    }

    @Override
    public boolean revert(ErrorRecord record) {
        return stateMachine.revertToPrevious(record.applicationId(), "revert after " + record.errorType());
    }

    /**
     * Sends a suspended application back to document collection.
     */
    @Override
    public boolean restart(ErrorRecord record) {
        return stateMachine.currentState(record.applicationId())
                .filter(s -> s == ApplicationState.SUSPENDED)
                .map(s -> stateMachine.transition(record.applicationId(), ApplicationState.DOCUMENT_COLLECTION,
                        "restart after " + record.errorType()))
                .orElse(false);
    }

    @Override
    public boolean alternate(ErrorRecord record) {
        return false;
    }

    @Override
    public boolean diagnostic(ErrorRecord record) {
        List<StateTransition> history = stateMachine.history(record.applicationId());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_id", record.errorId());
        details.put("current_state", stateMachine.currentState(record.applicationId())
                .map(ApplicationState::wireName).orElse("unknown"));
        details.put("transitions", history.size());
        details.put("error_context", record.context());
        auditLog.logSecurityEvent("diagnostic", null, null, record.applicationId(), details, true);
        log.info("Diagnostic for error {} on application {}: {}", record.errorId(), record.applicationId(), details);
        return true;
    }

    @Override
    public boolean escalate(ErrorRecord record) {
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_id", record.errorId());
        details.put("severity", record.severity().wireName());
        details.put("message", record.message());
        auditLog.logSecurityEvent("escalation_requested", null, null, record.applicationId(), details, true);
        log.warn("Escalated error {} on application {} for manual review", record.errorId(), record.applicationId());
        return true;
    }

    @Override
    public boolean suspend(ErrorRecord record) {
        return stateMachine.transition(record.applicationId(), ApplicationState.SUSPENDED,
                "suspended after " + record.errorType());
    }
}
