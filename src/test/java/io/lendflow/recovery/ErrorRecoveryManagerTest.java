package io.lendflow.recovery;

import io.lendflow.error.AgentFailureException;
import io.lendflow.error.SecurityViolationException;
import io.lendflow.error.ValidationException;
import io.lendflow.model.ApplicationState;
import io.lendflow.observability.AuditLog;
import io.lendflow.observability.AuditQuery;
import io.lendflow.observability.InMemorySegmentStore;
import io.lendflow.state.ApplicationStateMachine;
import io.lendflow.state.InMemoryApplicationStateStore;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

final class ErrorRecoveryManagerTest {

    @Test
    void classifiesByExceptionType() {
        assertClassified(new AgentFailureException("down"), ErrorSeverity.HIGH, ErrorCategory.AGENT_FAILURE);
        assertClassified(new ValidationException("bad"), ErrorSeverity.MEDIUM, ErrorCategory.VALIDATION);
        assertClassified(new SecurityViolationException("nope"), ErrorSeverity.HIGH, ErrorCategory.SECURITY);
        assertClassified(new IOException("disk"), ErrorSeverity.CRITICAL, ErrorCategory.SYSTEM);
        assertClassified(new IllegalStateException("boom"), ErrorSeverity.CRITICAL, ErrorCategory.UNKNOWN);
        assertClassified(new Exception("checked"), ErrorSeverity.MEDIUM, ErrorCategory.UNKNOWN);
    }

    @Test
    void plansFromCategoryStrategyOrSeverity() {
        Fixture fx = fixture();

        ErrorRecord agent = fx.manager().handleError("app-1", new AgentFailureException("down"), Map.of());
        Assertions.assertEquals(List.of(RecoveryAction.DIAGNOSTIC, RecoveryAction.ESCALATE), agent.plannedActions());
        Assertions.assertEquals(RecoveryStatus.RECOVERY_PLANNED, agent.status());

        ErrorRecord validation = fx.manager().handleError("app-1", new ValidationException("bad"), Map.of());
        Assertions.assertEquals(List.of(RecoveryAction.REVERT, RecoveryAction.ALTERNATE), validation.plannedActions());

        ErrorRecord overridden = fx.manager().handleError("app-1", new AgentFailureException("slow"), Map.of(),
                ErrorSeverity.LOW, null);
        Assertions.assertEquals(List.of(RecoveryAction.RETRY, RecoveryAction.ALTERNATE), overridden.plannedActions());

        ErrorRecord unknown = fx.manager().handleError("app-1", new Exception("odd"), Map.of());
        Assertions.assertEquals(List.of(RecoveryAction.RETRY, RecoveryAction.FALLBACK), unknown.plannedActions());

        fx.manager().registerRecoveryStrategy(ErrorCategory.SECURITY, r -> List.of(RecoveryAction.SUSPEND));
        ErrorRecord security = fx.manager().handleError("app-1", new SecurityViolationException("x"), Map.of());
        Assertions.assertEquals(List.of(RecoveryAction.SUSPEND), security.plannedActions());

        Assertions.assertEquals(5, fx.audit().search(AuditQuery.all().withAction("error_detected")).size());
    }

    @Test
    void callerPlanWinsOverStrategy() {
        Fixture fx = fixture();
        RecordingTarget target = new RecordingTarget();
        ErrorRecord record = fx.manager().handleError("app-1", new AgentFailureException("down"), Map.of(), null, null,
                new RecoveryContext(target, 2, 0, List.of(RecoveryAction.IGNORE)));
        Assertions.assertEquals(List.of(RecoveryAction.IGNORE), record.plannedActions());
        Assertions.assertEquals(2, record.maxRetries());

        Assertions.assertTrue(fx.manager().executeRecovery("app-1", record.errorId(), RecoveryAction.IGNORE));
        Assertions.assertEquals(List.of("ignore"), target.calls);
    }

    @Test
    void exhaustedBudgetTurnsRetryIntoFallback() {
        Fixture fx = fixture();
        RecordingTarget target = new RecordingTarget();
        ErrorRecord record = fx.manager().handleError("app-1", new AgentFailureException("down"), Map.of(), null, null,
                new RecoveryContext(target, 1, 0, List.of(RecoveryAction.RETRY)));

        Assertions.assertTrue(fx.manager().executeRecovery("app-1", record.errorId(), RecoveryAction.RETRY));
        Assertions.assertTrue(fx.manager().executeRecovery("app-1", record.errorId(), RecoveryAction.RETRY));
        Assertions.assertEquals(List.of("retry", "fallback"), target.calls);

        ErrorRecord stored = fx.manager().findError("app-1", record.errorId()).orElseThrow();
        Assertions.assertEquals(2, stored.attempts().size());
        RecoveryAttempt converted = stored.attempts().get(1);
        Assertions.assertEquals(RecoveryAction.FALLBACK, converted.action());
        Assertions.assertEquals(RecoveryAction.RETRY, converted.requestedAction());
        Assertions.assertEquals(AttemptResult.SUCCESS, converted.result());
        Assertions.assertEquals(RecoveryStatus.RECOVERY_SUCCESSFUL, stored.status());
    }

    @Test
    void priorAttemptsCountAgainstBudget() {
        Fixture fx = fixture();
        RecordingTarget target = new RecordingTarget();
        ErrorRecord record = fx.manager().handleError("app-1", new AgentFailureException("down"), Map.of(), null, null,
                new RecoveryContext(target, 2, 2, List.of(RecoveryAction.ALTERNATE)));

        Assertions.assertTrue(record.retryBudgetExhausted());
        fx.manager().executeRecovery("app-1", record.errorId(), RecoveryAction.ALTERNATE);
        fx.manager().executeRecovery("app-1", record.errorId(), RecoveryAction.ESCALATE);
        Assertions.assertEquals(List.of("fallback", "escalate"), target.calls);
    }

    @Test
    void failingAndThrowingTargetsAreRecorded() {
        Fixture fx = fixture();
        RecordingTarget target = new RecordingTarget();
        target.outcome = false;
        ErrorRecord record = fx.manager().handleError("app-1", new ValidationException("bad"), Map.of(), null, null,
                new RecoveryContext(target, 3, 0, List.of()));

        Assertions.assertFalse(fx.manager().executeRecovery("app-1", record.errorId(), RecoveryAction.REVERT));
        Assertions.assertEquals(RecoveryStatus.RECOVERY_FAILED,
                fx.manager().findError("app-1", record.errorId()).orElseThrow().status());

        target.failure = new IllegalStateException("target exploded");
        Assertions.assertFalse(fx.manager().executeRecovery("app-1", record.errorId(), RecoveryAction.ALTERNATE));
        ErrorRecord stored = fx.manager().findError("app-1", record.errorId()).orElseThrow();
        Assertions.assertEquals(RecoveryStatus.RECOVERY_ERROR, stored.status());
        Assertions.assertEquals(AttemptResult.ERROR, stored.attempts().get(1).result());
        Assertions.assertEquals("target exploded", stored.attempts().get(1).detail());
        Assertions.assertEquals(2, fx.audit().search(AuditQuery.all().withAction("execute_recovery")).size());
    }

    @Test
    void rejectsUnknownRecordsAndBlankApplications() {
        Fixture fx = fixture();
        ErrorRecord record = fx.manager().handleError("app-1", new ValidationException("bad"), Map.of());

        Assertions.assertThrows(IllegalArgumentException.class,
                () -> fx.manager().executeRecovery("app-1", "err_missing", RecoveryAction.RETRY));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> fx.manager().executeRecovery("app-2", record.errorId(), RecoveryAction.RETRY));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> fx.manager().handleError(" ", new ValidationException("bad"), Map.of()));
        Assertions.assertTrue(fx.manager().findError("app-2", record.errorId()).isEmpty());
    }

    @Test
    void defaultTargetSuspendsApplication() {
        Fixture fx = fixture();
        fx.stateMachine().createApplication("app-1");
        for (ApplicationState next : List.of(
                ApplicationState.DOCUMENT_COLLECTION,
                ApplicationState.DOCUMENT_VALIDATION,
                ApplicationState.DOCUMENT_ANALYSIS,
                ApplicationState.UNDERWRITING,
                ApplicationState.COMPLIANCE_CHECK,
                ApplicationState.DECISION_PENDING)) {
            fx.stateMachine().transition("app-1", next, "advance");
        }

        ErrorRecord record = fx.manager().handleError("app-1", new IOException("disk full"), Map.of("agent_id", "doc"));
        Assertions.assertEquals(List.of(RecoveryAction.ESCALATE, RecoveryAction.SUSPEND), record.plannedActions());
        for (RecoveryAction action : record.plannedActions()) {
            Assertions.assertTrue(fx.manager().executeRecovery("app-1", record.errorId(), action));
        }
        Assertions.assertEquals(ApplicationState.SUSPENDED, fx.stateMachine().currentState("app-1").orElseThrow());
        Assertions.assertEquals(1, fx.audit().search(AuditQuery.all().withAction("escalation_requested")).size());

        ErrorRecord retry = fx.manager().handleError("app-1", new Exception("odd"), Map.of());
        Assertions.assertFalse(fx.manager().executeRecovery("app-1", retry.errorId(), RecoveryAction.RETRY));
        ErrorRecord restart = fx.manager().handleError("app-1", new Exception("odd again"), Map.of());
        Assertions.assertTrue(fx.manager().executeRecovery("app-1", restart.errorId(), RecoveryAction.RESTART));
        Assertions.assertEquals(ApplicationState.DOCUMENT_COLLECTION, fx.stateMachine().currentState("app-1").orElseThrow());
    }

    @Test
    void historyIsNewestFirstAndStatisticsSummarise() {
        Fixture fx = fixture();
        RecordingTarget target = new RecordingTarget();
        ErrorRecord first = fx.manager().handleError("app-1", new ValidationException("one"), Map.of(), null, null,
                new RecoveryContext(target, 1, 0, List.of()));
        ErrorRecord second = fx.manager().handleError("app-1", new AgentFailureException("two"), Map.of());
        fx.manager().handleError("app-2", new AgentFailureException("other"), Map.of());
        fx.manager().executeRecovery("app-1", first.errorId(), RecoveryAction.REVERT);

        List<ErrorRecord> history = fx.manager().errorHistory("app-1", 10);
        Assertions.assertEquals(2, history.size());
        Assertions.assertEquals(second.errorId(), history.get(0).errorId());
        Assertions.assertEquals(first.errorId(), history.get(1).errorId());
        Assertions.assertEquals(1, fx.manager().errorHistory("app-1", 1).size());

        ErrorStatistics stats = fx.manager().errorStatistics("app-1");
        Assertions.assertEquals(2, stats.totalErrors());
        Assertions.assertEquals(1L, stats.byCategory().get("validation"));
        Assertions.assertEquals(1L, stats.byStatus().get("recovery_successful"));
        Assertions.assertEquals(1.0, stats.recoverySuccessRate(), 0.0001);
        Assertions.assertEquals(3, fx.manager().errorStatistics(null).totalErrors());
        Assertions.assertEquals(0.0, fx.manager().errorStatistics("nobody").recoverySuccessRate(), 0.0001);
    }

    private static void assertClassified(Throwable error, ErrorSeverity severity, ErrorCategory category) {
        ErrorRecoveryManager.Classification c = ErrorRecoveryManager.classify(error);
        Assertions.assertEquals(severity, c.severity(), error.getClass().getSimpleName());
        Assertions.assertEquals(category, c.category(), error.getClass().getSimpleName());
    }

    private static Fixture fixture() {
        AuditLog audit = new AuditLog(new InMemorySegmentStore());
        ApplicationStateMachine stateMachine = new ApplicationStateMachine(
                new InMemoryApplicationStateStore(), audit, Clock.systemUTC());
        ErrorRecoveryManager manager = new ErrorRecoveryManager(
                audit,
                new InMemoryErrorRecordStore(),
                new ApplicationRecoveryTarget(stateMachine, audit),
                1,
                Clock.systemUTC()
        );
        return new Fixture(manager, stateMachine, audit);
    }

    private record Fixture(ErrorRecoveryManager manager, ApplicationStateMachine stateMachine, AuditLog audit) {
    }

    private static final class RecordingTarget implements RecoveryTarget {
        private final List<String> calls = new ArrayList<>();
        private boolean outcome = true;
        private RuntimeException failure;

        private boolean hit(String action) {
            calls.add(action);
            if (failure != null) {
                throw failure;
            }
            return outcome;
        }

        @Override
        public boolean retry(ErrorRecord record) {
            return hit("retry");
        }

        @Override
        public boolean fallback(ErrorRecord record) {
            return hit("fallback");
        }

        @Override
        public boolean revert(ErrorRecord record) {
            return hit("revert");
        }

        @Override
        public boolean restart(ErrorRecord record) {
            return hit("restart");
        }

        @Override
        public boolean alternate(ErrorRecord record) {
            return hit("alternate");
        }

        @Override
        public boolean diagnostic(ErrorRecord record) {
            return hit("diagnostic");
        }

        @Override
        public boolean escalate(ErrorRecord record) {
            return hit("escalate");
        }

        @Override
        public boolean suspend(ErrorRecord record) {
            return hit("suspend");
        }

        @Override
        public boolean ignore(ErrorRecord record) {
            return hit("ignore");
        }
    }
}
