package io.lendflow.recovery;

import io.lendflow.error.AgentFailureException;
import io.lendflow.error.CommunicationException;
import io.lendflow.error.DataIntegrityException;
import io.lendflow.error.DocumentProcessingException;
import io.lendflow.error.IntegrationException;
import io.lendflow.error.SecurityViolationException;
import io.lendflow.error.SystemFailureException;
import io.lendflow.error.ValidationException;
import io.lendflow.error.WorkflowException;
import io.lendflow.observability.AuditLog;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Classifies raised failures into error records, plans recovery actions for them and
 * executes those actions one at a time against the record's recovery target.
 */
public final class ErrorRecoveryManager {
    private static final Logger log = LoggerFactory.getLogger(ErrorRecoveryManager.class);

    private final AuditLog auditLog;
    private final ErrorRecordStore store;
    private final RecoveryTarget defaultTarget;
    private final int defaultMaxRetries;
    private final Clock clock;
    private final Map<ErrorCategory, RecoveryStrategy> strategies = new EnumMap<>(ErrorCategory.class);
    private final Map<String, RecoveryTarget> targets = new ConcurrentHashMap<>();
    private final Map<String, Object> recordLocks = new ConcurrentHashMap<>();

    public ErrorRecoveryManager(
            AuditLog auditLog,
            ErrorRecordStore store,
            RecoveryTarget defaultTarget,
            int defaultMaxRetries,
            Clock clock
    ) {
        this.auditLog = auditLog;
        this.store = store;
        this.defaultTarget = defaultTarget;
        this.defaultMaxRetries = Math.max(0, defaultMaxRetries);
        this.clock = clock == null ? Clock.systemUTC() : clock;
        registerDefaultStrategies();
    }

    private void registerDefaultStrategies() {
        strategies.put(ErrorCategory.VALIDATION, r -> List.of(RecoveryAction.REVERT, RecoveryAction.ALTERNATE));
        strategies.put(ErrorCategory.AGENT_FAILURE, r -> switch (r.severity()) {
            case LOW, MEDIUM -> List.of(RecoveryAction.RETRY, RecoveryAction.ALTERNATE);
            case HIGH, CRITICAL -> List.of(RecoveryAction.DIAGNOSTIC, RecoveryAction.ESCALATE);
        });
        strategies.put(ErrorCategory.COMMUNICATION, r -> List.of(RecoveryAction.RETRY, RecoveryAction.FALLBACK));
        strategies.put(ErrorCategory.SYSTEM, r -> List.of(RecoveryAction.ESCALATE, RecoveryAction.SUSPEND));
    }

    public synchronized void registerRecoveryStrategy(ErrorCategory category, RecoveryStrategy strategy) {
        if (category == null || strategy == null) {
            throw new IllegalArgumentException("category and strategy are required");
        }
        strategies.put(category, strategy);
        log.info("Registered recovery strategy for category {}", category.wireName());
    }

    public ErrorRecord handleError(String applicationId, Throwable error, Map<String, Object> context) {
        return handleError(applicationId, error, context, null, null, null);
    }

    public ErrorRecord handleError(
            String applicationId,
            Throwable error,
            Map<String, Object> context,
            ErrorSeverity severity,
            ErrorCategory category
    ) {
        return handleError(applicationId, error, context, severity, category, null);
    }

    /**
     * Records the failure, audits its detection and attaches a recovery plan. Nothing
     * is executed yet; callers drive {@link #executeRecovery} through the plan.
     */
    public ErrorRecord handleError(
            String applicationId,
            Throwable error,
            Map<String, Object> context,
            ErrorSeverity severity,
            ErrorCategory category,
            RecoveryContext recoveryContext
    ) {
        if (applicationId == null || applicationId.isBlank()) {
            throw new IllegalArgumentException("applicationId must not be blank");
        }
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        Classification inferred = classify(error);
        ErrorSeverity effectiveSeverity = severity == null ? inferred.severity() : severity;
        ErrorCategory effectiveCategory = category == null ? inferred.category() : category;
        int maxRetries = recoveryContext == null ? defaultMaxRetries : recoveryContext.maxRetries();
        int priorAttempts = recoveryContext == null ? 0 : recoveryContext.priorAttempts();

        ErrorRecord record = new ErrorRecord(
                "err_" + UUID.randomUUID(),
                applicationId,
                Instant.now(clock),
                error.getClass().getSimpleName(),
                error.getMessage() == null ? error.getClass().getName() : error.getMessage(),
                effectiveSeverity,
                effectiveCategory,
                context,
                List.of(),
                List.of(),
                RecoveryStatus.DETECTED,
                priorAttempts,
                maxRetries
        );
        store.save(record);
        if (recoveryContext != null && recoveryContext.target() != null) {
            targets.put(record.errorId(), recoveryContext.target());
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("error_id", record.errorId());
        details.put("error_type", record.errorType());
        details.put("error_message", record.message());
        details.put("severity", effectiveSeverity.wireName());
        details.put("category", effectiveCategory.wireName());
        details.put("context", record.context());
        auditLog.logSecurityEvent("error_detected", null, record.contextValue("agent_id"), applicationId, details, false);

        List<RecoveryAction> plan = recoveryContext != null && !recoveryContext.plannedActions().isEmpty()
                ? recoveryContext.plannedActions()
                : planFor(record);
        ErrorRecord planned = record.withPlan(plan);
        store.save(planned);
        log.warn("Error {} on application {} classified {}/{}: {}; plan={}",
                planned.errorId(), applicationId, effectiveSeverity.wireName(), effectiveCategory.wireName(),
                planned.message(), plan);
        return planned;
    }

    /**
     * Executes exactly one recovery action for the record. Attempt-consuming actions
     * become {@link RecoveryAction#FALLBACK} once the record's retry budget is spent.
     */
    public boolean executeRecovery(String applicationId, String errorId, RecoveryAction action) {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
        Object lock = recordLocks.computeIfAbsent(errorId, k -> new Object());
        synchronized (lock) {
            ErrorRecord record = store.find(errorId)
                    .filter(r -> r.applicationId().equals(applicationId))
                    .orElseThrow(() -> new IllegalArgumentException(
                            "Unknown error record " + errorId + " for application " + applicationId));
            RecoveryAction effective = action;
            if (action.consumesAttempt() && record.retryBudgetExhausted()) {
                log.info("Retry budget of error {} exhausted ({} prior, {} on record, max {}); {} becomes fallback",
                        errorId, record.priorAttempts(), record.consumedAttempts(), record.maxRetries(), action.wireName());
                effective = RecoveryAction.FALLBACK;
            }
            ErrorRecord inProgress = record.withStatus(RecoveryStatus.RECOVERY_IN_PROGRESS);
            store.save(inProgress);

            RecoveryTarget target = targets.getOrDefault(errorId, defaultTarget);
            AttemptResult result;
            String detail = null;
            try {
                boolean ok = dispatch(target, effective, inProgress);
                result = ok ? AttemptResult.SUCCESS : AttemptResult.FAILURE;
            } catch (Exception e) {
                log.error("Recovery action {} for error {} raised", effective.wireName(), errorId, e);
                result = AttemptResult.ERROR;
                detail = e.getMessage();
            }
            RecoveryStatus status = switch (result) {
                case SUCCESS -> RecoveryStatus.RECOVERY_SUCCESSFUL;
                case FAILURE -> RecoveryStatus.RECOVERY_FAILED;
                case ERROR -> RecoveryStatus.RECOVERY_ERROR;
            };
            RecoveryAttempt attempt = new RecoveryAttempt(effective, action, Instant.now(clock), result, detail);
            store.save(inProgress.withAttempt(attempt, status));

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("error_id", errorId);
            details.put("requested_action", action.wireName());
            details.put("recovery_action", effective.wireName());
            details.put("result", result.wireName());
            if (detail != null) {
                details.put("detail", detail);
            }
            auditLog.logEvent(AuditLog.RECOVERY_ATTEMPT, null, record.contextValue("agent_id"),
                    "execute_recovery", applicationId, details, result == AttemptResult.SUCCESS);
            return result == AttemptResult.SUCCESS;
        }
    }

    public Optional<ErrorRecord> findError(String applicationId, String errorId) {
        return store.find(errorId).filter(r -> r.applicationId().equals(applicationId));
    }

    /**
     * Most recent first; a non-positive limit returns everything.
     */
    public List<ErrorRecord> errorHistory(String applicationId, int limit) {
        List<ErrorRecord> records = new ArrayList<>(store.findByApplication(applicationId));
        Collections.reverse(records);
        if (limit > 0 && records.size() > limit) {
            return List.copyOf(records.subList(0, limit));
        }
        return List.copyOf(records);
    }

    /**
     * Statistics for one application, or across all applications when the id is null.
     */
    public ErrorStatistics errorStatistics(String applicationId) {
        List<ErrorRecord> records = applicationId == null ? store.findAll() : store.findByApplication(applicationId);
        Map<String, Long> bySeverity = new TreeMap<>();
        Map<String, Long> byCategory = new TreeMap<>();
        Map<String, Long> byStatus = new TreeMap<>();
        long successful = 0;
        long failed = 0;
        for (ErrorRecord record : records) {
            bySeverity.merge(record.severity().wireName(), 1L, Long::sum);
            byCategory.merge(record.category().wireName(), 1L, Long::sum);
            byStatus.merge(record.status().wireName(), 1L, Long::sum);
            if (record.status() == RecoveryStatus.RECOVERY_SUCCESSFUL) {
                successful++;
            } else if (record.status() == RecoveryStatus.RECOVERY_FAILED) {
                failed++;
            }
        }
        double rate = successful + failed == 0 ? 0.0 : (double) successful / (successful + failed);
        return new ErrorStatistics(records.size(), bySeverity, byCategory, byStatus, rate);
    }

    /**
     * Drops the per-record target binding once the caller is done with a record.
     */
    public void release(String errorId) {
        targets.remove(errorId);
        recordLocks.remove(errorId);
    }

    synchronized List<RecoveryAction> planFor(ErrorRecord record) {
        RecoveryStrategy strategy = strategies.get(record.category());
        if (strategy != null) {
            List<RecoveryAction> plan = strategy.plan(record);
            if (plan != null && !plan.isEmpty()) {
                return List.copyOf(plan);
            }
        }
        return switch (record.severity()) {
            case LOW -> List.of(RecoveryAction.RETRY);
            case MEDIUM -> List.of(RecoveryAction.RETRY, RecoveryAction.FALLBACK);
            case HIGH, CRITICAL -> List.of(RecoveryAction.ESCALATE, RecoveryAction.SUSPEND);
        };
    }

    private static boolean dispatch(RecoveryTarget target, RecoveryAction action, ErrorRecord record) throws Exception {
        if (target == null) {
            throw new IllegalStateException("No recovery target bound for error " + record.errorId());
        }
        return switch (action) {
            case RETRY -> target.retry(record);
            case FALLBACK -> target.fallback(record);
            case REVERT -> target.revert(record);
            case RESTART -> target.restart(record);
            case ALTERNATE -> target.alternate(record);
            case DIAGNOSTIC -> target.diagnostic(record);
            case ESCALATE -> target.escalate(record);
            case SUSPEND -> target.suspend(record);
            case IGNORE -> target.ignore(record);
        };
    }

    static Classification classify(Throwable error) {
        if (error instanceof AgentFailureException) {
            return new Classification(ErrorSeverity.HIGH, ErrorCategory.AGENT_FAILURE);
        }
        if (error instanceof ValidationException) {
            return new Classification(ErrorSeverity.MEDIUM, ErrorCategory.VALIDATION);
        }
        if (error instanceof DocumentProcessingException) {
            return new Classification(ErrorSeverity.MEDIUM, ErrorCategory.DOCUMENT_PROCESSING);
        }
        if (error instanceof CommunicationException
                || error instanceof SocketException
                || error instanceof SocketTimeoutException) {
            return new Classification(ErrorSeverity.MEDIUM, ErrorCategory.COMMUNICATION);
        }
        if (error instanceof SecurityViolationException) {
            return new Classification(ErrorSeverity.HIGH, ErrorCategory.SECURITY);
        }
        if (error instanceof IntegrationException) {
            return new Classification(ErrorSeverity.MEDIUM, ErrorCategory.INTEGRATION);
        }
        if (error instanceof DataIntegrityException) {
            return new Classification(ErrorSeverity.HIGH, ErrorCategory.DATA);
        }
        if (error instanceof SystemFailureException
                || error instanceof IOException
                || error instanceof VirtualMachineError) {
            return new Classification(ErrorSeverity.CRITICAL, ErrorCategory.SYSTEM);
        }
        if (error instanceof WorkflowException) {
            return new Classification(ErrorSeverity.HIGH, ErrorCategory.UNKNOWN);
        }
        if (error instanceof RuntimeException) {
            return new Classification(ErrorSeverity.CRITICAL, ErrorCategory.UNKNOWN);
        }
        return new Classification(ErrorSeverity.MEDIUM, ErrorCategory.UNKNOWN);
    }

    record Classification(ErrorSeverity severity, ErrorCategory category) {
    }
}
