package io.lendflow.recovery;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One raised failure and everything done about it. Instances are immutable; the
 * manager replaces a record with an updated copy on every change.
 */
public record ErrorRecord(
        String errorId,
        String applicationId,
        Instant timestamp,
        String errorType,
        String message,
        ErrorSeverity severity,
        ErrorCategory category,
        Map<String, Object> context,
        List<RecoveryAction> plannedActions,
        List<RecoveryAttempt> attempts,
        RecoveryStatus status,
        int priorAttempts,
        int maxRetries
) {
    public ErrorRecord {
        context = context == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(context));
        plannedActions = plannedActions == null ? List.of() : List.copyOf(plannedActions);
        attempts = attempts == null ? List.of() : List.copyOf(attempts);
    }

    public ErrorRecord withPlan(List<RecoveryAction> plan) {
        return new ErrorRecord(errorId, applicationId, timestamp, errorType, message, severity, category,
                context, plan, attempts, RecoveryStatus.RECOVERY_PLANNED, priorAttempts, maxRetries);
    }

    public ErrorRecord withStatus(RecoveryStatus newStatus) {
        return new ErrorRecord(errorId, applicationId, timestamp, errorType, message, severity, category,
                context, plannedActions, attempts, newStatus, priorAttempts, maxRetries);
    }

    public ErrorRecord withAttempt(RecoveryAttempt attempt, RecoveryStatus newStatus) {
        List<RecoveryAttempt> next = new ArrayList<>(attempts);
        next.add(attempt);
        return new ErrorRecord(errorId, applicationId, timestamp, errorType, message, severity, category,
                context, plannedActions, next, newStatus, priorAttempts, maxRetries);
    }

    /**
     * Attempt-consuming recoveries already run for this record.
     */
    public int consumedAttempts() {
        int n = 0;
        for (RecoveryAttempt attempt : attempts) {
            if (attempt.action().consumesAttempt()) {
                n++;
            }
        }
        return n;
    }

    public boolean retryBudgetExhausted() {
        return priorAttempts + consumedAttempts() >= maxRetries;
    }

    public String contextValue(String key) {
        Object value = context.get(key);
        return value == null ? null : value.toString();
    }
}
