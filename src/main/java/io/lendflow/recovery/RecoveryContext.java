package io.lendflow.recovery;

import java.util.List;

/**
 * Caller-supplied recovery parameters. An empty {@code plannedActions} lets the
 * manager derive the plan from the record's category and severity.
 */
public record RecoveryContext(
        RecoveryTarget target,
        int maxRetries,
        int priorAttempts,
        List<RecoveryAction> plannedActions
) {
    public RecoveryContext {
        plannedActions = plannedActions == null ? List.of() : List.copyOf(plannedActions);
        if (maxRetries < 0 || priorAttempts < 0) {
            throw new IllegalArgumentException("maxRetries and priorAttempts must be >= 0");
        }
    }
}
