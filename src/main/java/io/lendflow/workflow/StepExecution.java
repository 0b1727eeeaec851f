package io.lendflow.workflow;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One run of one step. {@code executionId} increases by one per run within a session.
 */
public record StepExecution(
        long executionId,
        String stepName,
        String agentId,
        Map<String, Object> inputs,
        Instant startTime,
        Instant endTime,
        int attempt,
        Status status,
        String error
) {
    public StepExecution {
        inputs = inputs == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(inputs));
    }

    public enum Status {
        COMPLETED,
        FAILED,
        SKIPPED
    }
}
