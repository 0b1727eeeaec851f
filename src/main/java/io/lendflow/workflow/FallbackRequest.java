package io.lendflow.workflow;

import io.lendflow.pattern.StepDefinition;
import io.lendflow.recovery.ErrorRecord;

import java.util.Map;

/**
 * Input to a {@link FallbackHandler}. {@code context} is the live session context;
 * handlers may write into it.
 */
public record FallbackRequest(
        String sessionId,
        String applicationId,
        StepDefinition step,
        Map<String, Object> context,
        ErrorRecord error
) {
}
