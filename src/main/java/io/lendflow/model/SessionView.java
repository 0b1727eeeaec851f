package io.lendflow.model;

import java.time.Instant;

public record SessionView(
        String sessionId,
        String patternName,
        String applicationId,
        String initiator,
        SessionStatus status,
        String currentStep,
        int currentStepIndex,
        int totalSteps,
        String progress,
        int completedSteps,
        int failedSteps,
        int messageCount,
        Instant startTime,
        Instant endTime
) {
}
