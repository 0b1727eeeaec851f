package io.lendflow.recovery;

import java.time.Instant;

public record RecoveryAttempt(
        RecoveryAction action,
        RecoveryAction requestedAction,
        Instant timestamp,
        AttemptResult result,
        String detail
) {
}
