package io.lendflow.state;

import io.lendflow.model.ApplicationState;

import java.time.Instant;

/**
 * One entry of an application's lifecycle history; {@code from} is null for the
 * entry created at intake.
 */
public record StateTransition(
        ApplicationState from,
        ApplicationState to,
        String reason,
        Instant timestamp
) {
}
