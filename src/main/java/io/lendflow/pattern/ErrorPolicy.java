package io.lendflow.pattern;

import java.util.Locale;

/**
 * What the engine does when a step fails: the first reaction, how many re-executions
 * the step is allowed, and the fallback applied once they are spent.
 */
public record ErrorPolicy(OnError onError, int maxRetries, String fallback) {
    public static final String ABORT_WORKFLOW = "abort_workflow";
    public static final String SKIP_STEP = "skip_step";
    public static final String MANUAL_INTERVENTION = "manual_intervention";
    public static final String CONSERVATIVE_ASSESSMENT = "conservative_assessment";

    public ErrorPolicy {
        if (onError == null) {
            onError = OnError.NOTIFY_ORCHESTRATOR;
        }
        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must be >= 0");
        }
        fallback = fallback == null || fallback.isBlank() ? ABORT_WORKFLOW : fallback.trim();
    }

    public static ErrorPolicy defaults(int maxRetries) {
        return new ErrorPolicy(OnError.RETRY, maxRetries, ABORT_WORKFLOW);
    }

    public enum OnError {
        RETRY("retry"),
        NOTIFY_ORCHESTRATOR("notify_orchestrator"),
        NOTIFY_HUMAN("notify_human");

        private final String wireName;

        OnError(String wireName) {
            this.wireName = wireName;
        }

        public String wireName() {
            return wireName;
        }

        public static OnError fromString(String raw) {
            if (raw == null || raw.isBlank()) {
                return NOTIFY_ORCHESTRATOR;
            }
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            for (OnError value : values()) {
                if (value.wireName.equals(normalized) || value.name().equalsIgnoreCase(normalized)) {
                    return value;
                }
            }
            throw new IllegalArgumentException("Unknown on_error value: " + raw);
        }
    }
}
