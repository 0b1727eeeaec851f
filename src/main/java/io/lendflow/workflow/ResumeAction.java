package io.lendflow.workflow;

import java.util.Locale;

public enum ResumeAction {
    CONTINUE,
    RETRY,
    ABORT,
    SKIP;

    public static ResumeAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return CONTINUE;
        }
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown resume action: " + raw, e);
        }
    }
}
