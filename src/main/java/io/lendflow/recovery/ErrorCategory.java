package io.lendflow.recovery;

public enum ErrorCategory {
    VALIDATION("validation"),
    DOCUMENT_PROCESSING("document_processing"),
    AGENT_FAILURE("agent_failure"),
    COMMUNICATION("communication"),
    SECURITY("security"),
    SYSTEM("system"),
    INTEGRATION("integration"),
    DATA("data"),
    UNKNOWN("unknown");

    private final String wireName;

    ErrorCategory(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ErrorCategory fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("ErrorCategory must not be blank");
        }
        for (ErrorCategory value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ErrorCategory: " + raw);
    }
}
