package io.lendflow.recovery;

public enum ErrorSeverity {
    LOW("low"),
    MEDIUM("medium"),
    HIGH("high"),
    CRITICAL("critical");

    private final String wireName;

    ErrorSeverity(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static ErrorSeverity fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("ErrorSeverity must not be blank");
        }
        for (ErrorSeverity value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown ErrorSeverity: " + raw);
    }
}
