package io.lendflow.recovery;

public enum AttemptResult {
    SUCCESS("success"),
    FAILURE("failure"),
    ERROR("error");

    private final String wireName;

    AttemptResult(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static AttemptResult fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("AttemptResult must not be blank");
        }
        for (AttemptResult value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown AttemptResult: " + raw);
    }
}
