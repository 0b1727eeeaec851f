package io.lendflow.recovery;

public enum RecoveryStatus {
    DETECTED("detected"),
    RECOVERY_PLANNED("recovery_planned"),
    RECOVERY_IN_PROGRESS("recovery_in_progress"),
    RECOVERY_SUCCESSFUL("recovery_successful"),
    RECOVERY_FAILED("recovery_failed"),
    RECOVERY_ERROR("recovery_error");

    private final String wireName;

    RecoveryStatus(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static RecoveryStatus fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("RecoveryStatus must not be blank");
        }
        for (RecoveryStatus value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown RecoveryStatus: " + raw);
    }
}
