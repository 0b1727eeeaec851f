package io.lendflow.recovery;

public enum RecoveryAction {
    RETRY("retry", true),
    FALLBACK("fallback", false),
    REVERT("revert", true),
    RESTART("restart", true),
    ALTERNATE("alternate", true),
    DIAGNOSTIC("diagnostic", false),
    ESCALATE("escalate", false),
    SUSPEND("suspend", false),
    IGNORE("ignore", false);

    private final String wireName;
    private final boolean consumesAttempt;

    RecoveryAction(String wireName, boolean consumesAttempt) {
        this.wireName = wireName;
        this.consumesAttempt = consumesAttempt;
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Actions that run the failed work again count against the step's retry budget.
     */
    public boolean consumesAttempt() {
        return consumesAttempt;
    }

    public static RecoveryAction fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Recovery action must not be blank");
        }
        for (RecoveryAction value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown recovery action: " + raw);
    }
}
