package io.lendflow.observability;

import java.util.Set;

public record AuditPolicy(
        boolean logAllEvents,
        Set<String> sensitiveEvents,
        int retentionDays
) {
    public static final int DEFAULT_RETENTION_DAYS = 90;
    public static final Set<String> DEFAULT_SENSITIVE_EVENTS = Set.of(
            "application_access", "decision", "security_event", "state_transition"
    );

    public AuditPolicy {
        sensitiveEvents = sensitiveEvents == null ? Set.of() : Set.copyOf(sensitiveEvents);
        if (retentionDays <= 0) {
            throw new IllegalArgumentException("retentionDays must be positive");
        }
    }

    public static AuditPolicy defaults() {
        return new AuditPolicy(true, DEFAULT_SENSITIVE_EVENTS, DEFAULT_RETENTION_DAYS);
    }

    public boolean records(String eventType) {
        return logAllEvents || sensitiveEvents.contains(eventType);
    }
}
