package io.lendflow.observability;

import java.time.LocalDate;
import java.util.Set;

/**
 * Search filters for {@link AuditLog#search(AuditQuery)}. Every non-null filter must
 * match; dates bound the scanned segments inclusively.
 */
public record AuditQuery(
        LocalDate startDate,
        LocalDate endDate,
        Set<String> eventTypes,
        String userId,
        String agentId,
        String resourceId,
        String action
) {
    public AuditQuery {
        eventTypes = eventTypes == null ? Set.of() : Set.copyOf(eventTypes);
    }

    public static AuditQuery all() {
        return new AuditQuery(null, null, Set.of(), null, null, null, null);
    }

    public AuditQuery between(LocalDate start, LocalDate end) {
        return new AuditQuery(start, end, eventTypes, userId, agentId, resourceId, action);
    }

    public AuditQuery withEventTypes(Set<String> types) {
        return new AuditQuery(startDate, endDate, types, userId, agentId, resourceId, action);
    }

    public AuditQuery withUserId(String value) {
        return new AuditQuery(startDate, endDate, eventTypes, value, agentId, resourceId, action);
    }

    public AuditQuery withAgentId(String value) {
        return new AuditQuery(startDate, endDate, eventTypes, userId, value, resourceId, action);
    }

    public AuditQuery withResourceId(String value) {
        return new AuditQuery(startDate, endDate, eventTypes, userId, agentId, value, action);
    }

    public AuditQuery withAction(String value) {
        return new AuditQuery(startDate, endDate, eventTypes, userId, agentId, resourceId, value);
    }

    boolean coversDay(LocalDate day) {
        return (startDate == null || !day.isBefore(startDate)) && (endDate == null || !day.isAfter(endDate));
    }

    boolean matches(AuditEntry entry) {
        if (!eventTypes.isEmpty() && !eventTypes.contains(entry.eventType())) {
            return false;
        }
        if (userId != null && !userId.equals(entry.userId())) {
            return false;
        }
        if (agentId != null && !agentId.equals(entry.agentId())) {
            return false;
        }
        if (resourceId != null && !resourceId.equals(entry.resourceId())) {
            return false;
        }
        return action == null || action.equals(entry.action());
    }
}
