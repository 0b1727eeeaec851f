package io.lendflow.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record AgentMessage(
        String messageId,
        String sender,
        String recipient,
        Instant timestamp,
        MessageType type,
        Map<String, Object> content,
        String sessionId,
        String inResponseTo,
        Priority priority
) {
    public AgentMessage {
        content = content == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(content));
        priority = priority == null ? Priority.MEDIUM : priority;
    }
}
