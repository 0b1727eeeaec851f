package io.lendflow.model;

public enum MessageType {
    REQUEST("request"),
    RESPONSE("response"),
    NOTIFICATION("notification"),
    ERROR("error"),
    DECISION("decision");

    private final String wireName;

    MessageType(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static MessageType fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            throw new IllegalArgumentException("Message type must not be blank");
        }
        for (MessageType value : values()) {
            if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown message type: " + raw);
    }
}
