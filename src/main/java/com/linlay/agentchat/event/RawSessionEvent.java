package com.linlay.agentchat.event;

import java.util.Map;

/**
 * Event envelope as produced by one of the SDK clients, before normalization.
 */
public record RawSessionEvent(
        String type,
        String sessionId,
        long timestamp,
        Map<String, Object> data
) {

    public RawSessionEvent {
        if (type == null || type.isBlank()) {
            throw new IllegalArgumentException("type must not be null or blank");
        }
        if (timestamp < 0) {
            throw new IllegalArgumentException("timestamp must not be negative");
        }
        if (data == null) {
            data = Map.of();
        }
    }
}
