package com.linlay.agentchat.event;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum SessionEventType {
    SESSION_START("session.start"),
    SESSION_IDLE("session.idle"),
    SESSION_ERROR("session.error"),
    MESSAGE_DELTA("message.delta"),
    MESSAGE_COMPLETE("message.complete"),
    TOOL_START("tool.start"),
    TOOL_COMPLETE("tool.complete"),
    SUBAGENT_START("subagent.start"),
    SUBAGENT_COMPLETE("subagent.complete"),
    PERMISSION_REQUESTED("permission.requested");

    private final String wireName;

    SessionEventType(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Returns null for types this core does not consume.
     */
    @JsonCreator
    public static SessionEventType fromWireName(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (SessionEventType type : values()) {
            if (type.wireName.equals(normalized)) {
                return type;
            }
        }
        return null;
    }
}
