package com.linlay.agentchat.agent;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum AgentStatus {
    PENDING,
    RUNNING,
    BACKGROUND,
    COMPLETED,
    ERROR,
    INTERRUPTED;

    public boolean isActive() {
        return this == PENDING || this == RUNNING || this == BACKGROUND;
    }

    public boolean isTerminal() {
        return !isActive();
    }

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static AgentStatus fromJson(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        return switch (normalized) {
            case "PENDING" -> PENDING;
            case "RUNNING" -> RUNNING;
            case "BACKGROUND" -> BACKGROUND;
            case "COMPLETED" -> COMPLETED;
            case "ERROR" -> ERROR;
            case "INTERRUPTED" -> INTERRUPTED;
            default -> throw new IllegalArgumentException("Unknown AgentStatus: " + raw);
        };
    }
}
