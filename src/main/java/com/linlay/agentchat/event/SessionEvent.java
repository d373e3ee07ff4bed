package com.linlay.agentchat.event;

import java.util.Map;

/**
 * Closed set of events consumed by the session core, independent of the SDK that produced them.
 */
public sealed interface SessionEvent permits
        SessionEvent.SessionStarted,
        SessionEvent.SessionIdle,
        SessionEvent.SessionErrored,
        SessionEvent.MessageDelta,
        SessionEvent.MessageCompleted,
        SessionEvent.ToolStarted,
        SessionEvent.ToolCompleted,
        SessionEvent.SubagentStarted,
        SessionEvent.SubagentCompleted,
        SessionEvent.PermissionRequested {

    String sessionId();

    long timestamp();

    record SessionStarted(String sessionId, long timestamp) implements SessionEvent {
    }

    record SessionIdle(String sessionId, long timestamp, String reason) implements SessionEvent {
    }

    record SessionErrored(String sessionId, long timestamp, String message) implements SessionEvent {
    }

    record MessageDelta(String sessionId, long timestamp, String messageId, String delta) implements SessionEvent {
        public MessageDelta {
            requireNonNull(delta, "delta");
        }
    }

    record MessageCompleted(String sessionId, long timestamp, String messageId) implements SessionEvent {
    }

    /**
     * @param parentAgentId set when the tool runs inside a sub-agent rather than the primary stream
     * @param runId         run tag attached by the SDK client, when it tracks runs
     */
    record ToolStarted(
            String sessionId,
            long timestamp,
            String toolCallId,
            String toolName,
            Map<String, Object> input,
            String parentAgentId,
            Long runId
    ) implements SessionEvent {
        public ToolStarted {
            requireNonBlank(toolName, "toolName");
            input = input == null ? Map.of() : input;
        }
    }

    record ToolCompleted(
            String sessionId,
            long timestamp,
            String toolCallId,
            String toolName,
            boolean success,
            String result,
            String error,
            String parentAgentId,
            Long runId
    ) implements SessionEvent {
    }

    record SubagentStarted(
            String sessionId,
            long timestamp,
            String subagentId,
            String subagentType,
            String task,
            String toolCallId,
            boolean background
    ) implements SessionEvent {
        public SubagentStarted {
            requireNonBlank(subagentId, "subagentId");
        }
    }

    record SubagentCompleted(
            String sessionId,
            long timestamp,
            String subagentId,
            boolean success,
            String result,
            String error
    ) implements SessionEvent {
        public SubagentCompleted {
            requireNonBlank(subagentId, "subagentId");
        }
    }

    record PermissionRequested(
            String sessionId,
            long timestamp,
            String requestId,
            String toolName
    ) implements SessionEvent {
    }

    private static void requireNonBlank(String value, String fieldName) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException(fieldName + " must not be null or blank");
        }
    }

    private static void requireNonNull(Object value, String fieldName) {
        if (value == null) {
            throw new IllegalArgumentException(fieldName + " must not be null");
        }
    }
}
