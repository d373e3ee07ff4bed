package com.linlay.agentchat.event;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Maps raw SDK payloads onto {@link SessionEvent}. Every vendor-specific key spelling is resolved here so
 * nothing past this boundary needs to know which SDK emitted an event.
 */
@Component
public class SessionEventNormalizer {

    private static final Logger log = LoggerFactory.getLogger(SessionEventNormalizer.class);

    private static final String[] TOOL_CALL_ID_KEYS =
            {"toolCallId", "toolUseId", "toolUseID", "tool_use_id", "callID", "callId", "sdkCorrelationId"};
    private static final String[] TOOL_NAME_KEYS = {"toolName", "tool", "name"};
    private static final String[] TOOL_INPUT_KEYS = {"toolInput", "input", "args", "arguments"};
    private static final String[] PARENT_AGENT_KEYS = {"parentAgentId", "parentToolCallId", "parentToolUseId"};
    private static final String[] SUBAGENT_ID_KEYS = {"subagentId", "agentId", "id"};
    private static final String[] SUBAGENT_TYPE_KEYS = {"subagentType", "subagent_type", "agentType", "agentName"};
    private static final String[] TASK_KEYS = {"task", "description", "prompt"};
    private static final String[] BACKGROUND_KEYS = {"runInBackground", "run_in_background", "background", "isAsync"};
    private static final String[] RESULT_KEYS = {"result", "output", "toolResult"};
    private static final String[] ERROR_KEYS = {"error", "errorMessage"};
    private static final String[] DELTA_KEYS = {"delta", "text", "content"};
    private static final String[] MESSAGE_ID_KEYS = {"messageId", "id"};
    private static final String[] REQUEST_ID_KEYS = {"requestId", "permissionId", "id"};

    private final ObjectMapper objectMapper;

    public SessionEventNormalizer(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<SessionEvent> normalize(RawSessionEvent raw) {
        if (raw == null) {
            return Optional.empty();
        }
        SessionEventType type = SessionEventType.fromWireName(raw.type());
        if (type == null) {
            log.debug("Ignore unsupported session event type={}", raw.type());
            return Optional.empty();
        }
        Map<String, Object> data = raw.data();
        String sessionId = raw.sessionId();
        long timestamp = raw.timestamp();
        try {
            SessionEvent event = switch (type) {
                case SESSION_START -> new SessionEvent.SessionStarted(sessionId, timestamp);
                case SESSION_IDLE -> new SessionEvent.SessionIdle(sessionId, timestamp, stringValue(data, "reason"));
                case SESSION_ERROR -> new SessionEvent.SessionErrored(
                        sessionId, timestamp, stringify(firstPresent(data, ERROR_KEYS)));
                case MESSAGE_DELTA -> new SessionEvent.MessageDelta(
                        sessionId, timestamp, stringValue(data, MESSAGE_ID_KEYS), rawText(data, DELTA_KEYS));
                case MESSAGE_COMPLETE -> new SessionEvent.MessageCompleted(
                        sessionId, timestamp, stringValue(data, MESSAGE_ID_KEYS));
                case TOOL_START -> new SessionEvent.ToolStarted(
                        sessionId,
                        timestamp,
                        stringValue(data, TOOL_CALL_ID_KEYS),
                        stringValue(data, TOOL_NAME_KEYS),
                        mapValue(data, TOOL_INPUT_KEYS),
                        stringValue(data, PARENT_AGENT_KEYS),
                        longValue(data, "runId")
                );
                case TOOL_COMPLETE -> new SessionEvent.ToolCompleted(
                        sessionId,
                        timestamp,
                        stringValue(data, TOOL_CALL_ID_KEYS),
                        stringValue(data, TOOL_NAME_KEYS),
                        booleanValue(data, true, "success"),
                        stringify(firstPresent(data, RESULT_KEYS)),
                        stringify(firstPresent(data, ERROR_KEYS)),
                        stringValue(data, PARENT_AGENT_KEYS),
                        longValue(data, "runId")
                );
                case SUBAGENT_START -> new SessionEvent.SubagentStarted(
                        sessionId,
                        timestamp,
                        stringValue(data, SUBAGENT_ID_KEYS),
                        stringValue(data, SUBAGENT_TYPE_KEYS),
                        stringValue(data, TASK_KEYS),
                        stringValue(data, TOOL_CALL_ID_KEYS),
                        booleanValue(data, false, BACKGROUND_KEYS)
                );
                case SUBAGENT_COMPLETE -> new SessionEvent.SubagentCompleted(
                        sessionId,
                        timestamp,
                        stringValue(data, SUBAGENT_ID_KEYS),
                        booleanValue(data, true, "success"),
                        stringify(firstPresent(data, RESULT_KEYS)),
                        stringify(firstPresent(data, ERROR_KEYS))
                );
                case PERMISSION_REQUESTED -> new SessionEvent.PermissionRequested(
                        sessionId, timestamp, stringValue(data, REQUEST_ID_KEYS), stringValue(data, TOOL_NAME_KEYS));
            };
            return Optional.of(event);
        } catch (IllegalArgumentException ex) {
            log.warn("Drop malformed session event type={}, sessionId={}: {}", raw.type(), sessionId, ex.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Reads the sub-agent invocation carried by a Task tool input.
     */
    public TaskInvocation taskInvocation(Map<String, Object> input) {
        Map<String, Object> safeInput = input == null ? Map.of() : input;
        return new TaskInvocation(
                stringValue(safeInput, SUBAGENT_TYPE_KEYS),
                stringValue(safeInput, TASK_KEYS),
                booleanValue(safeInput, false, BACKGROUND_KEYS)
        );
    }

    private String stringify(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof String text) {
            return text;
        }
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException ex) {
            return String.valueOf(value);
        }
    }

    static Object firstPresent(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    static String stringValue(Map<String, Object> data, String... keys) {
        for (String key : keys) {
            Object value = data.get(key);
            if (value instanceof String text && !text.isBlank()) {
                return text.trim();
            }
            if (value instanceof Number number) {
                return number.toString();
            }
        }
        return null;
    }

    static boolean booleanValue(Map<String, Object> data, boolean fallback, String... keys) {
        Object value = firstPresent(data, keys);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && !text.isBlank()) {
            return Boolean.parseBoolean(text.trim());
        }
        return fallback;
    }

    static Long longValue(Map<String, Object> data, String... keys) {
        Object value = firstPresent(data, keys);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof String text && !text.isBlank()) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    static Map<String, Object> mapValue(Map<String, Object> data, String... keys) {
        Object value = firstPresent(data, keys);
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((key, item) -> copy.put(String.valueOf(key), item));
            return copy;
        }
        return Map.of();
    }

    private static String rawText(Map<String, Object> data, String... keys) {
        Object value = firstPresent(data, keys);
        return value instanceof String text ? text : "";
    }

    public record TaskInvocation(String subagentType, String description, boolean background) {
    }
}
