package com.linlay.agentchat.agent;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One sub-agent row as tracked during a turn.
 * <p>
 * The legacy dual background signal is folded into {@link #background()} when the record is built:
 * a {@link AgentStatus#BACKGROUND} status always yields {@code background == true}, so callers only
 * ever consult the flag to tell foreground from background agents.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ParallelAgent(
        String id,
        String correlationId,
        String name,
        String task,
        AgentStatus status,
        boolean background,
        String startedAt,
        Long durationMs,
        String currentTool,
        Integer toolUses,
        String result,
        String error
) {

    public static final String PLACEHOLDER_TASK = "Sub-agent task";

    private static final Set<String> GENERIC_TASKS = Set.of("", "sub-agent task", "subagent task");

    public ParallelAgent {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("id must not be null or blank");
        }
        if (status == null) {
            status = AgentStatus.PENDING;
        }
        if (status == AgentStatus.BACKGROUND) {
            background = true;
        }
        if (correlationId != null && correlationId.isBlank()) {
            correlationId = null;
        }
        name = name == null ? "" : name;
        task = task == null ? "" : task;
    }

    /**
     * Eager row created from a Task tool call before the SDK reports the sub-agent itself.
     */
    public static ParallelAgent placeholder(
            String toolCallId,
            String name,
            String task,
            boolean background,
            String startedAt
    ) {
        String resolvedTask = task == null || task.isBlank() ? PLACEHOLDER_TASK : task;
        return new ParallelAgent(
                toolCallId,
                toolCallId,
                name,
                resolvedTask,
                background ? AgentStatus.BACKGROUND : AgentStatus.RUNNING,
                background,
                startedAt,
                null,
                background ? "Running " + name + " in background…" : "Starting " + name + "…",
                null,
                null,
                null
        );
    }

    public static ParallelAgent started(
            String id,
            String correlationId,
            String name,
            String task,
            boolean background,
            String startedAt
    ) {
        return new ParallelAgent(
                id,
                correlationId,
                name,
                task == null || task.isBlank() ? PLACEHOLDER_TASK : task,
                background ? AgentStatus.BACKGROUND : AgentStatus.RUNNING,
                background,
                startedAt,
                null,
                name == null || name.isBlank() ? null : "Running " + name + "…",
                null,
                null,
                null
        );
    }

    @JsonIgnore
    public boolean isActive() {
        return status.isActive();
    }

    @JsonIgnore
    public boolean isActiveForeground() {
        return !background && (status == AgentStatus.RUNNING || status == AgentStatus.PENDING);
    }

    @JsonIgnore
    public boolean isActiveBackground() {
        return background && status.isActive();
    }

    @JsonIgnore
    public boolean hasGenericTask() {
        return isGenericTask(task);
    }

    /**
     * Eager placeholder shape: generic task text, and keyed by its own correlation id when one is present.
     */
    @JsonIgnore
    public boolean isPlaceholderShape() {
        return hasGenericTask() && (correlationId == null || correlationId.equals(id));
    }

    @JsonIgnore
    public Long startedAtMillis() {
        return parseTimestamp(startedAt);
    }

    public ParallelAgent withStatus(AgentStatus nextStatus) {
        return new ParallelAgent(id, correlationId, name, task, nextStatus, background, startedAt,
                durationMs, currentTool, toolUses, result, error);
    }

    public ParallelAgent withCurrentTool(String nextCurrentTool) {
        return new ParallelAgent(id, correlationId, name, task, status, background, startedAt,
                durationMs, nextCurrentTool, toolUses, result, error);
    }

    public ParallelAgent withResult(String nextResult) {
        return new ParallelAgent(id, correlationId, name, task, status, background, startedAt,
                durationMs, currentTool, toolUses, nextResult, error);
    }

    public ParallelAgent withBackground(boolean nextBackground) {
        return new ParallelAgent(id, correlationId, name, task, status, nextBackground, startedAt,
                durationMs, currentTool, toolUses, result, error);
    }

    public ParallelAgent withProgress(String nextCurrentTool, Integer nextToolUses) {
        return new ParallelAgent(id, correlationId, name, task, status, background, startedAt,
                durationMs, nextCurrentTool, nextToolUses, result, error);
    }

    /**
     * Moves the record into a terminal status, clearing the current tool and measuring elapsed time.
     * An unparseable start time keeps the previously stored duration.
     */
    public ParallelAgent finish(AgentStatus terminalStatus, long nowMs, String nextResult, String nextError) {
        if (terminalStatus == null || terminalStatus.isActive()) {
            throw new IllegalArgumentException("terminal status required, got " + terminalStatus);
        }
        return new ParallelAgent(id, correlationId, name, task, terminalStatus, background, startedAt,
                elapsedSince(nowMs), null, toolUses,
                nextResult == null ? result : nextResult,
                nextError == null ? error : nextError);
    }

    public Long elapsedSince(long nowMs) {
        Long startedAtMs = startedAtMillis();
        if (startedAtMs == null) {
            return durationMs;
        }
        return Math.max(0L, nowMs - startedAtMs);
    }

    public static boolean isGenericTask(String task) {
        String normalized = task == null ? "" : task.trim().toLowerCase(Locale.ROOT);
        return GENERIC_TASKS.contains(normalized);
    }

    public static Long parseTimestamp(String raw) {
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Instant.parse(raw.trim()).toEpochMilli();
        } catch (DateTimeParseException ex) {
            return null;
        }
    }

    public boolean sameCorrelation(ParallelAgent other) {
        if (other == null) {
            return false;
        }
        if (correlationId != null && Objects.equals(correlationId, other.correlationId)) {
            return true;
        }
        return (correlationId != null && correlationId.equals(other.id))
                || (other.correlationId != null && other.correlationId.equals(id));
    }
}
