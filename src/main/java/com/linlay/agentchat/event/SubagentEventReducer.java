package com.linlay.agentchat.event;

import com.linlay.agentchat.agent.AgentLifecycleStore;
import com.linlay.agentchat.agent.ParallelAgent;
import com.linlay.agentchat.stream.ToolBlockingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Applies tool and sub-agent events to the {@link AgentLifecycleStore}.
 * <p>
 * A Task tool start creates an eager placeholder row keyed by its tool call id and leaves a pending entry
 * until the runtime reports the sub-agent itself. Events of other sessions or of an earlier run are dropped
 * through {@link CorrelationGuard}.
 */
@Component
public class SubagentEventReducer {

    private static final Logger log = LoggerFactory.getLogger(SubagentEventReducer.class);

    private final SessionEventNormalizer normalizer;
    private final CorrelationGuard guard;
    private final AgentLifecycleStore store;
    private final Clock clock;

    private final Map<String, SessionEventNormalizer.TaskInvocation> pendingTaskCalls = new LinkedHashMap<>();
    private final Set<String> taskToolCalls = new LinkedHashSet<>();
    private final Map<String, Long> toolCallRuns = new HashMap<>();
    private final Set<String> runningAskQuestionTools = new LinkedHashSet<>();

    private String activeSessionId;
    private Long activeRunId;
    private long runSequence;

    public SubagentEventReducer(
            SessionEventNormalizer normalizer,
            CorrelationGuard guard,
            AgentLifecycleStore store,
            Clock clock
    ) {
        this.normalizer = Objects.requireNonNull(normalizer, "normalizer must not be null");
        this.guard = Objects.requireNonNull(guard, "guard must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    public synchronized void setActiveSessionId(String sessionId) {
        this.activeSessionId = StringUtils.hasText(sessionId) ? sessionId.trim() : null;
    }

    public synchronized String activeSessionId() {
        return activeSessionId;
    }

    /**
     * Opens a new run. Tool events tagged with an earlier run are rejected from now on.
     */
    public synchronized long beginRun() {
        activeRunId = ++runSequence;
        pendingTaskCalls.clear();
        taskToolCalls.clear();
        toolCallRuns.clear();
        runningAskQuestionTools.clear();
        return activeRunId;
    }

    public synchronized void endRun() {
        activeRunId = null;
        toolCallRuns.clear();
        runningAskQuestionTools.clear();
    }

    public synchronized Long activeRunId() {
        return activeRunId;
    }

    public synchronized boolean hasPendingTaskCalls() {
        return !pendingTaskCalls.isEmpty();
    }

    public synchronized int runningAskQuestionTools() {
        return runningAskQuestionTools.size();
    }

    /**
     * True once no agent is active and no Task call waits for its sub-agent.
     */
    public synchronized boolean isRunSettled() {
        return guard.shouldFinalizeRun(store.hasActiveAgents(), !pendingTaskCalls.isEmpty());
    }

    /**
     * @return true when the event changed tracked state
     */
    public synchronized boolean reduce(SessionEvent event) {
        if (event instanceof SessionEvent.ToolStarted toolStarted) {
            return onToolStarted(toolStarted);
        }
        if (event instanceof SessionEvent.ToolCompleted toolCompleted) {
            return onToolCompleted(toolCompleted);
        }
        if (event instanceof SessionEvent.SubagentStarted subagentStarted) {
            return onSubagentStarted(subagentStarted);
        }
        if (event instanceof SessionEvent.SubagentCompleted subagentCompleted) {
            return onSubagentCompleted(subagentCompleted);
        }
        return false;
    }

    private boolean onToolStarted(SessionEvent.ToolStarted event) {
        boolean owned = isOwned(event.sessionId());
        if (!guard.acceptsToolStart(owned, activeRunId, store.streamState().isStreaming(), event.runId())) {
            log.debug("Drop tool.start toolCallId={}, sessionId={}, runId={}",
                    event.toolCallId(), event.sessionId(), event.runId());
            return false;
        }
        String toolCallId = event.toolCallId();
        if (toolCallId != null) {
            toolCallRuns.put(toolCallId, activeRunId);
            if (ToolBlockingPolicy.isAskQuestionTool(event.toolName())) {
                runningAskQuestionTools.add(toolCallId);
            }
        }
        store.toolStarted(toolCallId, event.toolName());
        if (StringUtils.hasText(event.parentAgentId())) {
            store.recordToolUse(event.parentAgentId(), event.toolName());
        }
        if (toolCallId != null && ToolBlockingPolicy.isTaskTool(event.toolName())) {
            SessionEventNormalizer.TaskInvocation invocation = normalizer.taskInvocation(event.input());
            pendingTaskCalls.put(toolCallId, invocation);
            taskToolCalls.add(toolCallId);
            String name = StringUtils.hasText(invocation.subagentType()) ? invocation.subagentType() : event.toolName();
            store.startAgent(ParallelAgent.placeholder(
                    toolCallId,
                    name,
                    invocation.description(),
                    invocation.background(),
                    startedAt(event.timestamp())
            ));
        }
        return true;
    }

    private boolean onToolCompleted(SessionEvent.ToolCompleted event) {
        String toolCallId = event.toolCallId();
        Long eventRunId = toolCallId == null ? null : toolCallRuns.get(toolCallId);
        boolean owned = isOwned(event.sessionId());
        if (!guard.acceptsToolComplete(owned, activeRunId, store.streamState().isStreaming(), event.runId(), eventRunId)) {
            log.debug("Drop tool.complete toolCallId={}, sessionId={}, runId={}",
                    toolCallId, event.sessionId(), event.runId());
            return false;
        }
        toolCallRuns.remove(toolCallId);
        runningAskQuestionTools.remove(toolCallId);
        store.toolCompleted(toolCallId);
        if (taskToolCalls.remove(toolCallId) || ToolBlockingPolicy.isTaskTool(event.toolName())) {
            pendingTaskCalls.remove(toolCallId);
            store.completeTaskTool(toolCallId, event.success() ? event.result() : event.error());
        }
        return true;
    }

    private boolean onSubagentStarted(SessionEvent.SubagentStarted event) {
        String toolCallId = event.toolCallId();
        boolean pendingEntry = toolCallId == null
                ? !pendingTaskCalls.isEmpty()
                : pendingTaskCalls.containsKey(toolCallId);
        boolean sdkMatch = toolCallId != null
                && (toolCallRuns.containsKey(toolCallId) || store.findAgent(toolCallId) != null);
        CorrelationSignals signals = new CorrelationSignals(isOwned(event.sessionId()), pendingEntry, sdkMatch);
        if (!guard.admits(signals)) {
            log.debug("Drop subagent.start subagentId={}, sessionId={}", event.subagentId(), event.sessionId());
            return false;
        }

        SessionEventNormalizer.TaskInvocation invocation = toolCallId == null ? null : pendingTaskCalls.remove(toolCallId);
        String name = event.subagentType();
        String task = event.task();
        boolean background = event.background();
        if (invocation != null) {
            name = StringUtils.hasText(name) ? name : invocation.subagentType();
            task = StringUtils.hasText(task) ? task : invocation.description();
            background = background || invocation.background();
        }
        store.startAgent(ParallelAgent.started(
                event.subagentId(),
                toolCallId,
                name,
                task,
                background,
                startedAt(event.timestamp())
        ));
        log.debug("Sub-agent started id={}, toolCallId={}, background={}", event.subagentId(), toolCallId, background);
        return true;
    }

    private boolean onSubagentCompleted(SessionEvent.SubagentCompleted event) {
        boolean known = store.findAgent(event.subagentId()) != null;
        CorrelationSignals signals = new CorrelationSignals(isOwned(event.sessionId()), false, known);
        if (!guard.admits(signals)) {
            log.debug("Drop subagent.complete subagentId={}, sessionId={}", event.subagentId(), event.sessionId());
            return false;
        }
        return store.completeAgent(event.subagentId(), event.success(), event.result(), event.error());
    }

    private boolean isOwned(String sessionId) {
        return activeSessionId != null && activeSessionId.equals(sessionId);
    }

    private String startedAt(long timestamp) {
        return (timestamp > 0 ? Instant.ofEpochMilli(timestamp) : clock.instant()).toString();
    }
}
