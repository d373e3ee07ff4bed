package com.linlay.agentchat.agent;

import com.linlay.agentchat.stream.StreamControlState;
import com.linlay.agentchat.stream.StreamGeneration;
import com.linlay.agentchat.stream.ToolBlockingPolicy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.Executor;

/**
 * Live sub-agent rows and primary stream control state of the current session.
 * <p>
 * Single owner: every mutation runs through this class, and each one re-applies
 * {@link AgentDeduplicator#dedupe(List)} so readers always see canonical rows. Deferred stream
 * completions are tagged with the stream generation and handed to the event loop only once no
 * foreground agent is active and no blocking tool runs.
 */
@Component
public class AgentLifecycleStore {

    private static final Logger log = LoggerFactory.getLogger(AgentLifecycleStore.class);

    private final AgentDeduplicator deduplicator;
    private final Executor eventLoop;
    private final Clock clock;
    private final StreamGeneration generation = new StreamGeneration();
    private final Set<String> runningBlockingTools = new LinkedHashSet<>();

    private List<ParallelAgent> agents = List.of();
    private StreamControlState streamState = StreamControlState.idle();
    private Runnable pendingCompletion;

    public AgentLifecycleStore(
            AgentDeduplicator deduplicator,
            @Qualifier("agentEventLoop") Executor eventLoop,
            Clock clock
    ) {
        this.deduplicator = Objects.requireNonNull(deduplicator, "deduplicator must not be null");
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    // ========= Stream =========

    /**
     * Starts a turn and returns the generation its callbacks must carry. Rows left from the previous turn
     * are dropped except background agents that are still running.
     */
    public synchronized long startStream(String messageId, boolean agentOnlyStream) {
        streamState = streamState.start(messageId, clock.millis(), agentOnlyStream);
        pendingCompletion = null;
        runningBlockingTools.clear();
        agents = AgentTransitions.activeBackground(agents);
        log.debug("Stream started messageId={}, generation={}", messageId, generation.current());
        return generation.current();
    }

    /**
     * Ends the turn normally. Foreground agents still running are completed; the returned snapshot is the
     * one to bake into the finished message.
     */
    public synchronized List<ParallelAgent> finishStream() {
        agents = AgentTransitions.finalizeForeground(agents, clock.millis());
        streamState = streamState.stop(false);
        pendingCompletion = null;
        runningBlockingTools.clear();
        return agents;
    }

    /**
     * Stops the stream right away and invalidates every callback scheduled during the turn. The streaming
     * start is kept for the elapsed-time display.
     *
     * @return the new generation
     */
    public synchronized long cancelStream() {
        streamState = streamState.stop(true);
        pendingCompletion = null;
        runningBlockingTools.clear();
        agents = AgentTransitions.interruptForeground(agents, clock.millis());
        long next = generation.invalidate();
        log.debug("Stream cancelled, generation now {}", next);
        return next;
    }

    /**
     * Queues the stream-complete continuation. It runs on the event loop as soon as no foreground agent is
     * running or pending and no blocking tool is in flight, and never if the turn is cancelled first.
     */
    public synchronized void deferCompletion(Runnable continuation) {
        Objects.requireNonNull(continuation, "continuation must not be null");
        Runnable guarded = generation.guard(continuation);
        if (AgentTransitions.shouldFinalizeDeferredStream(agents, streamState.hasRunningTool())) {
            eventLoop.execute(guarded);
            return;
        }
        pendingCompletion = guarded;
        streamState = streamState.withPendingCompletion(true);
    }

    public synchronized void markStreamingMeta() {
        streamState = streamState.withStreamingMeta(true);
    }

    public synchronized void toolStarted(String toolCallId, String toolName) {
        if (toolCallId == null || !ToolBlockingPolicy.isBlocking(toolName)) {
            return;
        }
        runningBlockingTools.add(toolCallId);
        streamState = streamState.withRunningTool(true);
    }

    public synchronized void toolCompleted(String toolCallId) {
        if (toolCallId == null || !runningBlockingTools.remove(toolCallId)) {
            return;
        }
        streamState = streamState.withRunningTool(!runningBlockingTools.isEmpty());
        releaseDeferredCompletion();
    }

    // ========= Agents =========

    public synchronized void startAgent(ParallelAgent started) {
        agents = deduplicator.dedupe(AgentTransitions.start(agents, started));
    }

    public synchronized void updateAgentProgress(String agentId, String currentTool, Integer toolUses) {
        agents = AgentTransitions.progress(agents, agentId, currentTool, toolUses);
    }

    public synchronized boolean recordToolUse(String agentKey, String toolName) {
        ParallelAgent target = AgentTransitions.findByIdOrCorrelation(agents, agentKey);
        if (target == null) {
            return false;
        }
        agents = AgentTransitions.toolUsed(agents, target.id(), toolName);
        return true;
    }

    public synchronized boolean completeAgent(String agentId, boolean success, String result, String error) {
        ParallelAgent target = AgentTransitions.findById(agents, agentId);
        if (target == null) {
            return false;
        }
        agents = AgentTransitions.complete(agents, agentId, success, result, error, clock.millis());
        releaseDeferredCompletion();
        return true;
    }

    public synchronized void completeTaskTool(String toolCallId, String result) {
        agents = AgentTransitions.taskToolCompleted(agents, toolCallId, result, clock.millis());
        releaseDeferredCompletion();
    }

    /**
     * Interrupts the background agents active right now. Rows changed by events since any earlier read
     * are kept as they are.
     */
    public synchronized AgentTransitions.InterruptResult interruptActiveBackground() {
        AgentTransitions.InterruptResult result = AgentTransitions.interruptActiveBackground(agents, clock.millis());
        agents = deduplicator.dedupe(result.agents());
        releaseDeferredCompletion();
        return new AgentTransitions.InterruptResult(agents, result.interruptedIds());
    }

    public synchronized void reset() {
        agents = List.of();
        streamState = StreamControlState.idle();
        pendingCompletion = null;
        runningBlockingTools.clear();
        generation.invalidate();
    }

    // ========= Views =========

    public synchronized List<ParallelAgent> agents() {
        return agents;
    }

    public synchronized StreamControlState streamState() {
        return streamState;
    }

    public synchronized List<ParallelAgent> foregroundAgents() {
        return AgentTransitions.foregroundView(agents, deduplicator);
    }

    public synchronized List<ParallelAgent> activeBackgroundAgents() {
        return AgentTransitions.activeBackground(agents);
    }

    /**
     * Looks a row up by id, falling back to its correlation id.
     */
    public synchronized ParallelAgent findAgent(String key) {
        return AgentTransitions.findByIdOrCorrelation(agents, key);
    }

    public synchronized boolean hasActiveAgents() {
        return AgentTransitions.hasActiveAgents(agents);
    }

    public long currentGeneration() {
        return generation.current();
    }

    public boolean isCurrentGeneration(long callbackGeneration) {
        return generation.isCurrent(callbackGeneration);
    }

    public Runnable guardCurrentGeneration(Runnable callback) {
        return generation.guard(callback);
    }

    private void releaseDeferredCompletion() {
        if (pendingCompletion == null
                || !AgentTransitions.shouldFinalizeDeferredStream(agents, streamState.hasRunningTool())) {
            return;
        }
        Runnable continuation = pendingCompletion;
        pendingCompletion = null;
        streamState = streamState.withPendingCompletion(false);
        eventLoop.execute(continuation);
    }
}
