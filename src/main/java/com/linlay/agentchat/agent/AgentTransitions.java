package com.linlay.agentchat.agent;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Predicate;
import java.util.function.UnaryOperator;

/**
 * Pure status transitions over a snapshot of sub-agent rows. Every method returns a new list and never
 * mutates its input.
 */
public final class AgentTransitions {

    private AgentTransitions() {
    }

    /**
     * Registers a started agent. A row with the same id in a terminal status is left over from an earlier
     * turn and gets replaced; an active row is updated in place.
     */
    public static List<ParallelAgent> start(List<ParallelAgent> agents, ParallelAgent started) {
        Objects.requireNonNull(started, "started must not be null");
        List<ParallelAgent> current = agents == null ? List.of() : agents;
        ParallelAgent existing = findById(current, started.id());
        if (existing == null) {
            List<ParallelAgent> next = new ArrayList<>(current);
            next.add(started);
            return List.copyOf(next);
        }
        if (existing.status().isTerminal()) {
            List<ParallelAgent> next = new ArrayList<>(current.size());
            for (ParallelAgent agent : current) {
                if (!agent.id().equals(started.id())) {
                    next.add(agent);
                }
            }
            next.add(started);
            return List.copyOf(next);
        }
        ParallelAgent updated = new ParallelAgent(
                existing.id(),
                started.correlationId() != null ? started.correlationId() : existing.correlationId(),
                started.name().isBlank() ? existing.name() : started.name(),
                started.hasGenericTask() ? existing.task() : started.task(),
                started.status(),
                started.background() || existing.background(),
                existing.startedAt() != null ? existing.startedAt() : started.startedAt(),
                existing.durationMs(),
                started.currentTool() != null ? started.currentTool() : existing.currentTool(),
                existing.toolUses(),
                existing.result(),
                existing.error()
        );
        return replace(current, existing.id(), agent -> updated);
    }

    public static List<ParallelAgent> progress(
            List<ParallelAgent> agents,
            String agentId,
            String currentTool,
            Integer toolUses
    ) {
        return replace(agents, agentId, agent -> agent.withProgress(
                currentTool != null ? currentTool : agent.currentTool(),
                toolUses != null ? toolUses : agent.toolUses()
        ));
    }

    /**
     * Records one more tool invocation made by the agent.
     */
    public static List<ParallelAgent> toolUsed(List<ParallelAgent> agents, String agentId, String toolName) {
        return replace(agents, agentId, agent -> agent.status().isTerminal()
                ? agent
                : agent.withProgress(toolName, agent.toolUses() == null ? 1 : agent.toolUses() + 1));
    }

    public static List<ParallelAgent> complete(
            List<ParallelAgent> agents,
            String agentId,
            boolean success,
            String result,
            String error,
            long nowMs
    ) {
        return replace(agents, agentId, agent -> agent.isActive()
                ? agent.finish(success ? AgentStatus.COMPLETED : AgentStatus.ERROR, nowMs, result, error)
                : agent);
    }

    /**
     * Applies a Task tool completion. Background agents only receive the result; foreground agents are
     * finalized as well.
     */
    public static List<ParallelAgent> taskToolCompleted(
            List<ParallelAgent> agents,
            String toolCallId,
            String result,
            long nowMs
    ) {
        ParallelAgent target = findByIdOrCorrelation(agents, toolCallId);
        if (target == null) {
            return agents;
        }
        return replace(agents, target.id(), agent -> {
            if (agent.background() || !agent.isActiveForeground()) {
                return agent.withResult(result);
            }
            return agent.finish(AgentStatus.COMPLETED, nowMs, result, null);
        });
    }

    /**
     * Turn-end finalization: foreground agents still running or pending are completed; background agents
     * keep going on their own.
     */
    public static List<ParallelAgent> finalizeForeground(List<ParallelAgent> agents, long nowMs) {
        return mapMatching(agents, ParallelAgent::isActiveForeground,
                agent -> agent.finish(AgentStatus.COMPLETED, nowMs, null, null));
    }

    public static List<ParallelAgent> interruptForeground(List<ParallelAgent> agents, long nowMs) {
        return mapMatching(agents, ParallelAgent::isActiveForeground,
                agent -> agent.finish(AgentStatus.INTERRUPTED, nowMs, null, null));
    }

    public static InterruptResult interruptActiveBackground(List<ParallelAgent> agents, long nowMs) {
        List<ParallelAgent> current = agents == null ? List.of() : agents;
        Set<String> interruptedIds = new LinkedHashSet<>();
        for (ParallelAgent agent : current) {
            if (agent.isActiveBackground()) {
                interruptedIds.add(agent.id());
            }
        }
        if (interruptedIds.isEmpty()) {
            return new InterruptResult(current, List.of());
        }
        List<ParallelAgent> next = mapMatching(current, agent -> interruptedIds.contains(agent.id()),
                agent -> agent.finish(AgentStatus.INTERRUPTED, nowMs, null, null));
        return new InterruptResult(next, List.copyOf(interruptedIds));
    }

    public static List<ParallelAgent> activeBackground(List<ParallelAgent> agents) {
        if (agents == null) {
            return List.of();
        }
        return agents.stream().filter(ParallelAgent::isActiveBackground).toList();
    }

    public static boolean hasActiveForegroundAgents(List<ParallelAgent> agents) {
        return agents != null && agents.stream().anyMatch(ParallelAgent::isActiveForeground);
    }

    public static boolean hasActiveAgents(List<ParallelAgent> agents) {
        return agents != null && agents.stream().anyMatch(ParallelAgent::isActive);
    }

    /**
     * True once a queued stream completion may run: no foreground agent is running or pending and no
     * blocking tool is in flight.
     */
    public static boolean shouldFinalizeDeferredStream(List<ParallelAgent> agents, boolean hasRunningTool) {
        return !hasRunningTool && !hasActiveForegroundAgents(agents);
    }

    /**
     * A shadow is an active foreground row that duplicates an active background agent, either through a
     * shared correlation id or through the placeholder heuristic.
     */
    public static boolean isShadow(ParallelAgent agent, List<ParallelAgent> agents, AgentDeduplicator deduplicator) {
        if (agent == null || !agent.isActiveForeground() || agents == null) {
            return false;
        }
        for (ParallelAgent other : agents) {
            if (other == agent || !other.isActiveBackground() || other.id().equals(agent.id())) {
                continue;
            }
            if (agent.sameCorrelation(other)
                    || deduplicator.isHeuristicMatch(agent, other)
                    || deduplicator.isHeuristicMatch(other, agent)) {
                return true;
            }
        }
        return false;
    }

    public static List<ParallelAgent> foregroundView(List<ParallelAgent> agents, AgentDeduplicator deduplicator) {
        if (agents == null) {
            return List.of();
        }
        return agents.stream()
                .filter(agent -> !agent.background())
                .filter(agent -> !isShadow(agent, agents, deduplicator))
                .toList();
    }

    public static ParallelAgent findById(List<ParallelAgent> agents, String agentId) {
        if (agents == null || agentId == null) {
            return null;
        }
        for (ParallelAgent agent : agents) {
            if (agent.id().equals(agentId)) {
                return agent;
            }
        }
        return null;
    }

    public static ParallelAgent findByIdOrCorrelation(List<ParallelAgent> agents, String key) {
        ParallelAgent byId = findById(agents, key);
        if (byId != null || agents == null || key == null) {
            return byId;
        }
        for (ParallelAgent agent : agents) {
            if (key.equals(agent.correlationId())) {
                return agent;
            }
        }
        return null;
    }

    private static List<ParallelAgent> replace(
            List<ParallelAgent> agents,
            String agentId,
            UnaryOperator<ParallelAgent> update
    ) {
        return mapMatching(agents, agent -> agent.id().equals(agentId), update);
    }

    private static List<ParallelAgent> mapMatching(
            List<ParallelAgent> agents,
            Predicate<ParallelAgent> predicate,
            UnaryOperator<ParallelAgent> update
    ) {
        if (agents == null) {
            return List.of();
        }
        List<ParallelAgent> next = new ArrayList<>(agents.size());
        for (ParallelAgent agent : agents) {
            next.add(predicate.test(agent) ? update.apply(agent) : agent);
        }
        return List.copyOf(next);
    }

    public record InterruptResult(List<ParallelAgent> agents, List<String> interruptedIds) {
        public InterruptResult {
            agents = agents == null ? List.of() : List.copyOf(agents);
            interruptedIds = interruptedIds == null ? List.of() : List.copyOf(interruptedIds);
        }
    }
}
