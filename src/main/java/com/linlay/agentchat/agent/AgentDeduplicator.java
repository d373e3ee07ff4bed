package com.linlay.agentchat.agent;

import com.linlay.agentchat.config.AgentSessionProperties;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses event-derived rows that describe the same logical sub-agent into one canonical row.
 * <p>
 * A sub-agent is typically reported twice: once as an eager placeholder keyed by the Task tool call id and
 * once as the descriptive row from the SDK. Rows are grouped by correlation id first; rows left alone after
 * that may still pair up through the placeholder heuristic (same name, one placeholder, starts within
 * {@link AgentSessionProperties#getPlaceholderMergeWindowMs()}). The function is pure and keeps the order of
 * rows it does not touch; when nothing merges the input list itself is returned.
 */
@Component
public class AgentDeduplicator {

    public static final long DEFAULT_MERGE_WINDOW_MS = 120_000L;

    private final long mergeWindowMs;

    @Autowired
    public AgentDeduplicator(AgentSessionProperties properties) {
        this(properties == null ? DEFAULT_MERGE_WINDOW_MS : properties.getPlaceholderMergeWindowMs());
    }

    public AgentDeduplicator(long mergeWindowMs) {
        this.mergeWindowMs = Math.max(0L, mergeWindowMs);
    }

    public List<ParallelAgent> dedupe(List<ParallelAgent> agents) {
        if (agents == null || agents.size() <= 1) {
            return agents;
        }

        int size = agents.size();
        int[] parent = new int[size];
        for (int i = 0; i < size; i++) {
            parent[i] = i;
        }

        for (int i = 0; i < size; i++) {
            for (int j = i + 1; j < size; j++) {
                if (agents.get(i).sameCorrelation(agents.get(j))) {
                    union(parent, i, j);
                }
            }
        }

        int[] groupSizes = groupSizes(parent);
        boolean[] paired = new boolean[size];
        for (int i = 0; i < size; i++) {
            ParallelAgent placeholder = agents.get(i);
            if (paired[i] || groupSizes[find(parent, i)] > 1 || !placeholder.isPlaceholderShape()) {
                continue;
            }
            for (int j = 0; j < size; j++) {
                if (j == i || paired[j] || groupSizes[find(parent, j)] > 1) {
                    continue;
                }
                if (isHeuristicMatch(placeholder, agents.get(j))) {
                    union(parent, i, j);
                    paired[i] = true;
                    paired[j] = true;
                    break;
                }
            }
        }

        Map<Integer, List<ParallelAgent>> groups = new LinkedHashMap<>();
        boolean merged = false;
        for (int i = 0; i < size; i++) {
            List<ParallelAgent> members = groups.computeIfAbsent(find(parent, i), k -> new ArrayList<>());
            members.add(agents.get(i));
            merged |= members.size() > 1;
        }
        if (!merged) {
            return agents;
        }

        List<ParallelAgent> result = new ArrayList<>(groups.size());
        for (List<ParallelAgent> members : groups.values()) {
            result.add(members.size() == 1 ? members.get(0) : merge(members));
        }
        return List.copyOf(result);
    }

    /**
     * Narrow merge rule for rows that share no correlation id. Two descriptive tasks never match.
     */
    boolean isHeuristicMatch(ParallelAgent placeholder, ParallelAgent candidate) {
        if (!placeholder.isPlaceholderShape() || candidate.isPlaceholderShape() || candidate.hasGenericTask()) {
            return false;
        }
        if (!Objects.equals(placeholder.name(), candidate.name()) || placeholder.name().isBlank()) {
            return false;
        }
        if (placeholder.correlationId() != null
                && candidate.correlationId() != null
                && !placeholder.correlationId().equals(candidate.correlationId())) {
            return false;
        }
        Long left = placeholder.startedAtMillis();
        Long right = candidate.startedAtMillis();
        if (left == null || right == null) {
            return false;
        }
        return Math.abs(left - right) <= mergeWindowMs;
    }

    private ParallelAgent merge(List<ParallelAgent> members) {
        ParallelAgent canonical = null;
        for (ParallelAgent member : members) {
            if (!member.id().equals(member.correlationId())) {
                canonical = member;
            }
        }
        if (canonical == null) {
            canonical = members.get(members.size() - 1);
        }

        ParallelAgent terminal = canonical.status().isTerminal() ? canonical : null;
        String task = canonical.hasGenericTask() ? null : canonical.task();
        String name = canonical.name().isBlank() ? null : canonical.name();
        String correlationId = canonical.correlationId();
        String currentTool = canonical.currentTool();
        String result = canonical.result();
        String error = canonical.error();
        Integer toolUses = canonical.toolUses();
        boolean background = false;
        Long earliestStart = null;
        String startedAt = canonical.startedAt();

        for (ParallelAgent member : members) {
            background |= member.background();
            if (member.status().isTerminal() && terminal != canonical) {
                terminal = member;
            }
            if (task == null && !member.hasGenericTask()) {
                task = member.task();
            }
            if (name == null && !member.name().isBlank()) {
                name = member.name();
            }
            if (correlationId == null) {
                correlationId = member.correlationId();
            }
            if (currentTool == null) {
                currentTool = member.currentTool();
            }
            if (member.toolUses() != null && (toolUses == null || member.toolUses() > toolUses)) {
                toolUses = member.toolUses();
            }
            Long memberStart = member.startedAtMillis();
            if (memberStart != null && (earliestStart == null || memberStart < earliestStart)) {
                earliestStart = memberStart;
                startedAt = member.startedAt();
            }
        }

        AgentStatus status = canonical.status();
        Long durationMs = canonical.durationMs();
        if (terminal != null) {
            status = terminal.status();
            durationMs = terminal.durationMs() != null ? terminal.durationMs() : durationMs;
            result = result != null ? result : terminal.result();
            error = error != null ? error : terminal.error();
            currentTool = null;
        }

        return new ParallelAgent(
                canonical.id(),
                correlationId,
                name,
                task == null ? canonical.task() : task,
                status,
                background,
                startedAt,
                durationMs,
                currentTool,
                toolUses,
                result,
                error
        );
    }

    private static int[] groupSizes(int[] parent) {
        int[] sizes = new int[parent.length];
        for (int i = 0; i < parent.length; i++) {
            sizes[find(parent, i)]++;
        }
        return sizes;
    }

    private static int find(int[] parent, int index) {
        while (parent[index] != index) {
            parent[index] = parent[parent[index]];
            index = parent[index];
        }
        return index;
    }

    private static void union(int[] parent, int left, int right) {
        int leftRoot = find(parent, left);
        int rightRoot = find(parent, right);
        if (leftRoot == rightRoot) {
            return;
        }
        // keep the earliest index as root so merged rows stay at the first member's position
        if (leftRoot < rightRoot) {
            parent[rightRoot] = leftRoot;
        } else {
            parent[leftRoot] = rightRoot;
        }
    }
}
