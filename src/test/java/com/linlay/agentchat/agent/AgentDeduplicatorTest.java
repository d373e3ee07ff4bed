package com.linlay.agentchat.agent;

import com.linlay.agentchat.config.AgentSessionProperties;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class AgentDeduplicatorTest {

    private static final String T0 = "2026-03-02T10:00:00Z";

    private final AgentDeduplicator deduplicator = new AgentDeduplicator(AgentDeduplicator.DEFAULT_MERGE_WINDOW_MS);

    @Test
    void shouldReturnSameListWhenNothingMerges() {
        List<ParallelAgent> single = List.of(row("a1", null, "explore", "Find usages", AgentStatus.RUNNING, T0));
        List<ParallelAgent> distinct = List.of(
                row("a1", null, "explore", "Find usages", AgentStatus.RUNNING, T0),
                row("a2", null, "plan", "Draft migration plan", AgentStatus.RUNNING, T0)
        );

        assertThat(deduplicator.dedupe(single)).isSameAs(single);
        assertThat(deduplicator.dedupe(distinct)).isSameAs(distinct);
        assertThat(deduplicator.dedupe(List.of())).isEmpty();
    }

    @Test
    void shouldMergePlaceholderIntoDescriptiveRowSharingCorrelationId() {
        ParallelAgent placeholder = ParallelAgent.placeholder("call_1", "explore", null, false, T0);
        ParallelAgent unrelated = row("a9", null, "plan", "Draft migration plan", AgentStatus.RUNNING, T0);
        ParallelAgent described = new ParallelAgent("sa_1", "call_1", "explore", "Map the event pipeline",
                AgentStatus.RUNNING, false, "2026-03-02T10:00:05Z", null, "Grep", 3, null, null);

        List<ParallelAgent> result = deduplicator.dedupe(List.of(placeholder, unrelated, described));

        assertThat(result).hasSize(2);
        ParallelAgent merged = result.get(0);
        assertThat(merged.id()).isEqualTo("sa_1");
        assertThat(merged.correlationId()).isEqualTo("call_1");
        assertThat(merged.task()).isEqualTo("Map the event pipeline");
        assertThat(merged.startedAt()).isEqualTo(T0);
        assertThat(merged.toolUses()).isEqualTo(3);
        assertThat(merged.currentTool()).isEqualTo("Grep");
        assertThat(result.get(1)).isSameAs(unrelated);
    }

    @Test
    void shouldKeepTerminalOutcomeAndClearCurrentTool() {
        ParallelAgent placeholder = ParallelAgent.placeholder("call_2", "explore", "Sub-agent task", false, T0);
        ParallelAgent finished = new ParallelAgent("sa_2", "call_2", "explore", "Audit config loading",
                AgentStatus.COMPLETED, false, T0, 1_500L, null, 4, "done", null);

        List<ParallelAgent> result = deduplicator.dedupe(List.of(finished, placeholder));

        assertThat(result).hasSize(1);
        ParallelAgent merged = result.get(0);
        assertThat(merged.status()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(merged.currentTool()).isNull();
        assertThat(merged.result()).isEqualTo("done");
        assertThat(merged.durationMs()).isEqualTo(1_500L);
    }

    @Test
    void shouldTakeTerminalStatusFromNonCanonicalMember() {
        ParallelAgent placeholder = ParallelAgent.placeholder("call_3", "explore", null, false, T0)
                .finish(AgentStatus.ERROR, ParallelAgent.parseTimestamp(T0) + 900L, null, "boom");
        ParallelAgent described = row("sa_3", "call_3", "explore", "Review tests", AgentStatus.RUNNING, T0);

        ParallelAgent merged = deduplicator.dedupe(List.of(placeholder, described)).get(0);

        assertThat(merged.id()).isEqualTo("sa_3");
        assertThat(merged.status()).isEqualTo(AgentStatus.ERROR);
        assertThat(merged.error()).isEqualTo("boom");
        assertThat(merged.durationMs()).isEqualTo(900L);
    }

    @Test
    void shouldPreferLatestRowWhenEveryMemberIsPlaceholder() {
        ParallelAgent first = ParallelAgent.placeholder("call_4", "explore", null, false, T0);
        ParallelAgent second = ParallelAgent.placeholder("call_4", "explore", null, true, T0).withProgress("Read", 2);

        List<ParallelAgent> result = deduplicator.dedupe(List.of(first, second));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).toolUses()).isEqualTo(2);
        assertThat(result.get(0).background()).isTrue();
    }

    @Test
    void shouldMergeByHeuristicWithinTwoMinutesInclusive() {
        ParallelAgent placeholder = ParallelAgent.placeholder("call_h", "explore", null, false, T0);
        ParallelAgent described = row("sa_h", null, "explore", "Audit modules", AgentStatus.RUNNING,
                "2026-03-02T10:02:00Z");

        List<ParallelAgent> result = deduplicator.dedupe(List.of(placeholder, described));

        assertThat(result).hasSize(1);
        assertThat(result.get(0).id()).isEqualTo("sa_h");
        assertThat(result.get(0).correlationId()).isEqualTo("call_h");
        assertThat(result.get(0).task()).isEqualTo("Audit modules");
        assertThat(result.get(0).startedAt()).isEqualTo(T0);
    }

    @Test
    void shouldNotMergeByHeuristicPastTwoMinutes() {
        List<ParallelAgent> agents = List.of(
                ParallelAgent.placeholder("call_h", "explore", null, false, T0),
                row("sa_h", null, "explore", "Audit modules", AgentStatus.RUNNING, "2026-03-02T10:02:01Z")
        );

        assertThat(deduplicator.dedupe(agents)).isSameAs(agents);
    }

    @Test
    void shouldNeverMergeTwoDescriptiveTasks() {
        List<ParallelAgent> agents = List.of(
                row("a1", null, "explore", "Inspect parser", AgentStatus.RUNNING, T0),
                row("a2", null, "explore", "Inspect lexer", AgentStatus.RUNNING, "2026-03-02T10:00:01Z")
        );

        assertThat(deduplicator.dedupe(agents)).isSameAs(agents);
    }

    @Test
    void shouldNotMergeByHeuristicOnConflictingCorrelationOrBadTimestamp() {
        List<ParallelAgent> conflicting = List.of(
                ParallelAgent.placeholder("call_x", "explore", null, false, T0),
                row("sa_y", "call_y", "explore", "Audit modules", AgentStatus.RUNNING, T0)
        );
        List<ParallelAgent> otherName = List.of(
                ParallelAgent.placeholder("call_x", "explore", null, false, T0),
                row("sa_y", null, "plan", "Audit modules", AgentStatus.RUNNING, T0)
        );
        List<ParallelAgent> unparseable = List.of(
                ParallelAgent.placeholder("call_x", "explore", null, false, "yesterday"),
                row("sa_y", null, "explore", "Audit modules", AgentStatus.RUNNING, T0)
        );

        assertThat(deduplicator.dedupe(conflicting)).isSameAs(conflicting);
        assertThat(deduplicator.dedupe(otherName)).isSameAs(otherName);
        assertThat(deduplicator.dedupe(unparseable)).isSameAs(unparseable);
    }

    @Test
    void shouldHonorConfiguredMergeWindow() {
        AgentSessionProperties properties = new AgentSessionProperties();
        properties.setPlaceholderMergeWindowMs(1_000L);
        AgentDeduplicator narrow = new AgentDeduplicator(properties);
        List<ParallelAgent> agents = List.of(
                ParallelAgent.placeholder("call_h", "explore", null, false, T0),
                row("sa_h", null, "explore", "Audit modules", AgentStatus.RUNNING, "2026-03-02T10:00:02Z")
        );

        assertThat(narrow.dedupe(agents)).isSameAs(agents);
        assertThat(deduplicator.dedupe(agents)).hasSize(1);
    }

    static ParallelAgent row(
            String id,
            String correlationId,
            String name,
            String task,
            AgentStatus status,
            String startedAt
    ) {
        return new ParallelAgent(id, correlationId, name, task, status, false, startedAt,
                null, null, null, null, null);
    }
}
