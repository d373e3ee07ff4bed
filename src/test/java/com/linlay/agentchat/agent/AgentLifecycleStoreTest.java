package com.linlay.agentchat.agent;

import com.linlay.agentchat.stream.StreamControlState;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class AgentLifecycleStoreTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:05:00Z");

    private final List<Runnable> executed = new ArrayList<>();
    private final AgentLifecycleStore store = new AgentLifecycleStore(
            new AgentDeduplicator(AgentDeduplicator.DEFAULT_MERGE_WINDOW_MS),
            runnable -> {
                executed.add(runnable);
                runnable.run();
            },
            Clock.fixed(NOW, ZoneOffset.UTC)
    );

    @Test
    void shouldReleaseDeferredCompletionWhenLastForegroundAgentCompletes() {
        store.startStream("msg_1", false);
        store.startAgent(ParallelAgent.started("a1", null, "explore", "Scan", false, "2026-03-02T10:00:00Z"));
        store.startAgent(ParallelAgent.started("bg1", null, "watch", "Watch logs", true, "2026-03-02T10:00:00Z"));
        AtomicInteger completions = new AtomicInteger();

        store.deferCompletion(completions::incrementAndGet);

        assertThat(completions).hasValue(0);
        assertThat(store.streamState().hasPendingCompletion()).isTrue();

        store.completeAgent("a1", true, "ok", null);

        assertThat(completions).hasValue(1);
        assertThat(store.streamState().hasPendingCompletion()).isFalse();
        assertThat(AgentTransitions.findById(store.agents(), "a1").durationMs()).isEqualTo(300_000L);
        assertThat(AgentTransitions.findById(store.agents(), "bg1").status()).isEqualTo(AgentStatus.BACKGROUND);
    }

    @Test
    void shouldHoldCompletionWhileBlockingToolRuns() {
        store.startStream("msg_1", false);
        store.toolStarted("call_bash", "Bash");
        store.toolStarted("call_skill", "plugin__skill");
        AtomicInteger completions = new AtomicInteger();

        store.deferCompletion(completions::incrementAndGet);
        assertThat(completions).hasValue(0);

        store.toolCompleted("call_bash");

        assertThat(completions).hasValue(1);
        assertThat(store.streamState().hasRunningTool()).isFalse();
    }

    @Test
    void shouldRunCompletionImmediatelyWithoutActiveForegroundWork() {
        store.startStream("msg_1", false);
        AtomicInteger completions = new AtomicInteger();

        store.deferCompletion(completions::incrementAndGet);

        assertThat(completions).hasValue(1);
        assertThat(executed).hasSize(1);
    }

    @Test
    void shouldDropDeferredCompletionOnCancel() {
        long generation = store.startStream("msg_1", false);
        store.startAgent(ParallelAgent.started("a1", null, "explore", "Scan", false, "2026-03-02T10:04:00Z"));
        AtomicInteger completions = new AtomicInteger();
        store.deferCompletion(completions::incrementAndGet);
        Runnable staleCallback = store.guardCurrentGeneration(completions::incrementAndGet);

        long next = store.cancelStream();
        store.completeAgent("a1", true, "late", null);
        staleCallback.run();

        assertThat(next).isEqualTo(generation + 1);
        assertThat(store.isCurrentGeneration(generation)).isFalse();
        assertThat(completions).hasValue(0);
        ParallelAgent interrupted = AgentTransitions.findById(store.agents(), "a1");
        assertThat(interrupted.status()).isEqualTo(AgentStatus.INTERRUPTED);
        assertThat(interrupted.result()).isNull();
        StreamControlState state = store.streamState();
        assertThat(state.isStreaming()).isFalse();
        assertThat(state.streamingStart()).isEqualTo(NOW.toEpochMilli());
    }

    @Test
    void shouldKeepOnlyActiveBackgroundAgentsForNextTurn() {
        store.startStream("msg_1", false);
        store.startAgent(ParallelAgent.started("a1", null, "explore", "Scan", false, "2026-03-02T10:00:00Z"));
        store.startAgent(ParallelAgent.started("bg1", null, "watch", "Watch logs", true, "2026-03-02T10:00:00Z"));
        List<ParallelAgent> baked = store.finishStream();

        store.startStream("msg_2", false);

        assertThat(baked).extracting(ParallelAgent::status)
                .containsExactly(AgentStatus.COMPLETED, AgentStatus.BACKGROUND);
        assertThat(store.agents()).extracting(ParallelAgent::id).containsExactly("bg1");
        assertThat(store.activeBackgroundAgents()).hasSize(1);
    }

    @Test
    void shouldDeduplicatePlaceholderWhenSubagentStarts() {
        store.startStream("msg_1", false);
        store.startAgent(ParallelAgent.placeholder("call_1", "explore", null, false, "2026-03-02T10:00:00Z"));
        store.startAgent(ParallelAgent.started("sa_1", "call_1", "explore", "Scan", false, "2026-03-02T10:00:01Z"));

        assertThat(store.agents()).hasSize(1);
        assertThat(store.findAgent("call_1").id()).isEqualTo("sa_1");
        assertThat(store.recordToolUse("call_1", "Read")).isTrue();
        assertThat(store.findAgent("sa_1").toolUses()).isEqualTo(1);
        assertThat(store.recordToolUse("missing", "Read")).isFalse();
    }

    @Test
    void shouldInterruptOnlyBackgroundAgentsActiveAtCallTime() {
        store.startStream("msg_1", false);
        store.startAgent(ParallelAgent.started("bg1", null, "watch", "Watch logs", true, "2026-03-02T10:00:00Z"));
        store.startAgent(ParallelAgent.started("bg2", null, "watch", "Watch tests", true, "2026-03-02T10:00:00Z"));
        store.completeAgent("bg2", true, "done", null);
        store.startAgent(ParallelAgent.started("a1", null, "explore", "Scan", false, "2026-03-02T10:04:00Z"));

        AgentTransitions.InterruptResult result = store.interruptActiveBackground();

        assertThat(result.interruptedIds()).containsExactly("bg1");
        assertThat(result.agents()).isEqualTo(store.agents());
        assertThat(store.findAgent("bg1").status()).isEqualTo(AgentStatus.INTERRUPTED);
        assertThat(store.findAgent("bg2").status()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(store.findAgent("a1").status()).isEqualTo(AgentStatus.RUNNING);
        assertThat(store.activeBackgroundAgents()).isEmpty();
    }

    @Test
    void shouldClearEverythingOnReset() {
        long generation = store.startStream("msg_1", false);
        store.startAgent(ParallelAgent.started("bg1", null, "watch", "Watch logs", true, "2026-03-02T10:00:00Z"));

        store.reset();

        assertThat(store.agents()).isEmpty();
        assertThat(store.streamState()).isEqualTo(StreamControlState.idle());
        assertThat(store.currentGeneration()).isGreaterThan(generation);
        assertThat(store.hasActiveAgents()).isFalse();
    }
}
