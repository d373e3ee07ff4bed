package com.linlay.agentchat.event;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.linlay.agentchat.agent.AgentDeduplicator;
import com.linlay.agentchat.agent.AgentLifecycleStore;
import com.linlay.agentchat.agent.AgentStatus;
import com.linlay.agentchat.agent.ParallelAgent;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class SubagentEventReducerTest {

    private static final Instant NOW = Instant.parse("2026-03-02T10:00:00Z");
    private static final long TS = NOW.toEpochMilli();

    private final Clock clock = Clock.fixed(NOW.plusSeconds(60), ZoneOffset.UTC);
    private final AgentLifecycleStore store = new AgentLifecycleStore(
            new AgentDeduplicator(AgentDeduplicator.DEFAULT_MERGE_WINDOW_MS),
            Runnable::run,
            clock
    );
    private final SubagentEventReducer reducer = new SubagentEventReducer(
            new SessionEventNormalizer(new ObjectMapper()),
            new CorrelationGuard(),
            store,
            clock
    );

    @BeforeEach
    void setUp() {
        reducer.setActiveSessionId("s1");
        store.startStream("msg_1", false);
        reducer.beginRun();
    }

    @Test
    void shouldTrackTaskToolThroughSubagentLifecycle() {
        boolean started = reducer.reduce(taskStart("s1", "call_1", "explore", "Scan repo", false));

        assertThat(started).isTrue();
        assertThat(reducer.hasPendingTaskCalls()).isTrue();
        assertThat(store.agents()).singleElement().satisfies(agent -> {
            assertThat(agent.id()).isEqualTo("call_1");
            assertThat(agent.name()).isEqualTo("explore");
            assertThat(agent.status()).isEqualTo(AgentStatus.RUNNING);
        });

        reducer.reduce(new SessionEvent.SubagentStarted("s1", TS + 100, "sa_1", null, null, "call_1", false));

        assertThat(reducer.hasPendingTaskCalls()).isFalse();
        assertThat(store.agents()).singleElement().satisfies(agent -> {
            assertThat(agent.id()).isEqualTo("sa_1");
            assertThat(agent.correlationId()).isEqualTo("call_1");
            assertThat(agent.task()).isEqualTo("Scan repo");
            assertThat(agent.startedAt()).isEqualTo(NOW.toString());
        });

        reducer.reduce(new SessionEvent.ToolStarted("s1", TS + 200, "call_2", "Read", Map.of(), "sa_1", null));
        reducer.reduce(new SessionEvent.ToolCompleted("s1", TS + 300, "call_2", "Read", true, "ok", null, "sa_1", null));
        reducer.reduce(new SessionEvent.SubagentCompleted("s1", TS + 400, "sa_1", true, "scan finished", null));
        reducer.reduce(new SessionEvent.ToolCompleted("s1", TS + 500, "call_1", "Task", true, "Task result", null, null, null));

        ParallelAgent finished = store.findAgent("sa_1");
        assertThat(finished.toolUses()).isEqualTo(1);
        assertThat(finished.status()).isEqualTo(AgentStatus.COMPLETED);
        assertThat(finished.result()).isEqualTo("Task result");
        assertThat(finished.durationMs()).isEqualTo(60_000L);
        assertThat(store.streamState().hasRunningTool()).isFalse();
        assertThat(reducer.isRunSettled()).isTrue();
    }

    @Test
    void shouldDropSubagentOfForeignSessionWithoutCorrelation() {
        boolean applied = reducer.reduce(
                new SessionEvent.SubagentStarted("other", TS, "sa_x", "explore", "Other work", "call_x", false));
        boolean completed = reducer.reduce(new SessionEvent.SubagentCompleted("other", TS, "sa_x", true, null, null));

        assertThat(applied).isFalse();
        assertThat(completed).isFalse();
        assertThat(store.agents()).isEmpty();
    }

    @Test
    void shouldAdmitForeignSessionSubagentMatchingPendingTaskCall() {
        reducer.reduce(taskStart("s1", "call_1", "explore", "Scan repo", true));

        boolean applied = reducer.reduce(
                new SessionEvent.SubagentStarted("child-session", TS + 50, "sa_1", "explore", null, "call_1", false));

        assertThat(applied).isTrue();
        ParallelAgent agent = store.findAgent("sa_1");
        assertThat(agent.background()).isTrue();
        assertThat(agent.status()).isEqualTo(AgentStatus.BACKGROUND);
        assertThat(agent.task()).isEqualTo("Scan repo");
        assertThat(store.agents()).hasSize(1);
    }

    @Test
    void shouldAdmitOwnedSubagentWithoutTaskTool() {
        boolean applied = reducer.reduce(
                new SessionEvent.SubagentStarted("s1", TS, "sa_builtin", "compact", "Summarize", null, false));

        assertThat(applied).isTrue();
        assertThat(store.findAgent("sa_builtin").name()).isEqualTo("compact");
    }

    @Test
    void shouldRejectToolEventsOfEarlierRun() {
        reducer.reduce(new SessionEvent.ToolStarted("s1", TS, "call_bash", "Bash", Map.of(), null, null));
        assertThat(store.streamState().hasRunningTool()).isTrue();

        boolean staleStart = reducer.reduce(new SessionEvent.ToolStarted("s1", TS, "call_old", "Bash", Map.of(), null, 0L));
        reducer.beginRun();
        boolean staleComplete = reducer.reduce(
                new SessionEvent.ToolCompleted("s1", TS, "call_bash", "Bash", true, "ok", null, null, null));

        assertThat(staleStart).isFalse();
        assertThat(staleComplete).isFalse();
        assertThat(store.streamState().hasRunningTool()).isTrue();
    }

    @Test
    void shouldRejectToolStartOutsideStreaming() {
        store.finishStream();

        boolean applied = reducer.reduce(taskStart("s1", "call_1", "explore", "Scan repo", false));

        assertThat(applied).isFalse();
        assertThat(store.agents()).isEmpty();
    }

    @Test
    void shouldCountOpenAskQuestionTools() {
        reducer.reduce(new SessionEvent.ToolStarted("s1", TS, "call_q", "mcp__ui__ask_question", Map.of(), null, null));
        assertThat(reducer.runningAskQuestionTools()).isEqualTo(1);

        reducer.reduce(new SessionEvent.ToolCompleted("s1", TS, "call_q", "mcp__ui__ask_question", true, "yes", null, null, null));
        assertThat(reducer.runningAskQuestionTools()).isZero();
    }

    private static SessionEvent.ToolStarted taskStart(
            String sessionId,
            String toolCallId,
            String subagentType,
            String description,
            boolean background
    ) {
        return new SessionEvent.ToolStarted(
                sessionId,
                TS,
                toolCallId,
                "Task",
                Map.of("subagent_type", subagentType, "description", description, "run_in_background", background),
                null,
                null
        );
    }
}
