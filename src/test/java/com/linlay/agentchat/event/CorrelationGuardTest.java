package com.linlay.agentchat.event;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CorrelationGuardTest {

    private final CorrelationGuard guard = new CorrelationGuard();

    @Test
    void shouldAdmitOnAnySingleSignal() {
        assertThat(guard.admits(new CorrelationSignals(true, false, false))).isTrue();
        assertThat(guard.admits(new CorrelationSignals(false, true, false))).isTrue();
        assertThat(guard.admits(new CorrelationSignals(false, false, true))).isTrue();
        assertThat(guard.admits(new CorrelationSignals(false, false, false))).isFalse();
        assertThat(guard.admits(null)).isFalse();
    }

    @Test
    void shouldIsolateToolStartsByRun() {
        assertThat(guard.acceptsToolStart(true, 2L, true, null)).isTrue();
        assertThat(guard.acceptsToolStart(true, 2L, true, 2L)).isTrue();
        assertThat(guard.acceptsToolStart(true, 2L, true, 1L)).isFalse();
        assertThat(guard.acceptsToolStart(false, 2L, true, 2L)).isTrue();
        assertThat(guard.acceptsToolStart(false, 2L, true, null)).isFalse();
        assertThat(guard.acceptsToolStart(true, null, true, null)).isFalse();
        assertThat(guard.acceptsToolStart(true, 2L, false, null)).isFalse();
    }

    @Test
    void shouldRequireRecordedRunForToolCompletion() {
        assertThat(guard.acceptsToolComplete(true, 2L, true, null, 2L)).isTrue();
        assertThat(guard.acceptsToolComplete(true, 2L, true, null, 1L)).isFalse();
        assertThat(guard.acceptsToolComplete(true, 2L, true, null, null)).isFalse();
        assertThat(guard.acceptsToolComplete(false, 2L, true, 3L, 2L)).isFalse();
    }

    @Test
    void shouldFinalizeRunOnlyWhenNothingIsOutstanding() {
        assertThat(guard.shouldFinalizeRun(false, false)).isTrue();
        assertThat(guard.shouldFinalizeRun(true, false)).isFalse();
        assertThat(guard.shouldFinalizeRun(false, true)).isFalse();
    }
}
