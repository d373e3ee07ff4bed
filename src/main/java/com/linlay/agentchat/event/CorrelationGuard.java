package com.linlay.agentchat.event;

import org.springframework.stereotype.Component;

import java.util.Objects;

/**
 * Keeps events of unrelated sessions and stale runs away from the lifecycle store.
 * <p>
 * Sub-agent events are admitted on any single ownership signal. Session-owned events pass even without a
 * Task tool correlation because some runtimes dispatch built-in sub-agents without the Task tool.
 */
@Component
public class CorrelationGuard {

    public boolean admits(CorrelationSignals signals) {
        if (signals == null) {
            return false;
        }
        return signals.sessionOwned() || signals.pendingTaskEntry() || signals.hasSdkCorrelationMatch();
    }

    public boolean acceptsToolStart(boolean ownedSession, Long activeRunId, boolean isStreaming, Long sdkRunId) {
        if (activeRunId == null || !isStreaming) {
            return false;
        }
        if (!ownedSession && !Objects.equals(sdkRunId, activeRunId)) {
            return false;
        }
        return sdkRunId == null || sdkRunId.equals(activeRunId);
    }

    /**
     * @param eventRunId run recorded for the tool call when its start was accepted
     */
    public boolean acceptsToolComplete(
            boolean ownedSession,
            Long activeRunId,
            boolean isStreaming,
            Long sdkRunId,
            Long eventRunId
    ) {
        if (activeRunId == null || !isStreaming) {
            return false;
        }
        if (!ownedSession && !Objects.equals(sdkRunId, activeRunId)) {
            return false;
        }
        return eventRunId != null && eventRunId.equals(activeRunId);
    }

    /**
     * Parallel tracking of a run ends once nothing is active and no Task call awaits its sub-agent.
     */
    public boolean shouldFinalizeRun(boolean hasActiveAgents, boolean hasPendingCorrelations) {
        return !hasActiveAgents && !hasPendingCorrelations;
    }
}
