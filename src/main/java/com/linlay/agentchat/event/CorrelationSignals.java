package com.linlay.agentchat.event;

/**
 * Ownership evidence for an inbound sub-agent event.
 *
 * @param sessionOwned           the event's session id matches the active session
 * @param pendingTaskEntry       a Task tool invocation is still waiting for its sub-agent
 * @param hasSdkCorrelationMatch the event's tool-use id matches a tracked id
 */
public record CorrelationSignals(
        boolean sessionOwned,
        boolean pendingTaskEntry,
        boolean hasSdkCorrelationMatch
) {
}
