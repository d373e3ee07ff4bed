package com.linlay.agentchat.session;

import reactor.core.publisher.Mono;

/**
 * Outbound control channel to the agent runtime that owns the session.
 */
public interface AgentSessionClient {

    /**
     * Aborts the primary stream of the current turn.
     */
    Mono<Void> abort();

    /**
     * Aborts every background sub-agent still running in the session. Completes empty once the runtime
     * accepted the request; errors are reported through the returned {@link Mono}.
     */
    Mono<Void> abortBackgroundAgents();
}
