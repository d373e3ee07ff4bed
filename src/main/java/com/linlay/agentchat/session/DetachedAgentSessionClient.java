package com.linlay.agentchat.session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

/**
 * Client used when no agent runtime is attached. Aborts succeed immediately so local state still settles.
 */
public class DetachedAgentSessionClient implements AgentSessionClient {

    private static final Logger log = LoggerFactory.getLogger(DetachedAgentSessionClient.class);

    @Override
    public Mono<Void> abort() {
        return Mono.fromRunnable(() -> log.info("No agent runtime attached, abort handled locally"));
    }

    @Override
    public Mono<Void> abortBackgroundAgents() {
        return Mono.fromRunnable(() -> log.info("No agent runtime attached, background abort handled locally"));
    }
}
