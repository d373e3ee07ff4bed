package com.linlay.agentchat.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "agent.session")
public class AgentSessionProperties {

    private int windowSize = 50;
    private long placeholderMergeWindowMs = 120_000L;
    private String eventLoopThreadName = "agent-event-loop";

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public long getPlaceholderMergeWindowMs() {
        return placeholderMergeWindowMs;
    }

    public void setPlaceholderMergeWindowMs(long placeholderMergeWindowMs) {
        this.placeholderMergeWindowMs = placeholderMergeWindowMs;
    }

    public String getEventLoopThreadName() {
        return eventLoopThreadName;
    }

    public void setEventLoopThreadName(String eventLoopThreadName) {
        this.eventLoopThreadName = eventLoopThreadName;
    }
}
