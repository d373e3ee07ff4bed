package com.linlay.agentchat.transcript;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.linlay.agentchat.agent.ParallelAgent;

import java.time.Instant;
import java.util.List;

/**
 * One transcript entry. {@code parallelAgents} is the agent snapshot baked in when the message finished
 * streaming; the message owns it independently of the live lifecycle store.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(
        String id,
        MessageRole role,
        String content,
        String timestamp,
        Boolean streaming,
        Boolean interrupted,
        List<ParallelAgent> parallelAgents
) {

    public ChatMessage {
        content = content == null ? "" : content;
        parallelAgents = parallelAgents == null || parallelAgents.isEmpty() ? null : List.copyOf(parallelAgents);
    }

    public static ChatMessage user(String id, String content, Instant createdAt) {
        return new ChatMessage(id, MessageRole.USER, content, timestamp(createdAt), null, null, null);
    }

    public static ChatMessage assistant(String id, String content, Instant createdAt) {
        return new ChatMessage(id, MessageRole.ASSISTANT, content, timestamp(createdAt), null, null, null);
    }

    public static ChatMessage streamingAssistant(String id, Instant createdAt) {
        return new ChatMessage(id, MessageRole.ASSISTANT, "", timestamp(createdAt), true, null, null);
    }

    public boolean stillStreaming() {
        return Boolean.TRUE.equals(streaming);
    }

    public ChatMessage appendContent(String delta) {
        if (delta == null || delta.isEmpty()) {
            return this;
        }
        return new ChatMessage(id, role, content + delta, timestamp, streaming, interrupted, parallelAgents);
    }

    /**
     * Ends streaming and takes ownership of the given agent snapshot.
     */
    public ChatMessage complete(List<ParallelAgent> agentSnapshot) {
        return new ChatMessage(id, role, content, timestamp, null, interrupted, agentSnapshot);
    }

    public ChatMessage interrupt(List<ParallelAgent> agentSnapshot) {
        return new ChatMessage(id, role, content, timestamp, null, true, agentSnapshot);
    }

    public ChatMessage withParallelAgents(List<ParallelAgent> agentSnapshot) {
        return new ChatMessage(id, role, content, timestamp, streaming, interrupted, agentSnapshot);
    }

    private static String timestamp(Instant createdAt) {
        return createdAt == null ? null : createdAt.toString();
    }
}
