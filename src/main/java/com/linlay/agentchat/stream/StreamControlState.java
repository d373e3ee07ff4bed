package com.linlay.agentchat.stream;

/**
 * Control flags of the primary streaming response.
 */
public record StreamControlState(
        boolean isStreaming,
        String streamingMessageId,
        Long streamingStart,
        boolean hasStreamingMeta,
        boolean hasRunningTool,
        boolean isAgentOnlyStream,
        boolean hasPendingCompletion
) {

    private static final StreamControlState IDLE =
            new StreamControlState(false, null, null, false, false, false, false);

    public static StreamControlState idle() {
        return IDLE;
    }

    public StreamControlState start(String messageId, long startedAt, boolean agentOnlyStream) {
        if (messageId == null || messageId.isBlank()) {
            throw new IllegalArgumentException("messageId must not be null or blank");
        }
        return new StreamControlState(true, messageId, startedAt, false, false, agentOnlyStream, false);
    }

    /**
     * Clears every transient flag. Applying it to an already stopped state yields an equal state.
     */
    public StreamControlState stop(boolean preserveStreamingStart) {
        return new StreamControlState(
                false,
                null,
                preserveStreamingStart ? streamingStart : null,
                false,
                false,
                false,
                false
        );
    }

    public StreamControlState withStreamingMeta(boolean value) {
        return new StreamControlState(isStreaming, streamingMessageId, streamingStart, value,
                hasRunningTool, isAgentOnlyStream, hasPendingCompletion);
    }

    public StreamControlState withRunningTool(boolean value) {
        return new StreamControlState(isStreaming, streamingMessageId, streamingStart, hasStreamingMeta,
                value, isAgentOnlyStream, hasPendingCompletion);
    }

    public StreamControlState withPendingCompletion(boolean value) {
        return new StreamControlState(isStreaming, streamingMessageId, streamingStart, hasStreamingMeta,
                hasRunningTool, isAgentOnlyStream, value);
    }
}
