package com.linlay.agentchat.transcript;

import com.linlay.agentchat.config.AgentSessionProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Live conversation of the session. Holds at most {@code agent.session.window-size} messages; older ones are
 * moved to the {@link ConversationHistoryBuffer} and counted in {@link #trimmedCount()}.
 */
@Service
public class TranscriptService {

    private static final Logger log = LoggerFactory.getLogger(TranscriptService.class);

    private final ConversationHistoryBuffer historyBuffer;
    private final int windowSize;

    private List<ChatMessage> messages = List.of();
    private int trimmedCount;

    public TranscriptService(ConversationHistoryBuffer historyBuffer, AgentSessionProperties properties) {
        this.historyBuffer = Objects.requireNonNull(historyBuffer, "historyBuffer must not be null");
        this.windowSize = Math.max(1, properties.getWindowSize());
    }

    public synchronized void append(ChatMessage message) {
        Objects.requireNonNull(message, "message must not be null");
        List<ChatMessage> next = new ArrayList<>(messages);
        next.add(message);
        MessageWindow.Applied<ChatMessage> applied = MessageWindow.apply(next, windowSize);
        if (applied.evictedCount() > 0) {
            historyBuffer.append(applied.evictedMessages());
            trimmedCount += applied.evictedCount();
            log.debug("Evicted {} messages to history buffer, trimmedCount={}", applied.evictedCount(), trimmedCount);
        }
        messages = List.copyOf(applied.inMemoryMessages());
    }

    /**
     * Replaces the in-memory message with the given id.
     *
     * @return false when the message is no longer in memory
     */
    public synchronized boolean update(String messageId, UnaryOperator<ChatMessage> change) {
        if (messageId == null) {
            return false;
        }
        List<ChatMessage> next = new ArrayList<>(messages.size());
        boolean updated = false;
        for (ChatMessage message : messages) {
            if (!updated && messageId.equals(message.id())) {
                next.add(Objects.requireNonNull(change.apply(message), "updated message must not be null"));
                updated = true;
            } else {
                next.add(message);
            }
        }
        if (updated) {
            messages = List.copyOf(next);
        }
        return updated;
    }

    public synchronized Optional<ChatMessage> find(String messageId) {
        return messages.stream().filter(message -> Objects.equals(message.id(), messageId)).findFirst();
    }

    public synchronized List<ChatMessage> messages() {
        return messages;
    }

    public synchronized int trimmedCount() {
        return trimmedCount;
    }

    public synchronized MessageWindow.Visible<ChatMessage> visibleWindow() {
        return MessageWindow.visible(messages, trimmedCount, windowSize);
    }

    /**
     * Persisted overflow followed by the in-memory messages.
     */
    public synchronized List<ChatMessage> fullTranscript() {
        List<ChatMessage> transcript = new ArrayList<>(historyBuffer.read());
        transcript.addAll(messages);
        return List.copyOf(transcript);
    }

    public synchronized void clear() {
        messages = List.of();
        trimmedCount = 0;
        historyBuffer.clear();
        log.info("Transcript cleared");
    }

    /**
     * Drops the live conversation and leaves only the summary marker in the history buffer.
     */
    public synchronized ChatMessage compact(String summary) {
        ChatMessage marker = historyBuffer.appendCompactionSummary(summary);
        messages = List.of();
        trimmedCount = 0;
        log.info("Transcript compacted into {}", marker.id());
        return marker;
    }
}
