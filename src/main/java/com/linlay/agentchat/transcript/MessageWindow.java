package com.linlay.agentchat.transcript;

import java.util.List;

/**
 * Bounds how many messages stay in memory.
 */
public final class MessageWindow {

    private MessageWindow() {
    }

    /**
     * Splits the list into the evicted prefix and the most recent {@code maxInMemory} messages.
     */
    public static <T> Applied<T> apply(List<T> messages, int maxInMemory) {
        List<T> safeMessages = messages == null ? List.of() : messages;
        int cap = Math.max(0, maxInMemory);
        if (safeMessages.size() <= cap) {
            return new Applied<>(safeMessages, List.of());
        }
        int evictedCount = safeMessages.size() - cap;
        return new Applied<>(
                List.copyOf(safeMessages.subList(evictedCount, safeMessages.size())),
                List.copyOf(safeMessages.subList(0, evictedCount))
        );
    }

    /**
     * @param trimmedCount messages already evicted during this session
     */
    public static <T> Visible<T> visible(List<T> inMemory, int trimmedCount, int maxVisible) {
        List<T> safeMessages = inMemory == null ? List.of() : inMemory;
        int cap = Math.max(0, maxVisible);
        int overflow = Math.max(0, safeMessages.size() - cap);
        List<T> visibleMessages = overflow == 0
                ? safeMessages
                : List.copyOf(safeMessages.subList(overflow, safeMessages.size()));
        return new Visible<>(visibleMessages, Math.max(0, trimmedCount) + overflow);
    }

    public record Applied<T>(List<T> inMemoryMessages, List<T> evictedMessages) {

        public int evictedCount() {
            return evictedMessages.size();
        }
    }

    public record Visible<T>(List<T> visibleMessages, int hiddenMessageCount) {
    }
}
