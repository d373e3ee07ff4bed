package com.linlay.agentchat.stream;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Monotonic turn generation. Callbacks capture the value when scheduled and run only while it is still
 * current; invalidating bumps the counter so every callback of the cancelled turn becomes stale.
 */
public class StreamGeneration {

    private final AtomicLong current = new AtomicLong();

    public long current() {
        return current.get();
    }

    public long invalidate() {
        return current.incrementAndGet();
    }

    public boolean isCurrent(long callbackGeneration) {
        return isCurrent(current.get(), callbackGeneration);
    }

    public Runnable guard(Runnable callback) {
        long captured = current.get();
        return () -> {
            if (isCurrent(captured)) {
                callback.run();
            }
        };
    }

    public static long invalidate(long generation) {
        return generation + 1;
    }

    public static boolean isCurrent(long activeGeneration, long callbackGeneration) {
        return activeGeneration == callbackGeneration;
    }
}
