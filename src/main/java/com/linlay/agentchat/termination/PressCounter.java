package com.linlay.agentchat.termination;

import java.util.concurrent.atomic.AtomicInteger;

/**
 * Termination key press count owned by the input handler. Reads and writes are immediate so two presses
 * arriving in the same input tick each observe the other's update.
 */
public class PressCounter {

    private final AtomicInteger count = new AtomicInteger();

    public int get() {
        return count.get();
    }

    public void set(int value) {
        count.set(Math.max(0, value));
    }

    public void reset() {
        count.set(0);
    }
}
