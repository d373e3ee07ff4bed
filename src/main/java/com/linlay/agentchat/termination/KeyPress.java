package com.linlay.agentchat.termination;

/**
 * Decoded key event as delivered by the terminal layer.
 */
public record KeyPress(String name, boolean ctrl, boolean shift, boolean meta) {

    public static KeyPress ctrl(String name) {
        return new KeyPress(name, true, false, false);
    }
}
