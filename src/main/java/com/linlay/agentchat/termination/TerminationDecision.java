package com.linlay.agentchat.termination;

public record TerminationDecision(Action action, String message) {

    public static final String WARN_MESSAGE = "Press Ctrl-F again to terminate background agents";
    public static final String TERMINATE_MESSAGE = "All background agents killed";

    private static final TerminationDecision NONE = new TerminationDecision(Action.NONE, null);
    private static final TerminationDecision WARN = new TerminationDecision(Action.WARN, WARN_MESSAGE);
    private static final TerminationDecision TERMINATE = new TerminationDecision(Action.TERMINATE, TERMINATE_MESSAGE);

    public TerminationDecision {
        if (action == null) {
            throw new IllegalArgumentException("action must not be null");
        }
    }

    public static TerminationDecision none() {
        return NONE;
    }

    public static TerminationDecision warn() {
        return WARN;
    }

    public static TerminationDecision terminate() {
        return TERMINATE;
    }

    public enum Action {
        NONE,
        WARN,
        TERMINATE
    }
}
