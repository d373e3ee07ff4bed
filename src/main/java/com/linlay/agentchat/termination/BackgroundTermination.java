package com.linlay.agentchat.termination;

/**
 * Double-press confirmation for killing background agents.
 * <p>
 * The first Ctrl+F warns, the second terminates. With no active background agent nothing happens and a
 * stale press count is cleared.
 */
public final class BackgroundTermination {

    private BackgroundTermination() {
    }

    /**
     * Ctrl+F only. Ctrl+Shift+F and Ctrl+Meta+F stay free for other bindings.
     */
    public static boolean isTerminationKey(KeyPress key) {
        return key != null
                && key.ctrl()
                && !key.shift()
                && !key.meta()
                && "f".equals(key.name());
    }

    public static TerminationDecision decide(int pressCount, int activeBackgroundAgentCount) {
        if (activeBackgroundAgentCount <= 0) {
            return TerminationDecision.none();
        }
        if (pressCount >= 1) {
            return TerminationDecision.terminate();
        }
        return TerminationDecision.warn();
    }

    /**
     * Decides on a key press and advances the counter in the same call.
     */
    public static PressEvaluation evaluatePress(PressCounter counter, int activeBackgroundAgentCount) {
        int pressCount = counter.get();
        TerminationDecision decision = decide(pressCount, activeBackgroundAgentCount);
        int nextPressCount = decision.action() == TerminationDecision.Action.WARN ? pressCount + 1 : 0;
        counter.set(nextPressCount);
        return new PressEvaluation(pressCount, nextPressCount, decision);
    }

    public record PressEvaluation(int pressCount, int nextPressCount, TerminationDecision decision) {
    }
}
