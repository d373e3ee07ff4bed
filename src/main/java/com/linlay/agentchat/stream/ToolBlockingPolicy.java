package com.linlay.agentchat.stream;

import java.util.Locale;

/**
 * Decides which tools hold a turn open and when user input may be dispatched while tools run.
 */
public final class ToolBlockingPolicy {

    private static final String ASK_QUESTION_TOOL = "ask_question";
    // skill loaders may report start without a matching complete
    private static final String NON_BLOCKING_TOOL = "skill";

    private ToolBlockingPolicy() {
    }

    public static boolean isAskQuestionTool(String toolName) {
        return matchesSuffix(toolName, ASK_QUESTION_TOOL);
    }

    public static boolean isBlocking(String toolName) {
        String normalized = normalize(toolName);
        if (normalized.isEmpty()) {
            return true;
        }
        return !matchesSuffix(normalized, NON_BLOCKING_TOOL);
    }

    public static boolean isTaskTool(String toolName) {
        String normalized = normalize(toolName);
        return normalized.equals("task") || normalized.equals("agent");
    }

    public static boolean shouldDeferComposerSubmit(boolean isStreaming, int runningAskQuestionTools) {
        return isStreaming && runningAskQuestionTools > 0;
    }

    public static boolean shouldDispatchQueuedMessage(boolean isStreaming, int runningAskQuestionTools) {
        return !isStreaming && runningAskQuestionTools == 0;
    }

    private static boolean matchesSuffix(String toolName, String suffix) {
        String normalized = normalize(toolName);
        return normalized.equals(suffix)
                || normalized.endsWith("/" + suffix)
                || normalized.endsWith("__" + suffix);
    }

    private static String normalize(String toolName) {
        return toolName == null ? "" : toolName.trim().toLowerCase(Locale.ROOT);
    }
}
