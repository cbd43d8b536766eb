package com.purchasingpower.micros.agent;

import dev.langchain4j.data.message.ChatMessage;

import java.util.List;

/**
 * Outcome of one {@link ToolInvocationLoop} run.
 */
public interface ToolLoopResult {

    List<ChatMessage> transcript();

    int roundTrips();

    /**
     * The model answered with plain content.
     */
    record Completed(String content, List<ChatMessage> transcript, int roundTrips) implements ToolLoopResult {
    }

    /**
     * The loop stopped before the model answered. Not an error: the handler finalizes
     * with what the tools produced so far.
     */
    record Exhausted(List<ChatMessage> transcript, StopReason reason, String detail, int roundTrips)
            implements ToolLoopResult {
    }

    enum StopReason {
        MAX_ROUND_TRIPS,
        DEADLINE,
        MODEL_ERROR
    }
}
