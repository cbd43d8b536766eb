package com.purchasingpower.micros.client;

import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;

import java.util.List;

/**
 * Chat access to the configured language model.
 */
public interface LLMProvider {

    /**
     * Single-prompt completion.
     *
     * @param prompt    The prompt to send
     * @param agentName Name of the calling agent (for logging)
     * @return The model's response text
     */
    String chat(String prompt, String agentName);

    /**
     * Next assistant turn for a transcript, with the given tools on offer.
     * The returned message carries text, tool execution requests, or both.
     */
    AiMessage chat(List<ChatMessage> transcript, List<ToolSpecification> tools, String agentName);

    /**
     * Get the provider name (for logging).
     */
    String getProviderName();
}
