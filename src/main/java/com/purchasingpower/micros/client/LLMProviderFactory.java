package com.purchasingpower.micros.client;

import com.purchasingpower.micros.configuration.AppProperties;
import dev.langchain4j.model.chat.ChatLanguageModel;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Resolves the active LLM provider from {@code app.llm-provider}.
 *
 * An empty result means no model is configured; callers then take their
 * deterministic path instead.
 */
@Slf4j
@Component
public class LLMProviderFactory {

    private final AppProperties appProperties;
    private final LLMProvider provider;

    public LLMProviderFactory(AppProperties appProperties, ObjectProvider<ChatLanguageModel> chatModel) {
        this.appProperties = appProperties;
        ChatLanguageModel model = chatModel.getIfAvailable();
        this.provider = model != null ? new LangChain4jProvider(model, describe(appProperties)) : null;
    }

    @PostConstruct
    public void init() {
        log.info("🚀 LLM Provider configured: {}", appProperties.getLlmProvider());
        if (provider == null) {
            log.info("   No chat model available - intent extraction and handlers use heuristics");
        } else {
            log.info("   Active provider: {}", provider.getProviderName());
        }
    }

    public Optional<LLMProvider> getProvider() {
        return Optional.ofNullable(provider);
    }

    private static String describe(AppProperties properties) {
        return switch (properties.getLlmProvider().toLowerCase()) {
            case "ollama" -> "Ollama (" + properties.getOllama().getChatModel() + ")";
            case "openai" -> "OpenAI (" + properties.getOpenai().getChatModel() + ")";
            case "gemini" -> "Gemini (" + properties.getGemini().getChatModel() + ")";
            default -> properties.getLlmProvider();
        };
    }
}
