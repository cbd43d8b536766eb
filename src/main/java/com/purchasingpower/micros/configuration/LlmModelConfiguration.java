package com.purchasingpower.micros.configuration;

import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.googleai.GoogleAiGeminiChatModel;
import dev.langchain4j.model.ollama.OllamaChatModel;
import dev.langchain4j.model.openai.OpenAiChatModel;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Builds the single chat model used for intent classification and tool loops.
 *
 * Selected by {@code app.llm-provider}. With {@code none} (the default) no model bean
 * exists and the assistant runs on its heuristic paths.
 *
 * Every model carries the same timeout, retry count and temperature from
 * {@code app.llm.*}; retries happen here and nowhere else.
 */
@Slf4j
@Configuration
public class LlmModelConfiguration {

    @Bean("assistantChatModel")
    @ConditionalOnProperty(prefix = "app", name = "llm-provider", havingValue = "ollama")
    public ChatLanguageModel ollamaChatModel(AppProperties appProperties) {
        LlmProperties llm = appProperties.getLlm();
        OllamaProperties ollama = appProperties.getOllama();

        log.info("🔧 Initializing chat model (Ollama - Local)");
        log.info("   - URL: {}", ollama.getBaseUrl());
        log.info("   - Model: {}", ollama.getChatModel());

        ChatLanguageModel model = OllamaChatModel.builder()
                .baseUrl(ollama.getBaseUrl())
                .modelName(ollama.getChatModel())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .temperature(llm.getTemperature())
                .maxRetries(llm.getMaxRetries())
                .logRequests(llm.isLogRequests())
                .logResponses(llm.isLogResponses())
                .build();

        log.info("✅ Chat model initialized");
        return model;
    }

    @Bean("assistantChatModel")
    @ConditionalOnProperty(prefix = "app", name = "llm-provider", havingValue = "openai")
    public ChatLanguageModel openAiChatModel(AppProperties appProperties) {
        LlmProperties llm = appProperties.getLlm();
        OpenAiProperties openai = appProperties.getOpenai();
        requireApiKey(openai.getApiKey(), "app.openai.api-key");

        log.info("🔧 Initializing chat model (OpenAI - Cloud)");
        log.info("   - Model: {}", openai.getChatModel());

        ChatLanguageModel model = OpenAiChatModel.builder()
                .apiKey(openai.getApiKey())
                .modelName(openai.getChatModel())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .temperature(llm.getTemperature())
                .maxRetries(llm.getMaxRetries())
                .logRequests(llm.isLogRequests())
                .logResponses(llm.isLogResponses())
                .build();

        log.info("✅ Chat model initialized");
        return model;
    }

    @Bean("assistantChatModel")
    @ConditionalOnProperty(prefix = "app", name = "llm-provider", havingValue = "gemini")
    public ChatLanguageModel geminiChatModel(AppProperties appProperties) {
        LlmProperties llm = appProperties.getLlm();
        GeminiProperties gemini = appProperties.getGemini();
        requireApiKey(gemini.getApiKey(), "app.gemini.api-key");

        log.info("🧠 Initializing chat model (Gemini - Cloud)");
        log.info("   - Model: {}", gemini.getChatModel());

        ChatLanguageModel model = GoogleAiGeminiChatModel.builder()
                .apiKey(gemini.getApiKey())
                .modelName(gemini.getChatModel())
                .timeout(Duration.ofSeconds(llm.getTimeoutSeconds()))
                .temperature(llm.getTemperature())
                .maxRetries(llm.getMaxRetries())
                .build();

        log.info("✅ Chat model initialized");
        return model;
    }

    private static void requireApiKey(String apiKey, String property) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException(property + " must be set for the selected LLM provider");
        }
    }
}
