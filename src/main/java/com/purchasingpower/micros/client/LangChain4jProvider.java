package com.purchasingpower.micros.client;

import com.purchasingpower.micros.model.CallContext;
import com.purchasingpower.micros.model.ServiceType;
import com.purchasingpower.micros.util.ExternalCallLogger;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.model.chat.ChatLanguageModel;
import dev.langchain4j.model.output.Response;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * {@link LLMProvider} over a langchain4j {@link ChatLanguageModel}.
 * Timeouts and retries are configured on the model itself.
 */
@Slf4j
public class LangChain4jProvider implements LLMProvider {

    private final ChatLanguageModel model;
    private final String providerName;

    public LangChain4jProvider(ChatLanguageModel model, String providerName) {
        this.model = model;
        this.providerName = providerName;
    }

    @Override
    public String chat(String prompt, String agentName) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.LLM, "chat", agentName, log);
        call.logRequest("provider=" + providerName + ", prompt=" + ExternalCallLogger.truncate(prompt, 200));
        try {
            String content = model.generate(prompt);
            call.logResponse(ExternalCallLogger.truncate(content, 500));
            return content;
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public AiMessage chat(List<ChatMessage> transcript, List<ToolSpecification> tools, String agentName) {
        CallContext call = ExternalCallLogger.startCall(ServiceType.LLM, "chat-with-tools", agentName, log);
        call.logRequest("provider=" + providerName + ", messages=" + transcript.size() + ", tools=" + tools.size());
        try {
            Response<AiMessage> response = tools.isEmpty()
                    ? model.generate(transcript)
                    : model.generate(transcript, tools);
            AiMessage message = response.content();
            call.logResponse(message.hasToolExecutionRequests()
                    ? message.toolExecutionRequests().size() + " tool call(s)"
                    : ExternalCallLogger.truncate(message.text(), 500));
            return message;
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            throw e;
        }
    }

    @Override
    public String getProviderName() {
        return providerName;
    }
}
