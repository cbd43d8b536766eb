package com.purchasingpower.micros.agent;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.micros.client.LLMProvider;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.CallContext;
import com.purchasingpower.micros.model.ServiceType;
import com.purchasingpower.micros.util.ExternalCallLogger;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.agent.tool.ToolSpecification;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Bounded model ↔ tool exchange.
 *
 * <p>Each round trip asks the model for its next turn; tool calls are executed and
 * their results appended to the transcript until the model answers with plain content.
 * The loop stops after {@code max-round-trips} model calls or when the deadline has
 * passed, whichever comes first. The transcript is local to one {@link #run} call.
 *
 * <p>Tool failures (unknown tool, bad arguments, exceptions) are reported back to the
 * model as failed results and never end the loop.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolInvocationLoop {

    private static final TypeReference<Map<String, Object>> ARGUMENTS_TYPE = new TypeReference<>() {
    };

    private final AssistantConfig assistantConfig;
    private final Clock clock;
    private final ObjectMapper objectMapper;

    public ToolLoopResult run(LLMProvider provider,
                              String agentName,
                              List<ChatMessage> initialTranscript,
                              List<Tool> tools,
                              ToolContext context) {

        AssistantConfig.ToolLoopConfig bounds = assistantConfig.getToolLoop();
        Instant deadline = clock.instant().plus(Duration.ofSeconds(bounds.getDeadlineSeconds()));

        List<ChatMessage> transcript = new ArrayList<>(initialTranscript);
        List<ToolSpecification> specifications = tools.stream()
                .map(Tool::toSpecification)
                .collect(Collectors.toList());
        Map<String, Tool> byName = new LinkedHashMap<>();
        tools.forEach(tool -> byName.put(tool.getName(), tool));

        int roundTrips = 0;
        while (true) {
            if (roundTrips >= bounds.getMaxRoundTrips()) {
                log.warn("⚠️ [{}] Tool loop stopped after {} round trips", agentName, roundTrips);
                return new ToolLoopResult.Exhausted(transcript, ToolLoopResult.StopReason.MAX_ROUND_TRIPS,
                        "Reached " + bounds.getMaxRoundTrips() + " round trips", roundTrips);
            }
            if (!clock.instant().isBefore(deadline)) {
                log.warn("⚠️ [{}] Tool loop deadline of {}s passed after {} round trips",
                        agentName, bounds.getDeadlineSeconds(), roundTrips);
                return new ToolLoopResult.Exhausted(transcript, ToolLoopResult.StopReason.DEADLINE,
                        "Deadline of " + bounds.getDeadlineSeconds() + "s passed", roundTrips);
            }

            AiMessage reply;
            try {
                reply = provider.chat(transcript, specifications, agentName);
            } catch (RuntimeException e) {
                log.warn("⚠️ [{}] Model call failed, ending tool loop: {}", agentName, e.getMessage());
                return new ToolLoopResult.Exhausted(transcript, ToolLoopResult.StopReason.MODEL_ERROR,
                        e.getMessage(), roundTrips + 1);
            }
            roundTrips++;
            transcript.add(reply);

            if (!reply.hasToolExecutionRequests()) {
                log.debug("[{}] Tool loop completed in {} round trips", agentName, roundTrips);
                return new ToolLoopResult.Completed(reply.text() != null ? reply.text() : "", transcript, roundTrips);
            }

            for (ToolExecutionRequest request : reply.toolExecutionRequests()) {
                ToolResult result = executeTool(request, byName, context, agentName);
                transcript.add(ToolExecutionResultMessage.from(request, toJson(result)));
            }
        }
    }

    private ToolResult executeTool(ToolExecutionRequest request, Map<String, Tool> byName, ToolContext context,
                                   String agentName) {
        Tool tool = byName.get(request.name());
        if (tool == null) {
            String validTools = String.join(", ", byName.keySet());
            log.warn("Unknown tool '{}'. Valid tools: {}", request.name(), validTools);
            return ToolResult.failure("Tool '" + request.name() + "' does not exist. Valid tools: " + validTools);
        }

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(request.arguments());
        } catch (JsonProcessingException e) {
            log.warn("Bad arguments for tool {}: {}", tool.getName(), e.getOriginalMessage());
            return ToolResult.failure("Arguments for '" + tool.getName() + "' are not a valid JSON object");
        }

        CallContext call = ExternalCallLogger.startCall(ServiceType.TOOL, tool.getName(), agentName, log);
        call.logRequest(arguments.toString());
        try {
            ToolResult result = tool.execute(arguments, context);
            call.logResponse((result.isSuccess() ? "ok: " : "failed: ") + result.getMessage());
            return result;
        } catch (NutritionDomainException e) {
            call.logResponse("domain error: " + e.getMessage());
            return ToolResult.failure(e.getMessage());
        } catch (RuntimeException e) {
            call.logError(e.getMessage(), e);
            return ToolResult.failure("Tool execution failed: " + e.getMessage());
        }
    }

    private Map<String, Object> parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return new HashMap<>();
        }
        Map<String, Object> parsed = objectMapper.readValue(arguments, ARGUMENTS_TYPE);
        return parsed != null ? parsed : new HashMap<>();
    }

    private String toJson(ToolResult result) {
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("success", result.isSuccess());
        payload.put("message", result.getMessage());
        if (result.getData() != null) {
            payload.put("data", result.getData());
        }
        try {
            return objectMapper.writeValueAsString(payload);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize tool result: {}", e.getOriginalMessage());
            return objectMapper.createObjectNode()
                    .put("success", result.isSuccess())
                    .put("message", result.getMessage())
                    .toString();
        }
    }
}
