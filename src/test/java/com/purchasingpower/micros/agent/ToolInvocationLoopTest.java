package com.purchasingpower.micros.agent;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.micros.agent.impl.ToolContextImpl;
import com.purchasingpower.micros.client.LLMProvider;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.exception.NutritionDomainException;
import dev.langchain4j.agent.tool.ToolExecutionRequest;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.ToolExecutionResultMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class ToolInvocationLoopTest {

    private static final List<ChatMessage> START = List.of(UserMessage.from("what did I eat?"));

    private AssistantConfig config;
    private MutableClock clock;
    private LLMProvider provider;
    private ToolInvocationLoop loop;
    private ToolContextImpl context;
    private EchoTool echo;

    @BeforeEach
    void setUp() {
        config = new AssistantConfig();
        config.getToolLoop().setMaxRoundTrips(3);
        config.getToolLoop().setDeadlineSeconds(30);
        clock = new MutableClock(Instant.parse("2024-05-01T12:00:00Z"));
        provider = mock(LLMProvider.class);
        loop = new ToolInvocationLoop(config, clock, new ObjectMapper());
        context = ToolContextImpl.forUser(1);
        echo = new EchoTool();
    }

    @Test
    @DisplayName("Plain model content completes the loop")
    void completesOnContent() {
        // Given
        when(provider.chat(anyList(), anyList(), anyString())).thenReturn(AiMessage.from("All done."));

        // When
        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        // Then
        assertThat(result).isInstanceOf(ToolLoopResult.Completed.class);
        assertThat(((ToolLoopResult.Completed) result).content()).isEqualTo("All done.");
        assertThat(result.roundTrips()).isEqualTo(1);
        assertThat(result.transcript()).hasSize(2);
    }

    @Test
    @DisplayName("Tool results are appended before the next model call")
    void executesToolThenCompletes() {
        when(provider.chat(anyList(), anyList(), anyString()))
                .thenReturn(AiMessage.from(call("echo", "{\"text\":\"oats\"}")))
                .thenReturn(AiMessage.from("Echoed."));

        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        assertThat(result).isInstanceOf(ToolLoopResult.Completed.class);
        assertThat(result.roundTrips()).isEqualTo(2);
        assertThat(toolResultText(result)).contains("\"success\":true").contains("oats");
        assertThat(echo.executions).isEqualTo(1);
        assertThat(context.getHints()).containsEntry("food_name", "oats");
    }

    @Test
    @DisplayName("A model that keeps calling tools is stopped at the round-trip bound")
    void exhaustsAtMaxRoundTrips() {
        when(provider.chat(anyList(), anyList(), anyString()))
                .thenReturn(AiMessage.from(call("echo", "{\"text\":\"again\"}")));

        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        assertThat(result).isInstanceOf(ToolLoopResult.Exhausted.class);
        assertThat(((ToolLoopResult.Exhausted) result).reason()).isEqualTo(ToolLoopResult.StopReason.MAX_ROUND_TRIPS);
        assertThat(result.roundTrips()).isEqualTo(3);
        verify(provider, times(3)).chat(anyList(), anyList(), anyString());
    }

    @Test
    @DisplayName("No model call is made once the deadline has passed")
    void stopsAtDeadline() {
        when(provider.chat(anyList(), anyList(), anyString())).thenAnswer(invocation -> {
            clock.advance(Duration.ofSeconds(31));
            return AiMessage.from(call("echo", "{\"text\":\"slow\"}"));
        });

        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        assertThat(((ToolLoopResult.Exhausted) result).reason()).isEqualTo(ToolLoopResult.StopReason.DEADLINE);
        assertThat(result.roundTrips()).isEqualTo(1);
        verify(provider, times(1)).chat(anyList(), anyList(), anyString());
    }

    @Test
    void unknownToolIsReportedToTheModel() {
        when(provider.chat(anyList(), anyList(), anyString()))
                .thenReturn(AiMessage.from(call("tool_delete_everything", "{}")))
                .thenReturn(AiMessage.from("Sorry."));

        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        assertThat(result).isInstanceOf(ToolLoopResult.Completed.class);
        assertThat(toolResultText(result))
                .contains("\"success\":false")
                .contains("Tool 'tool_delete_everything' does not exist. Valid tools: echo");
    }

    @Test
    void badArgumentsAreReportedToTheModel() {
        when(provider.chat(anyList(), anyList(), anyString()))
                .thenReturn(AiMessage.from(call("echo", "not json")))
                .thenReturn(AiMessage.from("Retrying later."));

        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        assertThat(toolResultText(result)).contains("Arguments for 'echo' are not a valid JSON object");
        assertThat(echo.executions).isZero();
    }

    @Test
    void toolExceptionsDoNotEndTheLoop() {
        when(provider.chat(anyList(), anyList(), anyString()))
                .thenReturn(AiMessage.from(call("echo", "{\"text\":\"boom\"}")))
                .thenReturn(AiMessage.from(call("echo", "{\"text\":\"missing\"}")))
                .thenReturn(AiMessage.from("Gave up."));

        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        assertThat(result).isInstanceOf(ToolLoopResult.Completed.class);
        List<String> toolTexts = result.transcript().stream()
                .filter(ToolExecutionResultMessage.class::isInstance)
                .map(m -> ((ToolExecutionResultMessage) m).text())
                .collect(Collectors.toList());
        assertThat(toolTexts).hasSize(2);
        assertThat(toolTexts.get(0)).contains("Tool execution failed: kaboom");
        assertThat(toolTexts.get(1)).contains("Food not found: 99");
    }

    @Test
    @DisplayName("A result that cannot be serialized still reaches the model as valid JSON")
    void unserializableResultFallsBackToValidJson() throws Exception {
        // Given - the tool returns data Jackson cannot write and a message with quotes
        when(provider.chat(anyList(), anyList(), anyString()))
                .thenReturn(AiMessage.from(call("echo", "{\"text\":\"opaque\"}")))
                .thenReturn(AiMessage.from("Done."));

        // When
        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        // Then
        JsonNode payload = new ObjectMapper().readTree(toolResultText(result));
        assertThat(payload.get("success").asBoolean()).isTrue();
        assertThat(payload.get("message").asText()).isEqualTo("Echoed \"opaque\"\\ as-is");
        assertThat(payload.has("data")).isFalse();
    }

    @Test
    void modelErrorEndsTheLoop() {
        when(provider.chat(anyList(), anyList(), anyString())).thenThrow(new IllegalStateException("connection refused"));

        ToolLoopResult result = loop.run(provider, "test", START, List.of(echo), context);

        ToolLoopResult.Exhausted exhausted = (ToolLoopResult.Exhausted) result;
        assertThat(exhausted.reason()).isEqualTo(ToolLoopResult.StopReason.MODEL_ERROR);
        assertThat(exhausted.detail()).isEqualTo("connection refused");
        assertThat(exhausted.roundTrips()).isEqualTo(1);
    }

    private static ToolExecutionRequest call(String name, String arguments) {
        return ToolExecutionRequest.builder().id("call-" + name).name(name).arguments(arguments).build();
    }

    private static String toolResultText(ToolLoopResult result) {
        return result.transcript().stream()
                .filter(ToolExecutionResultMessage.class::isInstance)
                .map(m -> ((ToolExecutionResultMessage) m).text())
                .findFirst()
                .orElseThrow();
    }

    private static class EchoTool implements Tool {

        private int executions;

        @Override
        public String getName() {
            return "echo";
        }

        @Override
        public String getDescription() {
            return "Echoes its text argument";
        }

        @Override
        public JsonObjectSchema getParameters() {
            return JsonObjectSchema.builder()
                    .addProperty("text", JsonStringSchema.builder().description("Text to echo").build())
                    .required("text")
                    .build();
        }

        @Override
        public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
            executions++;
            String text = String.valueOf(parameters.get("text"));
            if ("boom".equals(text)) {
                throw new IllegalStateException("kaboom");
            }
            if ("missing".equals(text)) {
                throw NutritionDomainException.foodNotFound(99);
            }
            if ("opaque".equals(text)) {
                return ToolResult.success(new Object(), "Echoed \"opaque\"\\ as-is");
            }
            context.hint("food_name", text);
            return ToolResult.success(Map.of("echo", text), "Echoed " + text);
        }

        @Override
        public ToolCategory getCategory() {
            return ToolCategory.LOOKUP;
        }
    }

    private static class MutableClock extends Clock {

        private Instant now;

        MutableClock(Instant start) {
            this.now = start;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }
    }
}
