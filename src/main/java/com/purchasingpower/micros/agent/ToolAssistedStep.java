package com.purchasingpower.micros.agent;

import com.purchasingpower.micros.agent.impl.ToolContextImpl;
import com.purchasingpower.micros.client.LLMProvider;
import com.purchasingpower.micros.client.LLMProviderFactory;
import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.service.PromptLibraryService;
import com.purchasingpower.micros.util.DateResolver;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.ExtractedEntities;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Entry step of a tool-assisted handler: runs the handler's tool loop and copies what
 * the tools produced (entity hints, candidates, a logged meal) into a state update.
 *
 * <p>Returns an empty update when no model is configured, so the handler's finalize
 * step works from the extracted entities alone.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ToolAssistedStep {

    private final LLMProviderFactory llmProviderFactory;
    private final HandlerToolsets handlerToolsets;
    private final ToolInvocationLoop toolInvocationLoop;
    private final PromptLibraryService promptLibrary;
    private final DateResolver dateResolver;
    private final GramsNormalizer gramsNormalizer;

    public Map<String, Object> run(HandlerKind kind, ConversationState state) {
        Optional<LLMProvider> provider = llmProviderFactory.getProvider();
        if (provider.isEmpty()) {
            return Map.of();
        }

        Long userId = state.getUserId();
        ToolContextImpl context = ToolContextImpl.builder()
                .userId(userId != null ? userId : 0L)
                .requestedAmount(gramsNormalizer.check(state.getEntities()))
                .build();

        Map<String, Object> variables = new HashMap<>();
        variables.put("userId", userId);
        variables.put("today", dateResolver.today().toString());

        List<ChatMessage> transcript = new ArrayList<>();
        transcript.add(SystemMessage.from(promptLibrary.renderSystem(kind.getPromptName(), variables)));
        transcript.add(UserMessage.from(state.getInputText()));

        ToolLoopResult result = toolInvocationLoop.run(
                provider.get(), kind.getPromptName(), transcript, handlerToolsets.forHandler(kind), context);

        Map<String, Object> updates = harvest(state, context);
        if (result instanceof ToolLoopResult.Exhausted exhausted) {
            log.warn("⚠️ {} finished degraded ({}): {}", kind, exhausted.reason(), exhausted.detail());
            updates.put(ConversationState.DEGRADED, true);
        } else {
            log.info("✅ {} tool loop completed in {} round trips", kind, result.roundTrips());
        }
        return updates;
    }

    private Map<String, Object> harvest(ConversationState state, ToolContext context) {
        Map<String, Object> updates = new HashMap<>();

        ExtractedEntities entities = state.getEntities();
        ExtractedEntities filled = fillFromHints(entities, context.getHints());
        if (!filled.equals(entities)) {
            updates.put(ConversationState.ENTITIES, filled);
        }

        List<?> candidates = context.getCandidates();
        if (!candidates.isEmpty()
                && (state.getCandidates().isEmpty() || context.getCandidateSource() != CandidateSource.BROWSE)) {
            updates.put(ConversationState.CANDIDATES, new ArrayList<>(context.getCandidates()));
            updates.put(ConversationState.CANDIDATE_SOURCE, context.getCandidateSource());
        }

        context.getLoggedMeal().ifPresent(record -> updates.put(ConversationState.LOG_RESULT, record));
        return updates;
    }

    /**
     * Only slots the user left empty are taken from tool arguments.
     */
    private static ExtractedEntities fillFromHints(ExtractedEntities entities, Map<String, Object> hints) {
        ExtractedEntities.ExtractedEntitiesBuilder builder = entities.toBuilder();
        if (!entities.hasFoodName() && hints.get("food_name") instanceof String foodName) {
            builder.foodName(foodName);
        }
        if (!entities.hasUpc() && hints.get("upc") instanceof String upc) {
            builder.upc(upc);
        }
        if (!entities.hasDate() && hints.get("date") instanceof String date) {
            builder.date(date);
        }
        if (entities.getFoodId() == null && hints.get("food_id") instanceof Long foodId) {
            builder.foodId(foodId);
        }
        if (!entities.hasAmount() && hints.get("grams") instanceof Double grams) {
            builder.grams(grams);
        }
        if (!entities.hasMealType() && hints.get("meal_type") instanceof String mealType) {
            builder.mealType(mealType);
        }
        return builder.build();
    }
}
