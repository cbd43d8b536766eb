package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.agent.HandlerKind;
import com.purchasingpower.micros.agent.ToolAssistedStep;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.service.FoodCatalogService;
import com.purchasingpower.micros.service.MealLogService;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.IntentSlots;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Records a meal once the food and amount are known.
 *
 * <ol>
 *   <li>explicit food_id: needs a valid amount, then logs</li>
 *   <li>no food chosen yet: offers a browse list and asks which food</li>
 *   <li>several candidates and none selected: asks which one</li>
 *   <li>otherwise logs the selected or only candidate</li>
 * </ol>
 *
 * An amount that fails validation is left for the evaluator to report; nothing is logged.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MealLoggingAgent {

    private final ToolAssistedStep toolAssistedStep;
    private final MealLogService mealLogService;
    private final FoodCatalogService foodCatalogService;
    private final GramsNormalizer gramsNormalizer;
    private final AssistantConfig assistantConfig;

    public Map<String, Object> assist(ConversationState state) {
        return toolAssistedStep.run(HandlerKind.LOGGING, state);
    }

    public Map<String, Object> execute(ConversationState state) {
        LogRecord alreadyLogged = state.getLogResult();
        if (alreadyLogged != null) {
            log.info("📝 Meal {} already logged by the tool loop", alreadyLogged.getId());
            return Map.of(ConversationState.RESPONSE, describe(alreadyLogged));
        }

        IntentSlots.LogMeal slots = state.getSlots() instanceof IntentSlots.LogMeal logMeal
                ? logMeal
                : new IntentSlots.LogMeal(null, null, null, null);
        if (slots.foodId() != null) {
            return logIfAmountValid(state, slots, slots.foodId());
        }

        if (!state.hasPriorFoodChoice()) {
            List<FoodSummary> suggestions = foodCatalogService.listFoods(assistantConfig.getLogging().getBrowseLimit(), 0);
            Map<String, Object> updates = ConversationState.clarification(ElicitationAgent.WHICH_FOOD_TO_LOG,
                    "What food would you like to log?");
            if (!suggestions.isEmpty()) {
                updates.put(ConversationState.CANDIDATES, new ArrayList<>(suggestions));
                updates.put(ConversationState.CANDIDATE_SOURCE, CandidateSource.BROWSE);
            }
            return updates;
        }

        FoodSummary food = state.getSelected();
        if (food == null) {
            List<FoodSummary> candidates = state.getCandidates();
            if (candidates.size() > 1) {
                return ConversationState.clarification(ElicitationAgent.whichOf(candidates.size()),
                        "Please specify which food item you'd like to log.");
            }
            food = candidates.get(0);
        }
        return logIfAmountValid(state, slots, food.getId());
    }

    private Map<String, Object> logIfAmountValid(ConversationState state, IntentSlots.LogMeal slots, long foodId) {
        GramsNormalizer.GramsCheck grams = gramsNormalizer.check(slots.grams(), slots.gramsText());
        if (grams.status() == GramsNormalizer.Status.ABSENT) {
            return ConversationState.clarification(GramsNormalizer.GRAMS_QUESTION,
                    "How many grams would you like to log?");
        }
        if (!grams.isValid()) {
            return Map.of();
        }

        String mealType = slots.hasMealType()
                ? slots.mealType()
                : assistantConfig.getLogging().getDefaultMealType();

        try {
            LogRecord record = mealLogService.createMealLog(state.getUserId(), foodId, grams.grams(), mealType, null);
            Map<String, Object> updates = new HashMap<>();
            updates.put(ConversationState.LOG_RESULT, record);
            updates.put(ConversationState.RESPONSE, describe(record));
            return updates;
        } catch (NutritionDomainException e) {
            log.warn("⚠️ Could not log meal: {}", e.getMessage());
            Map<String, Object> updates = new HashMap<>();
            updates.put(ConversationState.RESPONSE, "Error logging meal: " + e.getMessage());
            updates.put(ConversationState.DOMAIN_ERROR, e.getKind());
            return updates;
        }
    }

    private static String describe(LogRecord record) {
        return "Logged " + record.getGrams() + "g of " + record.getFoodName() + " (" + record.getMealType() + ").";
    }
}
