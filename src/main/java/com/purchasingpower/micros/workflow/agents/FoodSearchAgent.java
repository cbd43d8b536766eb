package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.agent.HandlerKind;
import com.purchasingpower.micros.agent.ToolAssistedStep;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.service.FoodCatalogService;
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
 * Name search over the catalog.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FoodSearchAgent {

    private final ToolAssistedStep toolAssistedStep;
    private final FoodCatalogService foodCatalogService;
    private final AssistantConfig assistantConfig;

    public Map<String, Object> assist(ConversationState state) {
        return toolAssistedStep.run(HandlerKind.SEARCH, state);
    }

    public Map<String, Object> execute(ConversationState state) {
        IntentSlots.FoodSearch slots = state.getSlots() instanceof IntentSlots.FoodSearch search
                ? search
                : new IntentSlots.FoodSearch(null);
        if (!slots.hasFoodName()) {
            return ConversationState.clarification(ElicitationAgent.WHAT_TO_SEARCH, null);
        }

        String foodName = slots.foodName();

        List<FoodSummary> foods = foodCatalogService.searchByName(foodName, assistantConfig.getSearch().getLimit());
        log.info("🔍 Search '{}' → {} results", foodName, foods.size());

        Map<String, Object> updates = new HashMap<>();
        if (foods.isEmpty()) {
            updates.put(ConversationState.RESPONSE,
                    "No foods found matching '" + foodName + "'. Try a different search term.");
            return updates;
        }
        updates.put(ConversationState.CANDIDATES, new ArrayList<>(foods));
        updates.put(ConversationState.CANDIDATE_SOURCE, CandidateSource.SEARCH);
        updates.put(ConversationState.RESPONSE, "Found " + foods.size() + " food items.");
        return updates;
    }
}
