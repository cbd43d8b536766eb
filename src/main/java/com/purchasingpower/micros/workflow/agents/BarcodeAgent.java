package com.purchasingpower.micros.workflow.agents;

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
 * Looks a product up by UPC. The first match becomes the selected food.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BarcodeAgent {

    private final FoodCatalogService foodCatalogService;

    public Map<String, Object> execute(ConversationState state) {
        IntentSlots.Barcode slots = state.getSlots() instanceof IntentSlots.Barcode barcode
                ? barcode
                : new IntentSlots.Barcode(null);

        if (!slots.hasUpc()) {
            return ConversationState.clarification("Please provide a UPC code to scan.",
                    "I need a UPC code to look up the product. Please provide the barcode number.");
        }

        String upc = slots.upc();
        log.info("📷 Looking up UPC {}", upc);
        List<FoodSummary> foods = foodCatalogService.lookupByUpc(upc);
        if (foods.isEmpty()) {
            return ConversationState.clarification("Would you like to search by name instead?",
                    "No food found with UPC " + upc + ". Would you like to search by name instead?");
        }

        FoodSummary first = foods.get(0);
        Map<String, Object> updates = new HashMap<>();
        updates.put(ConversationState.CANDIDATES, new ArrayList<>(foods));
        updates.put(ConversationState.CANDIDATE_SOURCE, CandidateSource.UPC_LOOKUP);
        updates.put(ConversationState.SELECTED, first);
        updates.put(ConversationState.RESPONSE, "Found " + first.getName() + " (" + first.getBrand() + "). "
                + first.getCalories() + " calories per 100g.");
        return updates;
    }
}
