package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.IntentSlots;
import com.purchasingpower.micros.workflow.state.ValidationIssue;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Chooses the single question to ask when the turn cannot complete.
 *
 * Order: a validation issue, then the first unmet requirement of the intent, then a
 * question the handler already asked, then a generic request for detail.
 */
@Slf4j
@Component
public class ElicitationAgent {

    public static final String WHICH_FOOD_TO_LOG = "Which food would you like to log? You can say a name or provide food_id.";
    public static final String HOW_MANY_GRAMS = "How many grams?";
    public static final String WHICH_MEAL = "Which meal was this for (breakfast/lunch/dinner/snack)?";
    public static final String WHAT_TO_SEARCH = "What food would you like to search for?";
    public static final String WHICH_UPC = "Please provide the UPC (12 digits).";
    public static final String WHICH_DAY = "For which day? You can say 'today' or 'yesterday'.";
    public static final String GENERIC = "Could you clarify your request with a bit more detail?";

    public Map<String, Object> execute(ConversationState state) {
        ValidationIssue issue = state.getValidationIssue();
        if (issue != null) {
            log.info("❓ Asking about invalid {}: {}", issue.field(), issue.question());
            return ConversationState.clarification(issue.question(), issue.response());
        }

        Optional<String> missing = firstUnmet(state);
        if (missing.isPresent()) {
            log.info("❓ Asking for missing information: {}", missing.get());
            return ConversationState.clarification(missing.get(), null);
        }

        List<String> asked = state.getQuestions();
        if (state.isNeedsClarification() && asked.size() == 1) {
            log.info("❓ Keeping handler question: {}", asked.get(0));
            return ConversationState.clarification(asked.get(0), state.getResponse());
        }

        log.info("❓ Nothing specific missing, asking for detail");
        return ConversationState.clarification(GENERIC, null);
    }

    static Optional<String> firstUnmet(ConversationState state) {
        IntentSlots slots = state.getSlots();

        if (slots instanceof IntentSlots.LogMeal logMeal) {
            if (!state.hasPriorFoodChoice()) {
                return Optional.of(WHICH_FOOD_TO_LOG);
            }
            List<FoodSummary> candidates = state.getCandidates();
            if (logMeal.foodId() == null && state.getSelected() == null
                    && state.getCandidateSource() != CandidateSource.BROWSE && candidates.size() > 1) {
                return Optional.of(whichOf(candidates.size()));
            }
            if (!logMeal.hasAmount()) {
                return Optional.of(HOW_MANY_GRAMS);
            }
            if (!logMeal.hasMealType()) {
                return Optional.of(WHICH_MEAL);
            }
            return Optional.empty();
        }
        if (slots instanceof IntentSlots.FoodSearch search) {
            return search.hasFoodName() ? Optional.empty() : Optional.of(WHAT_TO_SEARCH);
        }
        if (slots instanceof IntentSlots.Barcode barcode) {
            return barcode.hasUpc() ? Optional.empty() : Optional.of(WHICH_UPC);
        }
        if (slots instanceof IntentSlots.Day day) {
            return day.hasDate() ? Optional.empty() : Optional.of(WHICH_DAY);
        }
        return Optional.empty();
    }

    static String whichOf(int count) {
        return "Which food (1-" + count + ")?";
    }
}
