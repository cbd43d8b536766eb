package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.agent.HandlerKind;
import com.purchasingpower.micros.agent.ToolAssistedStep;
import com.purchasingpower.micros.exception.DomainErrorKind;
import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.DaySummary;
import com.purchasingpower.micros.model.nutrition.Nutrient;
import com.purchasingpower.micros.service.DayAggregationService;
import com.purchasingpower.micros.service.GoalsService;
import com.purchasingpower.micros.util.DateResolver;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.IntentSlots;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Daily summary: totals for the requested day plus progress against the user's goals.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DailyAnalysisAgent {

    private final ToolAssistedStep toolAssistedStep;
    private final DayAggregationService dayAggregationService;
    private final GoalsService goalsService;
    private final DateResolver dateResolver;

    public Map<String, Object> assist(ConversationState state) {
        return toolAssistedStep.run(HandlerKind.ANALYSIS, state);
    }

    public Map<String, Object> execute(ConversationState state) {
        String reference = state.getSlots() instanceof IntentSlots.Day day ? day.date() : null;

        LocalDate date;
        try {
            date = dateResolver.resolve(reference);
        } catch (NutritionDomainException e) {
            return unreadableDate(reference, e);
        }

        try {
            DaySummary summary = dayAggregationService.computeDay(state.getUserId(), date);
            Map<String, Double> goals = goalsService.getGoals(state.getUserId());
            log.info("📊 Day {} for user {}: {} meals", date, state.getUserId(), summary.getMealCount());

            Map<String, Object> updates = new HashMap<>();
            updates.put(ConversationState.DAY_SUMMARY, summary);
            updates.put(ConversationState.RESPONSE, format(summary, goals));
            return updates;
        } catch (NutritionDomainException e) {
            log.warn("⚠️ Could not compute daily summary: {}", e.getMessage());
            Map<String, Object> updates = new HashMap<>();
            updates.put(ConversationState.RESPONSE, "Error computing daily summary: " + e.getMessage());
            updates.put(ConversationState.DOMAIN_ERROR, e.getKind());
            return updates;
        }
    }

    static String format(DaySummary summary, Map<String, Double> goals) {
        StringBuilder response = new StringBuilder();
        response.append("Daily Summary for ").append(summary.getDate()).append(":\n");
        response.append("Meals logged: ").append(summary.getMealCount()).append('\n');

        summary.getTotals().forEach((key, total) -> {
            String label = Nutrient.fromKey(key).map(Nutrient::getLabel).orElse(key);
            String unit = Nutrient.fromKey(key).map(Nutrient::getUnit).orElse("");
            response.append(label).append(": ").append(oneDecimal(total)).append(unit).append('\n');
        });

        if (!goals.isEmpty()) {
            response.append("\nGoal Progress:\n");
            goals.forEach((key, goal) -> {
                if (!summary.getTotals().containsKey(key)) {
                    return;
                }
                double actual = summary.total(key);
                double percentage = goal > 0 ? actual / goal * 100 : 0;
                response.append(actual >= goal ? "✅" : "❌").append(' ').append(key).append(": ")
                        .append(oneDecimal(actual)).append('/').append(oneDecimal(goal))
                        .append(" (").append(oneDecimal(percentage)).append("%)\n");
            });
        }
        return response.toString().stripTrailing();
    }

    static Map<String, Object> unreadableDate(String reference, NutritionDomainException e) {
        log.info("⚠️ {}", e.getMessage());
        Map<String, Object> updates = ConversationState.clarification(ElicitationAgent.WHICH_DAY,
                "I couldn't understand the date '" + reference + "'. " + ElicitationAgent.WHICH_DAY);
        updates.put(ConversationState.DOMAIN_ERROR, DomainErrorKind.INVALID_DATE);
        return updates;
    }

    private static String oneDecimal(double value) {
        return String.format(Locale.ROOT, "%.1f", value);
    }
}
