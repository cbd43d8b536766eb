package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.agent.HandlerKind;
import com.purchasingpower.micros.agent.ToolAssistedStep;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.CatalogFood;
import com.purchasingpower.micros.model.nutrition.DaySummary;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.RecommendationItem;
import com.purchasingpower.micros.service.DayAggregationService;
import com.purchasingpower.micros.service.FoodCatalogService;
import com.purchasingpower.micros.service.GoalsService;
import com.purchasingpower.micros.util.DateResolver;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.IntentSlots;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Suggests foods that close the day's largest nutrient gaps.
 *
 * <p>gap = goal - actual for every goal nutrient, kept when positive. For the largest
 * gaps, each catalog food scores {@code sum(min(per100g, gap) / gap)}. Sorting is
 * stable, so ties keep catalog (and goal) order.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class RecommendationAgent {

    public static final String GOALS_MET = "You're meeting your goals today. Nice work!";
    public static final String NOTHING_FITS = "I couldn't find foods that improve your biggest gaps from the current list.";

    private final ToolAssistedStep toolAssistedStep;
    private final DayAggregationService dayAggregationService;
    private final GoalsService goalsService;
    private final FoodCatalogService foodCatalogService;
    private final DateResolver dateResolver;
    private final AssistantConfig assistantConfig;

    public Map<String, Object> assist(ConversationState state) {
        return toolAssistedStep.run(HandlerKind.RECOMMEND, state);
    }

    public Map<String, Object> execute(ConversationState state) {
        String reference = state.getSlots() instanceof IntentSlots.Day day ? day.date() : null;

        LocalDate date;
        try {
            date = dateResolver.resolve(reference);
        } catch (NutritionDomainException e) {
            return DailyAnalysisAgent.unreadableDate(reference, e);
        }

        Map<String, Object> updates = new HashMap<>();
        try {
            DaySummary summary = dayAggregationService.computeDay(state.getUserId(), date);
            Map<String, Double> gaps = gaps(goalsService.getGoals(state.getUserId()), summary);

            if (gaps.isEmpty()) {
                updates.put(ConversationState.RECOMMENDATIONS, new ArrayList<RecommendationItem>());
                updates.put(ConversationState.RESPONSE, GOALS_MET);
                return updates;
            }

            List<RecommendationItem> picks = rank(gaps, foodCatalogService.listCatalog());
            log.info("🥗 {} gaps, {} recommendations for user {}", gaps.size(), picks.size(), state.getUserId());

            updates.put(ConversationState.RECOMMENDATIONS, new ArrayList<>(picks));
            updates.put(ConversationState.RESPONSE, picks.isEmpty() ? NOTHING_FITS : format(picks));
            return updates;
        } catch (NutritionDomainException e) {
            log.warn("⚠️ Could not build recommendations: {}", e.getMessage());
            updates.put(ConversationState.RESPONSE, "Error computing recommendations: " + e.getMessage());
            updates.put(ConversationState.DOMAIN_ERROR, e.getKind());
            return updates;
        }
    }

    static Map<String, Double> gaps(Map<String, Double> goals, DaySummary summary) {
        Map<String, Double> gaps = new LinkedHashMap<>();
        goals.forEach((key, goal) -> {
            double gap = goal - summary.total(key);
            if (gap > 0) {
                gaps.put(key, gap);
            }
        });
        return gaps;
    }

    List<RecommendationItem> rank(Map<String, Double> gaps, List<CatalogFood> catalog) {
        List<String> topGaps = gaps.entrySet().stream()
                .sorted(Map.Entry.<String, Double>comparingByValue().reversed())
                .limit(assistantConfig.getRecommendation().getTopGaps())
                .map(Map.Entry::getKey)
                .collect(Collectors.toList());

        List<RecommendationItem> scored = new ArrayList<>();
        for (CatalogFood food : catalog) {
            double score = 0.0;
            Map<String, Double> coverage = new LinkedHashMap<>();
            for (String key : topGaps) {
                double value = food.per100g(key);
                if (value > 0) {
                    double gap = gaps.get(key);
                    double covered = Math.min(value, gap);
                    coverage.put(key, covered);
                    score += covered / gap;
                }
            }
            if (score > 0) {
                FoodSummary summary = food.getSummary();
                scored.add(RecommendationItem.builder()
                        .foodId(summary.getId())
                        .name(summary.getName())
                        .brand(summary.getBrand())
                        .score(score)
                        .coverage(coverage)
                        .caloriesPer100g(summary.getCalories())
                        .build());
            }
        }

        return scored.stream()
                .sorted(Comparator.comparingDouble(RecommendationItem::getScore).reversed())
                .limit(assistantConfig.getRecommendation().getTopFoods())
                .collect(Collectors.toList());
    }

    static String format(List<RecommendationItem> picks) {
        StringBuilder response = new StringBuilder("Recommendations (100g servings):");
        for (RecommendationItem item : picks) {
            String covers = item.getCoverage().entrySet().stream()
                    .map(e -> e.getKey() + ": +" + String.format(Locale.ROOT, "%.1f", e.getValue()))
                    .collect(Collectors.joining(", "));
            String name = item.getBrand() == null || item.getBrand().isBlank()
                    ? item.getName()
                    : item.getName() + " (" + item.getBrand() + ")";
            response.append("\n- ").append(name).append(" covers ").append(covers);
        }
        return response.toString();
    }
}
