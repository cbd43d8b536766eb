package com.purchasingpower.micros.service.impl;

import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.CatalogFood;
import com.purchasingpower.micros.model.nutrition.DaySummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.MealRef;
import com.purchasingpower.micros.model.nutrition.Nutrient;
import com.purchasingpower.micros.service.DayAggregationService;
import com.purchasingpower.micros.storage.InMemoryNutritionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Recomputes a day's totals from the logged meals on every call.
 * Each meal contributes {@code nutrient_per_100g * grams / 100}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DayAggregationServiceImpl implements DayAggregationService {

    private final InMemoryNutritionStore store;

    @Override
    public DaySummary computeDay(long userId, LocalDate date) {
        if (!store.userExists(userId)) {
            throw NutritionDomainException.userNotFound(userId);
        }

        List<LogRecord> meals = store.logsForDay(userId, date);
        LinkedHashMap<String, Double> totals = Nutrient.zeroTotals();

        for (LogRecord meal : meals) {
            Optional<CatalogFood> food = store.findFood(meal.getFoodId());
            if (food.isEmpty()) {
                log.warn("⚠️ Meal {} references missing food {}", meal.getId(), meal.getFoodId());
                continue;
            }
            double scale = meal.getGrams() / 100.0;
            food.get().getNutrientsPer100g().forEach((key, per100g) ->
                    totals.merge(key, per100g * scale, Double::sum));
        }

        log.debug("Computed day {} for user {}: {} meals", date, userId, meals.size());
        return DaySummary.builder()
                .date(date)
                .mealCount(meals.size())
                .totals(totals)
                .meals(meals.stream().map(MealRef::from).collect(Collectors.toList()))
                .build();
    }
}
