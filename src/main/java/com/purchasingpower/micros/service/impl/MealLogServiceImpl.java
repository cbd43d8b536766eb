package com.purchasingpower.micros.service.impl;

import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.CatalogFood;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.MealRef;
import com.purchasingpower.micros.service.MealLogService;
import com.purchasingpower.micros.storage.InMemoryNutritionStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
@RequiredArgsConstructor
public class MealLogServiceImpl implements MealLogService {

    private final InMemoryNutritionStore store;

    @Override
    public LogRecord createMealLog(long userId, long foodId, double grams, String mealType, String notes) {
        if (!store.userExists(userId)) {
            throw NutritionDomainException.userNotFound(userId);
        }
        CatalogFood food = store.findFood(foodId)
                .orElseThrow(() -> NutritionDomainException.foodNotFound(foodId));

        LogRecord record = store.appendLog(builder -> builder
                .userId(userId)
                .foodId(foodId)
                .foodName(food.getSummary().getName())
                .grams(grams)
                .mealType(mealType)
                .notes(notes));

        log.info("📝 Logged meal {} for user {}: {}g of {} ({})",
                record.getId(), userId, grams, record.getFoodName(), mealType);
        return record;
    }

    @Override
    public List<MealRef> listMeals(long userId, int limit, int offset) {
        if (!store.userExists(userId)) {
            throw NutritionDomainException.userNotFound(userId);
        }
        return store.logsForUser(userId).stream()
                .sorted(Comparator.comparing(LogRecord::getLoggedAt).reversed())
                .skip(Math.max(offset, 0))
                .limit(Math.max(limit, 0))
                .map(MealRef::from)
                .collect(Collectors.toList());
    }
}
