package com.purchasingpower.micros.service;

import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.MealRef;

import java.util.List;

public interface MealLogService {

    /**
     * Records one meal atomically.
     *
     * @throws NutritionDomainException USER_NOT_FOUND or FOOD_NOT_FOUND
     */
    LogRecord createMealLog(long userId, long foodId, double grams, String mealType, String notes);

    /**
     * Most recent meals first.
     */
    List<MealRef> listMeals(long userId, int limit, int offset);
}
