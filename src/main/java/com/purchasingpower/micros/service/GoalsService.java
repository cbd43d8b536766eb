package com.purchasingpower.micros.service;

import java.util.Map;

public interface GoalsService {

    /**
     * Daily targets keyed by nutrient, in the user's goal order.
     *
     * @throws com.purchasingpower.micros.exception.NutritionDomainException USER_NOT_FOUND
     */
    Map<String, Double> getGoals(long userId);
}
