package com.purchasingpower.micros.service;

import com.purchasingpower.micros.model.nutrition.DaySummary;

import java.time.LocalDate;

public interface DayAggregationService {

    /**
     * Totals recomputed from the meals logged on {@code date}.
     */
    DaySummary computeDay(long userId, LocalDate date);
}
