package com.purchasingpower.micros.model.nutrition;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Aggregated intake for one user on one calendar day.
 * Totals always carry every canonical nutrient key.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class DaySummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private LocalDate date;
    private int mealCount;

    @Builder.Default
    private Map<String, Double> totals = new LinkedHashMap<>();

    @Builder.Default
    private List<MealRef> meals = new ArrayList<>();

    public double total(String nutrientKey) {
        Double value = totals.get(nutrientKey);
        return value != null ? value : 0.0;
    }
}
