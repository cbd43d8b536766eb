package com.purchasingpower.micros.model.nutrition;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A food suggested to close nutrient gaps, scored on a 100 g serving.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class RecommendationItem implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long foodId;
    private String name;
    private String brand;
    private double score;

    /**
     * Nutrient key to the amount a 100 g serving contributes toward that gap.
     */
    @Builder.Default
    private Map<String, Double> coverage = new LinkedHashMap<>();

    @JsonProperty("calories_per_100g")
    private double caloriesPer100g;
}
