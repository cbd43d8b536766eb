package com.purchasingpower.micros.model.nutrition;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Full catalog record used for recommendation scoring.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CatalogFood implements Serializable {

    private static final long serialVersionUID = 1L;

    private FoodSummary summary;

    @Builder.Default
    private Map<String, Double> nutrientsPer100g = new LinkedHashMap<>();

    public double per100g(String nutrientKey) {
        Double value = nutrientsPer100g.get(nutrientKey);
        return value != null ? value : 0.0;
    }
}
