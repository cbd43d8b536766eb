package com.purchasingpower.micros.model.nutrition;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Catalog entry as shown to the user: identity plus headline values per 100 g.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class FoodSummary implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private String name;
    private String brand;
    private String upc;
    private double calories;
    private double proteinG;
    private double fatG;
    private double carbsG;

    /**
     * "Name (Brand)" or just the name when the brand is unknown.
     */
    public String displayName() {
        return brand == null || brand.isBlank() ? name : name + " (" + brand + ")";
    }
}
