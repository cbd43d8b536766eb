package com.purchasingpower.micros.storage;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shape of the YAML seed file loaded by {@link InMemoryNutritionStore}.
 *
 * <pre>
 * users:
 *   - id: 1
 *     name: demo
 *     goals: { calories: 2000, protein_g: 120 }
 * foods:
 *   - id: 1
 *     name: Rolled Oats
 *     brand: Quaker
 *     upc: "030000010204"
 *     nutrients: { calories: 379, protein_g: 13.2 }
 * </pre>
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class SeedData {

    private List<SeedUser> users = new ArrayList<>();
    private List<SeedFood> foods = new ArrayList<>();

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeedUser {
        private long id;
        private String name;
        private Map<String, Double> goals = new LinkedHashMap<>();
    }

    @Data
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SeedFood {
        private long id;
        private String name;
        private String brand;
        private String upc;
        private Map<String, Double> nutrients = new LinkedHashMap<>();
    }
}
