package com.purchasingpower.micros.model.nutrition;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Canonical nutrient keys, in report order. Amounts are per 100 g for foods
 * and absolute for daily totals.
 */
public enum Nutrient {
    CALORIES("calories", "Calories", ""),
    PROTEIN("protein_g", "Protein", "g"),
    FAT("fat_g", "Fat", "g"),
    CARBS("carbs_g", "Carbs", "g"),

    VITAMIN_A("vitamin_a_rae", "Vitamin A", " RAE"),
    VITAMIN_D("vitamin_d_iu", "Vitamin D", " IU"),
    VITAMIN_E("vitamin_e_mg", "Vitamin E", "mg"),
    VITAMIN_K("vitamin_k_mcg", "Vitamin K", "mcg"),
    VITAMIN_C("vitamin_c_mg", "Vitamin C", "mg"),
    VITAMIN_B1("vitamin_b1_mg", "Thiamin (B1)", "mg"),
    VITAMIN_B2("vitamin_b2_mg", "Riboflavin (B2)", "mg"),
    VITAMIN_B3("vitamin_b3_mg", "Niacin (B3)", "mg"),
    VITAMIN_B5("vitamin_b5_mg", "Pantothenic Acid (B5)", "mg"),
    VITAMIN_B6("vitamin_b6_mg", "Pyridoxine (B6)", "mg"),
    VITAMIN_B7("vitamin_b7_mcg", "Biotin (B7)", "mcg"),
    VITAMIN_B9("vitamin_b9_mcg", "Folate (B9)", "mcg"),
    VITAMIN_B12("vitamin_b12_mcg", "Cobalamin (B12)", "mcg"),
    CHOLINE("choline_mg", "Choline", "mg"),

    CALCIUM("calcium_mg", "Calcium", "mg"),
    PHOSPHORUS("phosphorus_mg", "Phosphorus", "mg"),
    MAGNESIUM("magnesium_mg", "Magnesium", "mg"),
    SODIUM("sodium_mg", "Sodium", "mg"),
    POTASSIUM("potassium_mg", "Potassium", "mg"),
    CHLORIDE("chloride_mg", "Chloride", "mg"),
    SULFUR("sulfur_mg", "Sulfur", "mg"),

    IRON("iron_mg", "Iron", "mg"),
    ZINC("zinc_mg", "Zinc", "mg"),
    COPPER("copper_mg", "Copper", "mg"),
    MANGANESE("manganese_mg", "Manganese", "mg"),
    IODINE("iodine_mcg", "Iodine", "mcg"),
    SELENIUM("selenium_mcg", "Selenium", "mcg"),
    CHROMIUM("chromium_mcg", "Chromium", "mcg"),
    MOLYBDENUM("molybdenum_mcg", "Molybdenum", "mcg"),
    FLUORIDE("fluoride_mg", "Fluoride", "mg");

    private static final Map<String, Nutrient> BY_KEY = Arrays.stream(values())
            .collect(Collectors.toMap(Nutrient::getKey, n -> n));

    private final String key;
    private final String label;
    private final String unit;

    Nutrient(String key, String label, String unit) {
        this.key = key;
        this.label = label;
        this.unit = unit;
    }

    public String getKey() {
        return key;
    }

    public String getLabel() {
        return label;
    }

    public String getUnit() {
        return unit;
    }

    public static Optional<Nutrient> fromKey(String key) {
        return Optional.ofNullable(BY_KEY.get(key));
    }

    public static List<String> keys() {
        return Arrays.stream(values()).map(Nutrient::getKey).collect(Collectors.toList());
    }

    /**
     * Fresh ordered map with every canonical key set to zero.
     */
    public static LinkedHashMap<String, Double> zeroTotals() {
        LinkedHashMap<String, Double> totals = new LinkedHashMap<>();
        for (Nutrient nutrient : values()) {
            totals.put(nutrient.key, 0.0);
        }
        return totals;
    }
}
