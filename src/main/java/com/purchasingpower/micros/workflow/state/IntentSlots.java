package com.purchasingpower.micros.workflow.state;

/**
 * Per-intent view over {@link ExtractedEntities}: each variant exposes only the
 * keys its intent consumes. Handlers and the elicitation step read their inputs
 * through the variant for the routed intent.
 */
public interface IntentSlots {

    record Barcode(String upc) implements IntentSlots {

        public boolean hasUpc() {
            return upc != null && !upc.isBlank();
        }
    }

    record FoodSearch(String foodName) implements IntentSlots {

        public boolean hasFoodName() {
            return foodName != null && !foodName.isBlank();
        }
    }

    /**
     * @param grams     normalized amount, when one was read
     * @param gramsText amount as written, when it could not be read as a number yet
     */
    record LogMeal(Long foodId, Double grams, String gramsText, String mealType) implements IntentSlots {

        public boolean hasAmount() {
            return grams != null || (gramsText != null && !gramsText.isBlank());
        }

        public boolean hasMealType() {
            return mealType != null && !mealType.isBlank();
        }
    }

    record Day(String date) implements IntentSlots {

        public boolean hasDate() {
            return date != null && !date.isBlank();
        }
    }

    /**
     * No intent classified; nothing can be asked for.
     */
    record Unrouted() implements IntentSlots {
    }

    static IntentSlots of(Intent intent, ExtractedEntities entities) {
        if (intent == null) {
            return new Unrouted();
        }
        return switch (intent) {
            case SCAN_BARCODE -> new Barcode(entities.getUpc());
            case SEARCH_FOOD -> new FoodSearch(entities.getFoodName());
            case LOG_MEAL -> new LogMeal(entities.getFoodId(), entities.getGrams(), entities.getGramsText(),
                    entities.getMealType());
            case DAILY_SUMMARY, RECOMMEND -> new Day(entities.getDate());
        };
    }
}
