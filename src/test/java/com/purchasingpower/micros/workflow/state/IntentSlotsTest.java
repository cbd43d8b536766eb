package com.purchasingpower.micros.workflow.state;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IntentSlotsTest {

    private final ExtractedEntities entities = ExtractedEntities.builder()
            .foodName("banana")
            .upc("030000010204")
            .foodId(3L)
            .gramsText("a lot")
            .mealType("lunch")
            .date("today")
            .build();

    @Test
    void eachIntentSeesOnlyItsOwnSlots() {
        assertThat(IntentSlots.of(Intent.SCAN_BARCODE, entities)).isEqualTo(new IntentSlots.Barcode("030000010204"));
        assertThat(IntentSlots.of(Intent.SEARCH_FOOD, entities)).isEqualTo(new IntentSlots.FoodSearch("banana"));
        assertThat(IntentSlots.of(Intent.LOG_MEAL, entities))
                .isEqualTo(new IntentSlots.LogMeal(3L, null, "a lot", "lunch"));
        assertThat(IntentSlots.of(Intent.DAILY_SUMMARY, entities)).isEqualTo(new IntentSlots.Day("today"));
        assertThat(IntentSlots.of(Intent.RECOMMEND, entities)).isEqualTo(new IntentSlots.Day("today"));
        assertThat(IntentSlots.of(null, entities)).isInstanceOf(IntentSlots.Unrouted.class);
    }

    @Test
    void unreadableAmountStillCountsAsGiven() {
        IntentSlots.LogMeal slots = new IntentSlots.LogMeal(null, null, "a lot", " ");

        assertThat(slots.hasAmount()).isTrue();
        assertThat(slots.hasMealType()).isFalse();
        assertThat(new IntentSlots.LogMeal(null, null, null, null).hasAmount()).isFalse();
    }

    @Test
    void blankValuesAreMissing() {
        assertThat(new IntentSlots.Barcode(" ").hasUpc()).isFalse();
        assertThat(new IntentSlots.FoodSearch("").hasFoodName()).isFalse();
        assertThat(new IntentSlots.Day(null).hasDate()).isFalse();
    }
}
