package com.purchasingpower.micros.parser;

import com.purchasingpower.micros.workflow.state.ExtractedEntities;
import com.purchasingpower.micros.workflow.state.Intent;
import com.purchasingpower.micros.workflow.state.IntentExtraction;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Heuristic intent parser")
class HeuristicIntentParserTest {

    private final HeuristicIntentParser parser = new HeuristicIntentParser();

    @Test
    void searchPrefix_keepsOriginalCasing() {
        // Given
        String message = "search Greek Yogurt ";

        // When
        IntentExtraction extraction = parser.parse(message);

        // Then
        assertThat(extraction.intent()).isEqualTo(Intent.SEARCH_FOOD);
        assertThat(extraction.entities().getFoodName()).isEqualTo("Greek Yogurt");
        assertThat(extraction.confidence()).isEqualTo(0.5);
        assertThat(extraction.fromModel()).isFalse();
    }

    @Test
    void logMeal_extractsGramsAndFoodId() {
        IntentExtraction extraction = parser.parse("log meal: 100g food_id=1");

        assertThat(extraction.intent()).isEqualTo(Intent.LOG_MEAL);
        assertThat(extraction.entities().getGrams()).isEqualTo(100.0);
        assertThat(extraction.entities().getFoodId()).isEqualTo(1L);
    }

    @Test
    void foodIdAloneMeansLogging() {
        IntentExtraction extraction = parser.parse("food_id=7 150 grams for lunch");

        assertThat(extraction.intent()).isEqualTo(Intent.LOG_MEAL);
        assertThat(extraction.entities().getGrams()).isEqualTo(150.0);
        assertThat(extraction.entities().getMealType()).isEqualTo("lunch");
    }

    @ParameterizedTest
    @CsvSource({
            "scan 030000010204,scan_barcode",
            "please log the upc 030000010204,scan_barcode",
            "search oats,search_food",
            "recommend something for dinner,recommend",
            "can you suggest a snack,recommend",
            "daily summary,daily_summary",
            "Today,daily_summary",
            "yesterday,daily_summary",
            "I ate a banana,log_meal",
            "bananas,search_food"
    })
    void precedence_firstMatchingRuleWins(String message, String expectedIntent) {
        assertThat(parser.parse(message).intent().getWireName()).isEqualTo(expectedIntent);
    }

    @Test
    void summaryAndRecommendDefaultToToday() {
        assertThat(parser.parse("show my report").entities().getDate()).isEqualTo("today");
        assertThat(parser.parse("recommend food").entities().getDate()).isEqualTo("today");
        assertThat(parser.parse("summary for yesterday").entities().getDate()).isEqualTo("yesterday");
    }

    @Test
    void barcode_extractsTwelveDigitUpc() {
        IntentExtraction extraction = parser.parse("scan barcode 689544001737");

        assertThat(extraction.intent()).isEqualTo(Intent.SCAN_BARCODE);
        assertThat(extraction.entities().getUpc()).isEqualTo("689544001737");
    }

    @Test
    void entities_firstMealTypeWins() {
        ExtractedEntities entities = parser.extractEntities("breakfast or lunch");

        assertThat(entities.getMealType()).isEqualTo("breakfast");
    }

    @Test
    void emptyInput_defaultsToSearch() {
        IntentExtraction extraction = parser.parse("");

        assertThat(extraction.intent()).isEqualTo(Intent.SEARCH_FOOD);
        assertThat(extraction.confidence()).isBetween(0.0, 1.0);
    }
}
