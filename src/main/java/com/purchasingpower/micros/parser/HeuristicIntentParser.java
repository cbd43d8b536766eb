package com.purchasingpower.micros.parser;

import com.purchasingpower.micros.workflow.state.ExtractedEntities;
import com.purchasingpower.micros.workflow.state.Intent;
import com.purchasingpower.micros.workflow.state.IntentExtraction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Keyword and pattern based intent classification, used when no model is configured
 * or the model's answer cannot be parsed.
 *
 * Intent rules are checked in a fixed order and the first match wins:
 * barcode keywords, "search " prefix, recommend keywords, summary keywords,
 * logging keywords or an extracted food_id/grams, then search as the default.
 */
@Slf4j
@Component
public class HeuristicIntentParser {

    public static final double HEURISTIC_CONFIDENCE = 0.5;

    private static final Pattern GRAMS = Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(g|grams?)\\b");
    private static final Pattern FOOD_ID = Pattern.compile("food_id\\s*=\\s*(\\d+)");
    private static final Pattern UPC = Pattern.compile("\\b(\\d{12})\\b");

    private static final List<String> MEAL_TYPES = List.of("breakfast", "lunch", "dinner", "snack");
    private static final List<String> BARCODE_KEYWORDS = List.of("barcode", "upc", "scan");
    private static final List<String> RECOMMEND_KEYWORDS = List.of("recommend", "suggest");
    private static final List<String> SUMMARY_KEYWORDS = List.of("summary", "report");
    private static final List<String> LOG_KEYWORDS = List.of("log", "ate", "consumed");
    private static final String SEARCH_PREFIX = "search ";

    public IntentExtraction parse(String inputText) {
        String original = inputText != null ? inputText : "";
        String text = original.toLowerCase(Locale.ROOT).trim();

        ExtractedEntities entities = extractEntities(text);
        Intent intent;

        if (containsAny(text, BARCODE_KEYWORDS)) {
            intent = Intent.SCAN_BARCODE;
        } else if (text.startsWith(SEARCH_PREFIX)) {
            intent = Intent.SEARCH_FOOD;
            entities.setFoodName(original.trim().substring(SEARCH_PREFIX.length()).trim());
        } else if (containsAny(text, RECOMMEND_KEYWORDS)) {
            intent = Intent.RECOMMEND;
            defaultToToday(entities);
        } else if (containsAny(text, SUMMARY_KEYWORDS) || text.equals("today") || text.equals("yesterday")) {
            intent = Intent.DAILY_SUMMARY;
            defaultToToday(entities);
        } else if (containsAny(text, LOG_KEYWORDS) || entities.getFoodId() != null || entities.getGrams() != null) {
            intent = Intent.LOG_MEAL;
        } else {
            intent = Intent.SEARCH_FOOD;
        }

        log.debug("Heuristic intent: {} entities={}", intent.getWireName(), entities);
        return new IntentExtraction(intent, entities, HEURISTIC_CONFIDENCE, false);
    }

    /**
     * Entity extraction runs on the lower-cased text regardless of the intent.
     */
    ExtractedEntities extractEntities(String text) {
        ExtractedEntities entities = ExtractedEntities.empty();

        Matcher grams = GRAMS.matcher(text);
        if (grams.find()) {
            entities.setGrams(Double.parseDouble(grams.group(1)));
        }

        Matcher foodId = FOOD_ID.matcher(text);
        if (foodId.find()) {
            try {
                entities.setFoodId(Long.parseLong(foodId.group(1)));
            } catch (NumberFormatException e) {
                log.debug("food_id out of range: {}", foodId.group(1));
            }
        }

        Matcher upc = UPC.matcher(text);
        if (upc.find()) {
            entities.setUpc(upc.group(1));
        }

        for (String mealType : MEAL_TYPES) {
            if (text.contains(mealType)) {
                entities.setMealType(mealType);
                break;
            }
        }

        if (text.contains("yesterday")) {
            entities.setDate("yesterday");
        } else if (text.contains("today")) {
            entities.setDate("today");
        }
        return entities;
    }

    private static void defaultToToday(ExtractedEntities entities) {
        if (!entities.hasDate()) {
            entities.setDate("today");
        }
    }

    private static boolean containsAny(String text, List<String> keywords) {
        return keywords.stream().anyMatch(text::contains);
    }
}
