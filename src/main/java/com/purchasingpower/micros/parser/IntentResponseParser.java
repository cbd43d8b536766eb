package com.purchasingpower.micros.parser;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.purchasingpower.micros.exception.IntentParseException;
import com.purchasingpower.micros.workflow.state.ExtractedEntities;
import com.purchasingpower.micros.workflow.state.Intent;
import com.purchasingpower.micros.workflow.state.IntentExtraction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Locale;

/**
 * Binds the model's {@code {intent, entities, confidence}} JSON answer.
 *
 * Anything that does not name one of the five intents is rejected with
 * {@link IntentParseException}; entity values are accepted leniently (numbers or
 * strings) and unknown keys are ignored.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentResponseParser {

    public static final double DEFAULT_MODEL_CONFIDENCE = 0.7;

    private final ObjectMapper objectMapper;

    public IntentExtraction parse(String llmResponse) {
        if (llmResponse == null || llmResponse.isBlank()) {
            throw new IntentParseException("Empty model response", llmResponse);
        }

        String json = extractJson(llmResponse);
        if (json == null) {
            throw new IntentParseException("No JSON object in model response", llmResponse);
        }

        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            throw new IntentParseException("Malformed JSON in model response", llmResponse, e);
        }

        String intentName = text(root.get("intent"));
        Intent intent = Intent.fromWireName(intentName)
                .orElseThrow(() -> new IntentParseException("Unknown intent: " + intentName, llmResponse));

        ExtractedEntities entities = bindEntities(root.get("entities"));

        double confidence = DEFAULT_MODEL_CONFIDENCE;
        JsonNode confidenceNode = root.get("confidence");
        if (confidenceNode != null && confidenceNode.isNumber()) {
            confidence = confidenceNode.asDouble();
        } else if (confidenceNode != null && confidenceNode.isTextual()) {
            try {
                confidence = Double.parseDouble(confidenceNode.asText().trim());
            } catch (NumberFormatException e) {
                log.debug("Ignoring non-numeric confidence '{}'", confidenceNode.asText());
            }
        }
        if (!Double.isFinite(confidence)) {
            log.debug("Ignoring non-finite confidence {}", confidence);
            confidence = DEFAULT_MODEL_CONFIDENCE;
        }

        return new IntentExtraction(intent, entities, confidence, true);
    }

    private ExtractedEntities bindEntities(JsonNode node) {
        ExtractedEntities entities = ExtractedEntities.empty();
        if (node == null || !node.isObject()) {
            return entities;
        }

        entities.setFoodName(text(node.get("food_name")));
        entities.setUpc(text(node.get("upc")));
        entities.setDate(text(node.get("date")));

        String mealType = text(node.get("meal_type"));
        entities.setMealType(mealType != null ? mealType.toLowerCase(Locale.ROOT) : null);

        JsonNode grams = node.get("grams");
        if (grams != null && grams.isNumber()) {
            entities.setGrams(grams.asDouble());
        } else {
            entities.setGramsText(text(grams));
        }

        JsonNode foodId = node.get("food_id");
        if (foodId != null && foodId.canConvertToLong() && foodId.isIntegralNumber()) {
            entities.setFoodId(foodId.asLong());
        } else {
            String raw = text(foodId);
            if (raw != null) {
                try {
                    entities.setFoodId(Long.parseLong(raw));
                } catch (NumberFormatException e) {
                    log.debug("Ignoring non-numeric food_id '{}'", raw);
                }
            }
        }
        return entities;
    }

    /**
     * Text of a scalar node; null for missing, JSON null or blank values.
     */
    private static String text(JsonNode node) {
        if (node == null || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() || value.equalsIgnoreCase("null") ? null : value;
    }

    private static String extractJson(String text) {
        String cleaned = text.replaceAll("```json", "").replaceAll("```", "").trim();
        int start = cleaned.indexOf('{');
        int end = cleaned.lastIndexOf('}');
        if (start >= 0 && end > start) {
            return cleaned.substring(start, end + 1);
        }
        return null;
    }
}
