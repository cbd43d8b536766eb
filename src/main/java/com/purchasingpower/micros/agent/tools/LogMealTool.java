package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.agent.Tool;
import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.service.MealLogService;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonNumberSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Writes one meal log for the acting user. At most one log per turn; the amount goes
 * through the same grams check as the evaluator.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class LogMealTool implements Tool {

    private final MealLogService mealLogService;
    private final GramsNormalizer gramsNormalizer;
    private final AssistantConfig assistantConfig;

    @Override
    public String getName() {
        return "tool_log_meal";
    }

    @Override
    public String getDescription() {
        return "Create a meal log entry for the current user. Only call this once the food id and grams are known.";
    }

    @Override
    public JsonObjectSchema getParameters() {
        return JsonObjectSchema.builder()
                .addProperty("food_id", JsonIntegerSchema.builder().description("Catalog food id").build())
                .addProperty("grams", JsonNumberSchema.builder().description("Amount eaten in grams, greater than 0 and at most 5000").build())
                .addProperty("meal_type", JsonStringSchema.builder().description("breakfast, lunch, dinner or snack (default snack)").build())
                .addProperty("notes", JsonStringSchema.builder().description("Optional free-text note").build())
                .required("food_id", "grams")
                .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.ACTION;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        if (context.getLoggedMeal().isPresent()) {
            return ToolResult.failure("A meal was already logged in this turn");
        }

        Long foodId = ToolParams.longValue(parameters, "food_id");
        if (foodId == null) {
            return ToolResult.failure("food_id parameter is required");
        }

        String gramsText = ToolParams.string(parameters, "grams");
        GramsNormalizer.GramsCheck grams = gramsNormalizer.check(null, gramsText);
        if (!grams.isValid()) {
            return ToolResult.failure("grams must be a number greater than 0 and at most "
                    + (int) GramsNormalizer.MAX_GRAMS + " (got: " + gramsText + ")");
        }

        GramsNormalizer.GramsCheck requested = context.getRequestedAmount();
        if (requested.isInvalid()) {
            return ToolResult.failure("The amount the user gave is not valid; do not log, ask the user for a corrected amount");
        }
        if (requested.isValid() && Double.compare(requested.grams(), grams.grams()) != 0) {
            return ToolResult.failure("grams must be the amount the user gave (" + requested.grams() + ")");
        }

        String mealType = ToolParams.string(parameters, "meal_type");
        if (mealType == null) {
            mealType = assistantConfig.getLogging().getDefaultMealType();
        }

        context.hint("food_id", foodId);
        context.hint("grams", grams.grams());
        context.hint("meal_type", mealType);

        LogRecord record = mealLogService.createMealLog(
                context.getUserId(), foodId, grams.grams(), mealType, ToolParams.string(parameters, "notes"));
        context.recordLoggedMeal(record);

        return ToolResult.success(record, "Logged " + record.getGrams() + "g of " + record.getFoodName());
    }
}
