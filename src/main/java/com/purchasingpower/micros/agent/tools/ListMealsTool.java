package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.agent.Tool;
import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.model.nutrition.MealRef;
import com.purchasingpower.micros.service.MealLogService;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ListMealsTool implements Tool {

    private static final int DEFAULT_LIMIT = 25;

    private final MealLogService mealLogService;

    @Override
    public String getName() {
        return "tool_list_meals";
    }

    @Override
    public String getDescription() {
        return "List the current user's logged meals, most recent first (paginated).";
    }

    @Override
    public JsonObjectSchema getParameters() {
        return JsonObjectSchema.builder()
                .addProperty("limit", JsonIntegerSchema.builder().description("Page size (default 25)").build())
                .addProperty("offset", JsonIntegerSchema.builder().description("Items to skip (default 0)").build())
                .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.LOOKUP;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        int limit = ToolParams.intOr(parameters, "limit", DEFAULT_LIMIT);
        int offset = ToolParams.intOr(parameters, "offset", 0);

        List<MealRef> meals = mealLogService.listMeals(context.getUserId(), limit, offset);
        return ToolResult.success(meals, "Listed " + meals.size() + " meals");
    }
}
