package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.agent.Tool;
import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.service.FoodCatalogService;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Paginated browse list of the catalog. Results are suggestions, not a food choice.
 */
@Component
@RequiredArgsConstructor
public class ListFoodsTool implements Tool {

    private static final int DEFAULT_LIMIT = 25;

    private final FoodCatalogService foodCatalogService;

    @Override
    public String getName() {
        return "tool_list_foods";
    }

    @Override
    public String getDescription() {
        return "List foods in catalog order for browsing (paginated).";
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

        List<FoodSummary> foods = foodCatalogService.listFoods(limit, offset);
        context.recordCandidates(foods, CandidateSource.BROWSE);
        return ToolResult.success(foods, "Listed " + foods.size() + " foods");
    }
}
