package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.agent.Tool;
import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.service.FoodCatalogService;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import dev.langchain4j.model.chat.request.json.JsonIntegerSchema;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
public class SearchFoodTool implements Tool {

    private final FoodCatalogService foodCatalogService;
    private final AssistantConfig assistantConfig;

    @Override
    public String getName() {
        return "tool_search_food";
    }

    @Override
    public String getDescription() {
        return "Search foods by name or brand (case-insensitive substring match). Returns id, name, brand, upc and macros per 100g.";
    }

    @Override
    public JsonObjectSchema getParameters() {
        return JsonObjectSchema.builder()
                .addProperty("query", JsonStringSchema.builder().description("Food name to search for, e.g. 'oats'").build())
                .addProperty("limit", JsonIntegerSchema.builder().description("Maximum results (default 5)").build())
                .required("query")
                .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.LOOKUP;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        String query = ToolParams.string(parameters, "query");
        if (query == null) {
            return ToolResult.failure("Query parameter is required");
        }
        int limit = ToolParams.intOr(parameters, "limit", assistantConfig.getSearch().getLimit());

        context.hint("food_name", query);
        List<FoodSummary> foods = foodCatalogService.searchByName(query, limit);
        context.recordCandidates(foods, CandidateSource.TOOL);

        log.debug("tool_search_food '{}' → {} results", query, foods.size());
        return ToolResult.success(foods, foods.isEmpty()
                ? "No foods found matching '" + query + "'"
                : "Found " + foods.size() + " foods");
    }
}
