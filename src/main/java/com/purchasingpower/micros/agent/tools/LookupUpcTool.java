package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.agent.Tool;
import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.service.FoodCatalogService;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class LookupUpcTool implements Tool {

    private final FoodCatalogService foodCatalogService;

    @Override
    public String getName() {
        return "tool_lookup_upc";
    }

    @Override
    public String getDescription() {
        return "Look up foods by exact 12-digit UPC barcode.";
    }

    @Override
    public JsonObjectSchema getParameters() {
        return JsonObjectSchema.builder()
                .addProperty("upc", JsonStringSchema.builder().description("12-digit UPC code").build())
                .required("upc")
                .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.LOOKUP;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        String upc = ToolParams.string(parameters, "upc");
        if (upc == null) {
            return ToolResult.failure("upc parameter is required");
        }

        context.hint("upc", upc);
        List<FoodSummary> foods = foodCatalogService.lookupByUpc(upc);
        context.recordCandidates(foods, CandidateSource.TOOL);

        return ToolResult.success(foods, foods.isEmpty()
                ? "No food found with UPC " + upc
                : "Found " + foods.size() + " foods for UPC " + upc);
    }
}
