package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.agent.Tool;
import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.model.nutrition.DaySummary;
import com.purchasingpower.micros.service.DayAggregationService;
import com.purchasingpower.micros.util.DateResolver;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import dev.langchain4j.model.chat.request.json.JsonStringSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;

@Component
@RequiredArgsConstructor
public class ComputeDayTool implements Tool {

    private final DayAggregationService dayAggregationService;
    private final DateResolver dateResolver;

    @Override
    public String getName() {
        return "tool_compute_day";
    }

    @Override
    public String getDescription() {
        return "Compute the current user's nutrient totals for one day. date_iso accepts YYYY-MM-DD, 'today' or 'yesterday' (default today).";
    }

    @Override
    public JsonObjectSchema getParameters() {
        return JsonObjectSchema.builder()
                .addProperty("date_iso", JsonStringSchema.builder().description("Day to compute, e.g. 2024-05-01").build())
                .build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.LOOKUP;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        String reference = ToolParams.string(parameters, "date_iso");
        LocalDate date = dateResolver.resolve(reference);
        if (reference != null) {
            context.hint("date", reference);
        }

        DaySummary summary = dayAggregationService.computeDay(context.getUserId(), date);
        return ToolResult.success(summary, summary.getMealCount() + " meals logged on " + date);
    }
}
