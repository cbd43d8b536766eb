package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.agent.Tool;
import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.service.GoalsService;
import dev.langchain4j.model.chat.request.json.JsonObjectSchema;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Map;

@Component
@RequiredArgsConstructor
public class GetUserGoalsTool implements Tool {

    private final GoalsService goalsService;

    @Override
    public String getName() {
        return "tool_get_user_goals";
    }

    @Override
    public String getDescription() {
        return "Get the current user's daily nutrient goals.";
    }

    @Override
    public JsonObjectSchema getParameters() {
        return JsonObjectSchema.builder().build();
    }

    @Override
    public ToolCategory getCategory() {
        return ToolCategory.LOOKUP;
    }

    @Override
    public ToolResult execute(Map<String, Object> parameters, ToolContext context) {
        Map<String, Double> goals = goalsService.getGoals(context.getUserId());
        return ToolResult.success(goals, goals.size() + " goals");
    }
}
