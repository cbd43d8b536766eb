package com.purchasingpower.micros.agent;

import com.purchasingpower.micros.agent.tools.ComputeDayTool;
import com.purchasingpower.micros.agent.tools.GetUserGoalsTool;
import com.purchasingpower.micros.agent.tools.ListFoodsTool;
import com.purchasingpower.micros.agent.tools.ListMealsTool;
import com.purchasingpower.micros.agent.tools.LogMealTool;
import com.purchasingpower.micros.agent.tools.LookupUpcTool;
import com.purchasingpower.micros.agent.tools.SearchFoodTool;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.util.List;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("test")
class HandlerToolsetsTest {

    @Autowired
    private HandlerToolsets toolsets;

    @Autowired
    private List<Tool> tools;

    @Test
    void eachHandlerGetsItsFixedToolset() {
        assertThat(names(HandlerKind.SEARCH)).containsExactly("tool_search_food", "tool_list_foods", "tool_lookup_upc");
        assertThat(names(HandlerKind.LOGGING)).containsExactly("tool_log_meal", "tool_list_foods", "tool_list_meals");
        assertThat(names(HandlerKind.ANALYSIS)).containsExactly("tool_compute_day", "tool_get_user_goals");
        assertThat(names(HandlerKind.RECOMMEND)).containsExactly("tool_compute_day", "tool_get_user_goals");
    }

    @Test
    void onlyLoggingCanWrite() {
        for (HandlerKind kind : HandlerKind.values()) {
            boolean writes = toolsets.forHandler(kind).stream()
                    .anyMatch(tool -> tool.getCategory() == Tool.ToolCategory.ACTION);
            assertThat(writes).as(kind.name()).isEqualTo(kind == HandlerKind.LOGGING);
        }
    }

    @Test
    void toolSpecificationsCarryRequiredArguments() {
        Tool logMeal = toolsets.forHandler(HandlerKind.LOGGING).get(0);

        assertThat(logMeal.toSpecification().name()).isEqualTo("tool_log_meal");
        assertThat(logMeal.getParameters().required()).containsExactly("food_id", "grams");
    }

    @Test
    void missingToolFailsAtStartup() {
        List<Tool> withoutLogMeal = tools.stream()
                .filter(tool -> !(tool instanceof LogMealTool))
                .collect(Collectors.toList());

        assertThatThrownBy(() -> new HandlerToolsets(withoutLogMeal))
                .isInstanceOf(IllegalStateException.class)
                .hasMessageContaining("tool_log_meal");
    }

    @Test
    void allToolsAreRegistered() {
        assertThat(tools).hasAtLeastOneElementOfType(SearchFoodTool.class)
                .hasAtLeastOneElementOfType(LookupUpcTool.class)
                .hasAtLeastOneElementOfType(ListFoodsTool.class)
                .hasAtLeastOneElementOfType(ListMealsTool.class)
                .hasAtLeastOneElementOfType(ComputeDayTool.class)
                .hasAtLeastOneElementOfType(GetUserGoalsTool.class);
    }

    private List<String> names(HandlerKind kind) {
        return toolsets.forHandler(kind).stream().map(Tool::getName).collect(Collectors.toList());
    }
}
