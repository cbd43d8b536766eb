package com.purchasingpower.micros.agent.tools;

import com.purchasingpower.micros.NutritionFixtures;
import com.purchasingpower.micros.agent.ToolResult;
import com.purchasingpower.micros.agent.impl.ToolContextImpl;
import com.purchasingpower.micros.config.AssistantConfig;
import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.MealRef;
import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.service.impl.MealLogServiceImpl;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LogMealToolTest {

    private MealLogServiceImpl mealLog;
    private LogMealTool tool;
    private ToolContextImpl context;

    @BeforeEach
    void setUp() {
        mealLog = new MealLogServiceImpl(NutritionFixtures.seededStore(NutritionFixtures.fixedClock()));
        tool = new LogMealTool(mealLog, new GramsNormalizer(), new AssistantConfig());
        context = ToolContextImpl.forUser(1);
    }

    @Test
    void logsForTheContextUserAndRecordsHints() {
        // Given - the model passes numbers as text
        Map<String, Object> args = Map.of("food_id", "3", "grams", "120g", "meal_type", "lunch");

        // When
        ToolResult result = tool.execute(args, context);

        // Then
        assertThat(result.isSuccess()).isTrue();
        LogRecord record = (LogRecord) result.getData();
        assertThat(record.getUserId()).isEqualTo(1L);
        assertThat(record.getFoodName()).isEqualTo("Banana");
        assertThat(record.getGrams()).isEqualTo(120.0);
        assertThat(context.getLoggedMeal()).contains(record);
        assertThat(context.getHints())
                .containsEntry("food_id", 3L)
                .containsEntry("grams", 120.0)
                .containsEntry("meal_type", "lunch");
    }

    @Test
    void mealTypeDefaultsToSnack() {
        ToolResult result = tool.execute(Map.of("food_id", 1, "grams", 40), context);

        assertThat(((LogRecord) result.getData()).getMealType()).isEqualTo("snack");
    }

    @Test
    void rejectsOutOfRangeAmountsWithoutWriting() {
        ToolResult zero = tool.execute(Map.of("food_id", 1, "grams", 0), context);
        ToolResult huge = tool.execute(Map.of("food_id", 1, "grams", 6000), context);
        ToolResult text = tool.execute(Map.of("food_id", 1, "grams", "a handful"), context);

        assertThat(zero.isSuccess()).isFalse();
        assertThat(huge.isSuccess()).isFalse();
        assertThat(text.getMessage()).contains("at most 5000").contains("a handful");
        assertThat(context.getLoggedMeal()).isEmpty();
        assertThat(mealLog.listMeals(1, 10, 0)).isEmpty();
    }

    @Test
    @DisplayName("Nothing is written while the amount the user gave is invalid")
    void refusesWhileTheUserAmountIsInvalid() {
        // Given - the user asked for 6000g, the model picks a reasonable amount on its own
        ToolContextImpl turn = ToolContextImpl.builder()
                .userId(1)
                .requestedAmount(new GramsNormalizer().check(6000.0, null))
                .build();

        // When
        ToolResult result = tool.execute(Map.of("food_id", 1, "grams", 100), turn);

        // Then
        assertThat(result.isSuccess()).isFalse();
        assertThat(result.getMessage()).contains("ask the user for a corrected amount");
        assertThat(turn.getLoggedMeal()).isEmpty();
        assertThat(mealLog.listMeals(1, 10, 0)).isEmpty();
    }

    @Test
    void refusesAnAmountOtherThanTheOneTheUserGave() {
        ToolContextImpl turn = ToolContextImpl.builder()
                .userId(1)
                .requestedAmount(new GramsNormalizer().check(null, "150g"))
                .build();

        ToolResult different = tool.execute(Map.of("food_id", 1, "grams", 100), turn);
        ToolResult same = tool.execute(Map.of("food_id", 1, "grams", "150"), turn);

        assertThat(different.isSuccess()).isFalse();
        assertThat(different.getMessage()).isEqualTo("grams must be the amount the user gave (150.0)");
        assertThat(same.isSuccess()).isTrue();
        assertThat(mealLog.listMeals(1, 10, 0)).extracting(MealRef::getGrams).containsExactly(150.0);
    }

    @Test
    void onlyOneLogPerTurn() {
        tool.execute(Map.of("food_id", 1, "grams", 50), context);

        ToolResult second = tool.execute(Map.of("food_id", 2, "grams", 50), context);

        assertThat(second.isSuccess()).isFalse();
        assertThat(second.getMessage()).isEqualTo("A meal was already logged in this turn");
        assertThat(mealLog.listMeals(1, 10, 0)).hasSize(1);
    }

    @Test
    void missingFoodIdIsAFailedResult() {
        Map<String, Object> args = new HashMap<>();
        args.put("grams", 100);

        assertThat(tool.execute(args, context).getMessage()).isEqualTo("food_id parameter is required");
    }

    @Test
    void unknownFoodSurfacesTheDomainError() {
        assertThatThrownBy(() -> tool.execute(Map.of("food_id", 999, "grams", 100), context))
                .isInstanceOf(NutritionDomainException.class)
                .hasMessage("Food not found: 999");
    }
}
