package com.purchasingpower.micros.service.impl;

import com.purchasingpower.micros.NutritionFixtures;
import com.purchasingpower.micros.exception.DomainErrorKind;
import com.purchasingpower.micros.exception.NutritionDomainException;
import com.purchasingpower.micros.model.nutrition.DaySummary;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.MealRef;
import com.purchasingpower.micros.model.nutrition.Nutrient;
import com.purchasingpower.micros.storage.InMemoryNutritionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

@DisplayName("In-memory nutrition services")
class NutritionServicesTest {

    private FoodCatalogServiceImpl catalog;
    private MealLogServiceImpl mealLog;
    private DayAggregationServiceImpl aggregation;
    private GoalsServiceImpl goals;

    @BeforeEach
    void setUp() {
        InMemoryNutritionStore store = NutritionFixtures.seededStore(NutritionFixtures.fixedClock());
        catalog = new FoodCatalogServiceImpl(store);
        mealLog = new MealLogServiceImpl(store);
        aggregation = new DayAggregationServiceImpl(store);
        goals = new GoalsServiceImpl(store);
    }

    @Test
    void searchByName_isCaseInsensitiveAndLimited() {
        List<FoodSummary> oats = catalog.searchByName("OATS", 5);
        List<FoodSummary> oat = catalog.searchByName("oat", 1);

        assertThat(oats).extracting(FoodSummary::getName).containsExactly("Rolled Oats");
        assertThat(oat).hasSize(1);
    }

    @Test
    void lookupByUpc_exactMatchOnly() {
        assertThat(catalog.lookupByUpc("030000010204"))
                .singleElement()
                .satisfies(food -> {
                    assertThat(food.getBrand()).isEqualTo("Quaker");
                    assertThat(food.getCalories()).isEqualTo(379.0);
                });
        assertThat(catalog.lookupByUpc("03000001020")).isEmpty();
    }

    @Test
    void listFoods_pagesInCatalogOrder() {
        List<FoodSummary> firstPage = catalog.listFoods(5, 0);
        List<FoodSummary> secondPage = catalog.listFoods(5, 5);

        assertThat(firstPage).extracting(FoodSummary::getId).containsExactly(1L, 2L, 3L, 4L, 5L);
        assertThat(secondPage).extracting(FoodSummary::getId).startsWith(6L);
    }

    @Test
    void createMealLog_thenDayTotalsScaleByGrams() {
        // Given
        mealLog.createMealLog(1, 1, 50, "breakfast", null);
        mealLog.createMealLog(1, 3, 200, "snack", "after run");

        // When
        DaySummary day = aggregation.computeDay(1, NutritionFixtures.TODAY);

        // Then
        assertThat(day.getMealCount()).isEqualTo(2);
        assertThat(day.total("calories")).isCloseTo(379 * 0.5 + 89 * 2, within(1e-9));
        assertThat(day.total("potassium_mg")).isCloseTo(716.0, within(1e-9));
        assertThat(day.getTotals()).containsOnlyKeys(Nutrient.keys());
    }

    @Test
    void computeDay_otherDayIsEmpty() {
        mealLog.createMealLog(1, 1, 100, "lunch", null);

        DaySummary yesterday = aggregation.computeDay(1, NutritionFixtures.TODAY.minusDays(1));

        assertThat(yesterday.getMealCount()).isZero();
        assertThat(yesterday.total("calories")).isZero();
    }

    @Test
    void createMealLog_unknownUserOrFood() {
        assertThatThrownBy(() -> mealLog.createMealLog(99, 1, 100, "lunch", null))
                .isInstanceOf(NutritionDomainException.class)
                .hasMessage("User not found: 99")
                .extracting(e -> ((NutritionDomainException) e).getKind())
                .isEqualTo(DomainErrorKind.USER_NOT_FOUND);

        assertThatThrownBy(() -> mealLog.createMealLog(1, 999, 100, "lunch", null))
                .isInstanceOf(NutritionDomainException.class)
                .hasMessage("Food not found: 999");
    }

    @Test
    void createMealLog_recordsNameAndTime() {
        LogRecord record = mealLog.createMealLog(2, 6, 150, "dinner", null);

        assertThat(record.getId()).isPositive();
        assertThat(record.getFoodName()).isEqualTo("Chicken Breast");
        assertThat(record.getLoggedAt().toLocalDate()).isEqualTo(NutritionFixtures.TODAY);
    }

    @Test
    void listMeals_paginates() {
        mealLog.createMealLog(2, 1, 40, "breakfast", null);
        mealLog.createMealLog(2, 2, 170, "breakfast", null);
        mealLog.createMealLog(2, 3, 120, "snack", null);

        List<MealRef> page = mealLog.listMeals(2, 2, 1);

        assertThat(page).hasSize(2);
        assertThat(mealLog.listMeals(2, 25, 0)).hasSize(3);
    }

    @Test
    void getGoals_returnsCopy() {
        goals.getGoals(3).put("protein_g", 999.0);

        assertThat(goals.getGoals(3)).containsEntry("protein_g", 5.0);
        assertThatThrownBy(() -> goals.getGoals(42)).isInstanceOf(NutritionDomainException.class);
    }
}
