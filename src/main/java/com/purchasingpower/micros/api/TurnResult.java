package com.purchasingpower.micros.api;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.purchasingpower.micros.exception.DomainErrorKind;
import com.purchasingpower.micros.model.nutrition.DaySummary;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.RecommendationItem;
import com.purchasingpower.micros.workflow.state.Intent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of one turn. {@code needsClarification} is true exactly when
 * {@code questions} holds one question. Every key is written, null or not.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
@JsonInclude(JsonInclude.Include.ALWAYS)
public class TurnResult {

    private boolean ok;
    private Intent intent;
    private String message;
    private double confidence;
    private boolean needsClarification;

    @Builder.Default
    private List<String> questions = new ArrayList<>();

    @Builder.Default
    private List<FoodSummary> candidates = new ArrayList<>();

    private FoodSummary selected;
    private LogRecord logResult;
    private DaySummary daySummary;

    @Builder.Default
    private List<RecommendationItem> recommendations = new ArrayList<>();

    /**
     * Set when a user, food or date could not be resolved; the turn still completes.
     */
    private DomainErrorKind domainError;

    /**
     * A tool loop stopped at its round-trip or time bound.
     */
    private boolean degraded;

    private String error;

    public static TurnResult error(String error) {
        return TurnResult.builder()
                .ok(false)
                .error(error)
                .build();
    }
}
