package com.purchasingpower.micros.api;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One user message. Earlier context (candidates, a selection) is only used when the
 * caller sends it back.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class TurnRequest {

    @NotNull
    private Long userId;

    private String message;

    /**
     * Foods offered in the previous turn.
     */
    @Builder.Default
    private List<FoodSummary> candidates = new ArrayList<>();

    private FoodSummary selected;
}
