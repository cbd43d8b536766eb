package com.purchasingpower.micros.workflow.state;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;

/**
 * Slots pulled out of the user's message. Always present in the state, possibly empty.
 *
 * <p>{@code gramsText} holds a textual amount ("100 G") until the evaluator normalizes it
 * into {@code grams}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ExtractedEntities implements Serializable {

    private static final long serialVersionUID = 1L;

    private String foodName;
    private Double grams;
    private String gramsText;
    private String upc;
    private String mealType;
    private String date;
    private Long foodId;

    public static ExtractedEntities empty() {
        return new ExtractedEntities();
    }

    @JsonIgnore
    public boolean hasFoodName() {
        return foodName != null && !foodName.isBlank();
    }

    @JsonIgnore
    public boolean hasUpc() {
        return upc != null && !upc.isBlank();
    }

    @JsonIgnore
    public boolean hasDate() {
        return date != null && !date.isBlank();
    }

    @JsonIgnore
    public boolean hasMealType() {
        return mealType != null && !mealType.isBlank();
    }

    /**
     * True when any amount was supplied, normalized or not.
     */
    @JsonIgnore
    public boolean hasAmount() {
        return grams != null || (gramsText != null && !gramsText.isBlank());
    }
}
