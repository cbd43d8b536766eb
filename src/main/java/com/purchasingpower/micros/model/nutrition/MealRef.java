package com.purchasingpower.micros.model.nutrition;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class MealRef implements Serializable {

    private static final long serialVersionUID = 1L;

    private Long id;
    private Long foodId;
    private String foodName;
    private double grams;
    private String mealType;
    private LocalDateTime loggedAt;

    public static MealRef from(LogRecord record) {
        return MealRef.builder()
                .id(record.getId())
                .foodId(record.getFoodId())
                .foodName(record.getFoodName())
                .grams(record.getGrams())
                .mealType(record.getMealType())
                .loggedAt(record.getLoggedAt())
                .build();
    }
}
