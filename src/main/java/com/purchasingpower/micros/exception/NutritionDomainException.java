package com.purchasingpower.micros.exception;

import lombok.Getter;

/**
 * Raised by the nutrition services when a referenced user or food does not exist,
 * or when a day cannot be resolved. Handlers turn it into plain response text.
 */
@Getter
public class NutritionDomainException extends RuntimeException {

    private final DomainErrorKind kind;

    public NutritionDomainException(DomainErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public static NutritionDomainException userNotFound(long userId) {
        return new NutritionDomainException(DomainErrorKind.USER_NOT_FOUND, "User not found: " + userId);
    }

    public static NutritionDomainException foodNotFound(long foodId) {
        return new NutritionDomainException(DomainErrorKind.FOOD_NOT_FOUND, "Food not found: " + foodId);
    }
}
