package com.purchasingpower.micros.exception;

/**
 * Machine-readable category of a domain failure that was surfaced to the user as text.
 */
public enum DomainErrorKind {
    USER_NOT_FOUND,
    FOOD_NOT_FOUND,
    INVALID_DATE
}
