package com.purchasingpower.micros.util;

import com.purchasingpower.micros.exception.DomainErrorKind;
import com.purchasingpower.micros.exception.NutritionDomainException;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.Locale;

/**
 * Resolves a day reference against the injected clock.
 * Absent, "today" and "now" mean today; "yesterday" means today minus one day;
 * anything else must be an ISO calendar date.
 */
@Component
@RequiredArgsConstructor
public class DateResolver {

    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    public LocalDate resolve(String reference) {
        if (reference == null || reference.isBlank()) {
            return today();
        }
        String normalized = reference.trim().toLowerCase(Locale.ROOT);
        switch (normalized) {
            case "today", "now":
                return today();
            case "yesterday":
                return today().minusDays(1);
            default:
                try {
                    return LocalDate.parse(normalized);
                } catch (DateTimeParseException e) {
                    throw new NutritionDomainException(DomainErrorKind.INVALID_DATE,
                            "Unrecognized date: " + reference);
                }
        }
    }
}
