package com.purchasingpower.micros.util;

import com.purchasingpower.micros.NutritionFixtures;
import com.purchasingpower.micros.exception.DomainErrorKind;
import com.purchasingpower.micros.exception.NutritionDomainException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DateResolverTest {

    private final DateResolver resolver = new DateResolver(NutritionFixtures.fixedClock());

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"today", " Today ", "now"})
    void todayForms(String reference) {
        assertThat(resolver.resolve(reference)).isEqualTo(NutritionFixtures.TODAY);
    }

    @Test
    void yesterday() {
        assertThat(resolver.resolve("YESTERDAY")).isEqualTo(LocalDate.of(2024, 4, 30));
    }

    @Test
    void isoDate() {
        assertThat(resolver.resolve("2023-12-31")).isEqualTo(LocalDate.of(2023, 12, 31));
    }

    @ParameterizedTest
    @ValueSource(strings = {"last friday", "2024-13-01", "31/12/2023"})
    void anythingElseIsAnInvalidDate(String reference) {
        assertThatThrownBy(() -> resolver.resolve(reference))
                .isInstanceOf(NutritionDomainException.class)
                .hasMessage("Unrecognized date: " + reference)
                .extracting(e -> ((NutritionDomainException) e).getKind())
                .isEqualTo(DomainErrorKind.INVALID_DATE);
    }
}
