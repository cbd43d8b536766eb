package com.purchasingpower.micros.parser;

import com.purchasingpower.micros.workflow.state.ExtractedEntities;
import com.purchasingpower.micros.workflow.state.ValidationIssue;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.Optional;

/**
 * Turns a supplied amount into grams and checks it is in (0, 5000].
 *
 * Shared by the evaluator and every code path that writes a meal log, so an
 * invalid amount can never be recorded.
 */
@Component
public class GramsNormalizer {

    public static final double MAX_GRAMS = 5000.0;

    public static final String GRAMS_QUESTION = "How many grams?";
    public static final String REASONABLE_GRAMS_QUESTION = "Please provide a reasonable grams amount (e.g., 50, 100, 200).";

    private static final String[] UNIT_SUFFIXES = {"grams", "gram", "g"};

    public enum Status {
        ABSENT,
        VALID,
        UNREADABLE,
        NOT_POSITIVE,
        TOO_LARGE
    }

    /**
     * @param grams normalized value, set for VALID, NOT_POSITIVE and TOO_LARGE
     */
    public record GramsCheck(Status status, Double grams) {

        public boolean isValid() {
            return status == Status.VALID;
        }

        public boolean isInvalid() {
            return status != Status.VALID && status != Status.ABSENT;
        }

        public Optional<ValidationIssue> toIssue() {
            return switch (status) {
                case UNREADABLE -> Optional.of(new ValidationIssue("grams", GRAMS_QUESTION,
                        "I couldn't read the amount. " + GRAMS_QUESTION));
                case NOT_POSITIVE -> Optional.of(new ValidationIssue("grams", GRAMS_QUESTION,
                        "The amount must be greater than 0g. " + GRAMS_QUESTION));
                case TOO_LARGE -> Optional.of(new ValidationIssue("grams", REASONABLE_GRAMS_QUESTION,
                        "That seems too large. Did you mean a smaller amount in grams?"));
                case ABSENT, VALID -> Optional.empty();
            };
        }
    }

    /**
     * "100g", " 100 G ", "80 grams" → 100.0, 100.0, 80.0. Empty when the text is not a number.
     */
    public Optional<Double> parse(String text) {
        if (text == null) {
            return Optional.empty();
        }
        String compact = text.toLowerCase(Locale.ROOT).replaceAll("\\s+", "");
        for (String suffix : UNIT_SUFFIXES) {
            if (compact.endsWith(suffix)) {
                compact = compact.substring(0, compact.length() - suffix.length());
                break;
            }
        }
        if (compact.isEmpty()) {
            return Optional.empty();
        }
        try {
            double value = Double.parseDouble(compact);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                return Optional.empty();
            }
            return Optional.of(value);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public GramsCheck check(ExtractedEntities entities) {
        return check(entities.getGrams(), entities.getGramsText());
    }

    /**
     * A normalized amount wins over the text; the text is only parsed when no number is set.
     */
    public GramsCheck check(Double grams, String text) {
        Double value = grams;
        if (value == null) {
            if (text == null || text.isBlank()) {
                return new GramsCheck(Status.ABSENT, null);
            }
            Optional<Double> parsed = parse(text);
            if (parsed.isEmpty()) {
                return new GramsCheck(Status.UNREADABLE, null);
            }
            value = parsed.get();
        }
        return check(value);
    }

    public GramsCheck check(double grams) {
        if (grams <= 0) {
            return new GramsCheck(Status.NOT_POSITIVE, grams);
        }
        if (grams > MAX_GRAMS) {
            return new GramsCheck(Status.TOO_LARGE, grams);
        }
        return new GramsCheck(Status.VALID, grams);
    }
}
