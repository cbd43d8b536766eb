package com.purchasingpower.micros.workflow.state;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Optional;

/**
 * Closed set of user goals the assistant can act on.
 */
public enum Intent {
    SCAN_BARCODE("scan_barcode"),
    SEARCH_FOOD("search_food"),
    LOG_MEAL("log_meal"),
    DAILY_SUMMARY("daily_summary"),
    RECOMMEND("recommend");

    private final String wireName;

    Intent(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    /**
     * Lenient lookup by wire name ("log_meal") or constant name ("LOG_MEAL").
     */
    public static Optional<Intent> fromWireName(String value) {
        if (value == null) {
            return Optional.empty();
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
                .filter(intent -> intent.wireName.equals(normalized))
                .findFirst();
    }
}
