package com.purchasingpower.micros.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Settings for the conversation pipeline, loaded from {@code app.assistant}.
 *
 * <pre>
 * app:
 *   assistant:
 *     seed-resource: classpath:data/seed.yaml
 *     tool-loop:
 *       max-round-trips: 6
 *       deadline-seconds: 30
 *     search:
 *       limit: 5
 *     logging:
 *       browse-limit: 5
 *       default-meal-type: snack
 *     recommendation:
 *       top-gaps: 6
 *       top-foods: 5
 * </pre>
 */
@Data
@ConfigurationProperties(prefix = "app.assistant")
public class AssistantConfig {

    /**
     * Spring resource location of the YAML seed (users, goals, foods).
     */
    private String seedResource = "classpath:data/seed.yaml";

    private ToolLoopConfig toolLoop = new ToolLoopConfig();

    private SearchConfig search = new SearchConfig();

    private LoggingConfig logging = new LoggingConfig();

    private RecommendationConfig recommendation = new RecommendationConfig();

    /**
     * Bounds for one model/tool exchange inside a handler.
     */
    @Data
    public static class ToolLoopConfig {

        /**
         * Maximum model calls per loop. Reaching it ends the loop as exhausted.
         */
        private int maxRoundTrips = 6;

        /**
         * Wall-clock budget for the whole loop, checked before each model call.
         */
        private int deadlineSeconds = 30;
    }

    @Data
    public static class SearchConfig {

        private int limit = 5;
    }

    @Data
    public static class LoggingConfig {

        /**
         * Number of suggestions offered when the user has not named a food.
         */
        private int browseLimit = 5;

        private String defaultMealType = "snack";
    }

    @Data
    public static class RecommendationConfig {

        /**
         * Largest nutrient gaps considered when scoring foods.
         */
        private int topGaps = 6;

        private int topFoods = 5;
    }
}
