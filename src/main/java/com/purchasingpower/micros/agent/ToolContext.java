package com.purchasingpower.micros.agent;

import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.workflow.state.CandidateSource;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Per-turn context handed to tools.
 *
 * <p>Besides the acting user, it collects what the tools produced (candidates, a
 * logged meal, entity hints taken from tool arguments) so the handler can copy those
 * into the conversation state after the loop ends.
 */
public interface ToolContext {

    long getUserId();

    void recordCandidates(List<FoodSummary> candidates, CandidateSource source);

    List<FoodSummary> getCandidates();

    CandidateSource getCandidateSource();

    void recordLoggedMeal(LogRecord record);

    Optional<LogRecord> getLoggedMeal();

    /**
     * Remember an entity value the model supplied as a tool argument, e.g. "food_name".
     */
    void hint(String entityKey, Object value);

    Map<String, Object> getHints();

    /**
     * Outcome of checking the amount the user stated this turn. Write tools must not
     * record an amount the user did not give.
     */
    GramsNormalizer.GramsCheck getRequestedAmount();
}
