package com.purchasingpower.micros.workflow.state;

import com.purchasingpower.micros.exception.DomainErrorKind;
import com.purchasingpower.micros.model.nutrition.DaySummary;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.model.nutrition.RecommendationItem;
import org.bsc.langgraph4j.state.AgentState;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-turn state for the LangGraph4J conversation graph.
 *
 * Nodes read through the typed getters and return partial update maps keyed by the
 * constants below. The graph clones state between nodes, so every stored value is
 * Serializable and never null (absent keys mean "unset").
 */
public class ConversationState extends AgentState {

    public static final String USER_ID = "userId";
    public static final String INPUT_TEXT = "inputText";
    public static final String INTENT = "intent";
    public static final String ENTITIES = "entities";
    public static final String CONFIDENCE = "confidence";
    public static final String CANDIDATES = "candidates";
    public static final String CANDIDATE_SOURCE = "candidateSource";
    public static final String SELECTED = "selected";
    public static final String LOG_RESULT = "logResult";
    public static final String DAY_SUMMARY = "daySummary";
    public static final String RECOMMENDATIONS = "recommendations";
    public static final String RESPONSE = "response";
    public static final String NEEDS_CLARIFICATION = "needsClarification";
    public static final String QUESTIONS = "questions";
    public static final String VALIDATION_ISSUE = "validationIssue";
    public static final String DOMAIN_ERROR = "domainError";
    public static final String DEGRADED = "degraded";

    public ConversationState(Map<String, Object> initData) {
        super(initData);
    }

    // ================================================================
    // INPUTS
    // ================================================================

    public Long getUserId() {
        return this.<Long>value(USER_ID).orElse(null);
    }

    public String getInputText() {
        return this.<String>value(INPUT_TEXT).orElse("");
    }

    // ================================================================
    // CLASSIFICATION
    // ================================================================

    public Intent getIntent() {
        return this.<Intent>value(INTENT).orElse(null);
    }

    public ExtractedEntities getEntities() {
        return this.<ExtractedEntities>value(ENTITIES).orElseGet(ExtractedEntities::empty);
    }

    /**
     * Typed slot view for the active intent.
     */
    public IntentSlots getSlots() {
        return IntentSlots.of(getIntent(), getEntities());
    }

    public double getConfidence() {
        return this.<Double>value(CONFIDENCE).orElse(0.0);
    }

    // ================================================================
    // HANDLER OUTPUTS
    // ================================================================

    public List<FoodSummary> getCandidates() {
        return this.<List<FoodSummary>>value(CANDIDATES).orElse(List.of());
    }

    public CandidateSource getCandidateSource() {
        return this.<CandidateSource>value(CANDIDATE_SOURCE).orElse(null);
    }

    public FoodSummary getSelected() {
        return this.<FoodSummary>value(SELECTED).orElse(null);
    }

    public LogRecord getLogResult() {
        return this.<LogRecord>value(LOG_RESULT).orElse(null);
    }

    public DaySummary getDaySummary() {
        return this.<DaySummary>value(DAY_SUMMARY).orElse(null);
    }

    public List<RecommendationItem> getRecommendations() {
        return this.<List<RecommendationItem>>value(RECOMMENDATIONS).orElse(List.of());
    }

    public String getResponse() {
        return this.<String>value(RESPONSE).orElse(null);
    }

    // ================================================================
    // CLARIFICATION & ERRORS
    // ================================================================

    public boolean isNeedsClarification() {
        return this.<Boolean>value(NEEDS_CLARIFICATION).orElse(false);
    }

    public List<String> getQuestions() {
        return this.<List<String>>value(QUESTIONS).orElse(List.of());
    }

    public ValidationIssue getValidationIssue() {
        return this.<ValidationIssue>value(VALIDATION_ISSUE).orElse(null);
    }

    public DomainErrorKind getDomainError() {
        return this.<DomainErrorKind>value(DOMAIN_ERROR).orElse(null);
    }

    public boolean isDegraded() {
        return this.<Boolean>value(DEGRADED).orElse(false);
    }

    /**
     * A food counts as already chosen when an id was given, one was selected,
     * or the caller/search supplied candidates (browse suggestions do not count).
     */
    public boolean hasPriorFoodChoice() {
        if (getEntities().getFoodId() != null || getSelected() != null) {
            return true;
        }
        return !getCandidates().isEmpty() && getCandidateSource() != CandidateSource.BROWSE;
    }

    public Map<String, Object> toMap() {
        return new HashMap<>(data());
    }

    // ================================================================
    // UPDATE HELPERS
    // ================================================================

    /**
     * Update map that asks the user exactly one question.
     */
    public static Map<String, Object> clarification(String question, String response) {
        Map<String, Object> updates = new HashMap<>();
        updates.put(NEEDS_CLARIFICATION, true);
        updates.put(QUESTIONS, new ArrayList<>(List.of(question)));
        updates.put(RESPONSE, response != null ? response : question);
        return updates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Map<String, Object> data = new HashMap<>();

        public Builder userId(long userId) {
            data.put(USER_ID, userId);
            return this;
        }

        public Builder inputText(String inputText) {
            data.put(INPUT_TEXT, inputText != null ? inputText : "");
            return this;
        }

        public Builder intent(Intent intent) {
            if (intent != null) {
                data.put(INTENT, intent);
            }
            return this;
        }

        public Builder entities(ExtractedEntities entities) {
            if (entities != null) {
                data.put(ENTITIES, entities);
            }
            return this;
        }

        public Builder candidates(List<FoodSummary> candidates, CandidateSource source) {
            if (candidates != null && !candidates.isEmpty()) {
                data.put(CANDIDATES, new ArrayList<>(candidates));
                data.put(CANDIDATE_SOURCE, source);
            }
            return this;
        }

        public Builder selected(FoodSummary selected) {
            if (selected != null) {
                data.put(SELECTED, selected);
            }
            return this;
        }

        public ConversationState build() {
            data.putIfAbsent(ENTITIES, ExtractedEntities.empty());
            data.putIfAbsent(NEEDS_CLARIFICATION, false);
            data.putIfAbsent(QUESTIONS, new ArrayList<String>());
            data.putIfAbsent(CONFIDENCE, 0.0);
            return new ConversationState(data);
        }
    }
}
