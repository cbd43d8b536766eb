package com.purchasingpower.micros.agent.impl;

import com.purchasingpower.micros.agent.ToolContext;
import com.purchasingpower.micros.model.nutrition.FoodSummary;
import com.purchasingpower.micros.model.nutrition.LogRecord;
import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import lombok.Builder;
import lombok.Data;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Default implementation of ToolContext. One instance per handler invocation.
 */
@Data
@Builder
public class ToolContextImpl implements ToolContext {

    private long userId;

    @Builder.Default
    private List<FoodSummary> candidates = new ArrayList<>();

    private CandidateSource candidateSource;

    private LogRecord loggedMeal;

    @Builder.Default
    private Map<String, Object> hints = new LinkedHashMap<>();

    @Builder.Default
    private GramsNormalizer.GramsCheck requestedAmount = new GramsNormalizer.GramsCheck(GramsNormalizer.Status.ABSENT, null);

    /**
     * Search and UPC results replace an earlier browse list, never the other way round.
     */
    @Override
    public void recordCandidates(List<FoodSummary> found, CandidateSource source) {
        if (found == null || found.isEmpty()) {
            return;
        }
        if (source == CandidateSource.BROWSE && candidateSource != null && candidateSource != CandidateSource.BROWSE) {
            return;
        }
        candidates = new ArrayList<>(found);
        candidateSource = source;
    }

    @Override
    public void recordLoggedMeal(LogRecord record) {
        this.loggedMeal = record;
    }

    @Override
    public Optional<LogRecord> getLoggedMeal() {
        return Optional.ofNullable(loggedMeal);
    }

    @Override
    public void hint(String entityKey, Object value) {
        if (value != null) {
            hints.put(entityKey, value);
        }
    }

    public static ToolContextImpl forUser(long userId) {
        return ToolContextImpl.builder().userId(userId).build();
    }
}
