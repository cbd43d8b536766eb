package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.ExtractedEntities;
import com.purchasingpower.micros.workflow.state.ValidationIssue;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Validates and normalizes the amount after the handler ran.
 *
 * A readable amount in (0, 5000] replaces the raw text with its numeric value; anything
 * else records a {@link ValidationIssue} and asks for a new amount. Running it twice
 * gives the same state. A clarification raised earlier in the turn is never cleared.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class EvaluatorAgent {

    private final GramsNormalizer gramsNormalizer;

    public Map<String, Object> execute(ConversationState state) {
        Map<String, Object> updates = new HashMap<>();
        ExtractedEntities entities = state.getEntities();
        GramsNormalizer.GramsCheck check = gramsNormalizer.check(entities);

        if (check.isValid()) {
            if (!check.grams().equals(entities.getGrams()) || entities.getGramsText() != null) {
                updates.put(ConversationState.ENTITIES, entities.toBuilder()
                        .grams(check.grams())
                        .gramsText(null)
                        .build());
            }
            return updates;
        }

        check.toIssue().ifPresent(issue -> {
            log.info("⚠️ Amount rejected ({}): {}", check.status(), describeAmount(entities));
            updates.put(ConversationState.VALIDATION_ISSUE, issue);
            updates.putAll(ConversationState.clarification(issue.question(), issue.response()));
        });
        return updates;
    }

    private static String describeAmount(ExtractedEntities entities) {
        return entities.getGrams() != null ? String.valueOf(entities.getGrams()) : entities.getGramsText();
    }
}
