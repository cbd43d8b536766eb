package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.parser.GramsNormalizer;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.ExtractedEntities;
import com.purchasingpower.micros.workflow.state.Intent;
import com.purchasingpower.micros.workflow.state.ValidationIssue;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class EvaluatorAgentTest {

    private final EvaluatorAgent evaluator = new EvaluatorAgent(new GramsNormalizer());

    @Test
    void textualAmountIsReplacedByNumber() {
        // Given
        ConversationState state = logMealWith(ExtractedEntities.builder().foodId(1L).gramsText(" 100 G ").build());

        // When
        ConversationState result = apply(state);

        // Then
        assertThat(result.getEntities().getGrams()).isEqualTo(100.0);
        assertThat(result.getEntities().getGramsText()).isNull();
        assertThat(result.getEntities().getFoodId()).isEqualTo(1L);
        assertThat(result.isNeedsClarification()).isFalse();
    }

    @Test
    void zeroGramsRaisesClarification() {
        ConversationState result = apply(logMealWith(ExtractedEntities.builder().grams(0.0).build()));

        assertThat(result.isNeedsClarification()).isTrue();
        assertThat(result.getQuestions()).containsExactly("How many grams?");
        assertThat(result.getValidationIssue()).isNotNull();
    }

    @Test
    void hugeAmountRaisesReasonableAmountQuestion() {
        ConversationState result = apply(logMealWith(ExtractedEntities.builder().grams(6000.0).build()));

        assertThat(result.getQuestions())
                .containsExactly("Please provide a reasonable grams amount (e.g., 50, 100, 200).");
        assertThat(result.getResponse()).isEqualTo("That seems too large. Did you mean a smaller amount in grams?");
    }

    @Test
    void idempotent() {
        ConversationState valid = logMealWith(ExtractedEntities.builder().gramsText("80grams").build());
        ConversationState invalid = logMealWith(ExtractedEntities.builder().gramsText("lots").build());

        ConversationState validOnce = apply(valid);
        ConversationState invalidOnce = apply(invalid);

        assertThat(apply(validOnce).data()).isEqualTo(validOnce.data());
        assertThat(apply(invalidOnce).data()).isEqualTo(invalidOnce.data());
    }

    @Test
    void upstreamClarificationIsKept() {
        // Given - the barcode handler already asked something and no amount was given
        Map<String, Object> data = new HashMap<>(ConversationState.builder()
                .userId(1)
                .intent(Intent.SCAN_BARCODE)
                .build().data());
        data.putAll(ConversationState.clarification("Would you like to search by name instead?", null));

        // When
        ConversationState result = apply(new ConversationState(data));

        // Then
        assertThat(result.isNeedsClarification()).isTrue();
        assertThat(result.getQuestions()).containsExactly("Would you like to search by name instead?");
    }

    @Test
    void invalidAmountRecordsIssueForElicitation() {
        ConversationState result = apply(logMealWith(ExtractedEntities.builder().grams(-5.0).build()));

        ValidationIssue issue = result.getValidationIssue();
        assertThat(issue.field()).isEqualTo("grams");
        assertThat(issue.question()).isEqualTo("How many grams?");
        assertThat(result.getQuestions()).isEqualTo(List.of(issue.question()));
    }

    private ConversationState apply(ConversationState state) {
        Map<String, Object> merged = new HashMap<>(state.data());
        merged.putAll(evaluator.execute(state));
        return new ConversationState(merged);
    }

    private static ConversationState logMealWith(ExtractedEntities entities) {
        return ConversationState.builder()
                .userId(1)
                .intent(Intent.LOG_MEAL)
                .entities(entities)
                .build();
    }
}
