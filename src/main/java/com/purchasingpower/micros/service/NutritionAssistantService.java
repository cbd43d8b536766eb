package com.purchasingpower.micros.service;

import com.purchasingpower.micros.api.TurnRequest;
import com.purchasingpower.micros.api.TurnResult;
import com.purchasingpower.micros.workflow.NutritionWorkflow;
import com.purchasingpower.micros.workflow.state.CandidateSource;
import com.purchasingpower.micros.workflow.state.ConversationState;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for one conversational turn: builds a fresh state, runs the graph and
 * maps the final state to a {@link TurnResult}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class NutritionAssistantService {

    private final NutritionWorkflow workflow;

    public TurnResult handle(TurnRequest request) {
        long startTime = System.currentTimeMillis();
        log.info("═══════════════════════════════════════════════════════════");
        log.info("💬 Turn for user {}: {}", request.getUserId(), request.getMessage());

        try {
            ConversationState initial = ConversationState.builder()
                    .userId(request.getUserId())
                    .inputText(request.getMessage())
                    .candidates(request.getCandidates(), CandidateSource.CALLER)
                    .selected(request.getSelected())
                    .build();

            ConversationState finalState = workflow.execute(initial);
            TurnResult result = toResult(finalState);

            log.info("✅ Turn finished in {}ms: intent={}, clarification={}",
                    System.currentTimeMillis() - startTime, result.getIntent(), result.isNeedsClarification());
            return result;
        } catch (RuntimeException e) {
            log.error("❌ Turn failed for user {}", request.getUserId(), e);
            return TurnResult.error(e.getMessage());
        }
    }

    static TurnResult toResult(ConversationState state) {
        List<String> questions = state.getQuestions();
        boolean needsClarification = state.isNeedsClarification() && questions.size() == 1;
        if (state.isNeedsClarification() != needsClarification || (!needsClarification && !questions.isEmpty())) {
            log.warn("Inconsistent clarification state (flag={}, questions={}), normalizing",
                    state.isNeedsClarification(), questions.size());
        }

        return TurnResult.builder()
                .ok(true)
                .intent(state.getIntent())
                .message(state.getResponse())
                .confidence(state.getConfidence())
                .needsClarification(needsClarification)
                .questions(needsClarification ? new ArrayList<>(questions) : new ArrayList<>())
                .candidates(new ArrayList<>(state.getCandidates()))
                .selected(state.getSelected())
                .logResult(state.getLogResult())
                .daySummary(state.getDaySummary())
                .recommendations(new ArrayList<>(state.getRecommendations()))
                .domainError(state.getDomainError())
                .degraded(state.isDegraded())
                .build();
    }
}
