package com.purchasingpower.micros.workflow;

import com.purchasingpower.micros.exception.WorkflowExecutionException;
import com.purchasingpower.micros.workflow.agents.BarcodeAgent;
import com.purchasingpower.micros.workflow.agents.DailyAnalysisAgent;
import com.purchasingpower.micros.workflow.agents.ElicitationAgent;
import com.purchasingpower.micros.workflow.agents.EvaluatorAgent;
import com.purchasingpower.micros.workflow.agents.FoodSearchAgent;
import com.purchasingpower.micros.workflow.agents.IntentExtractorAgent;
import com.purchasingpower.micros.workflow.agents.MealLoggingAgent;
import com.purchasingpower.micros.workflow.agents.RecommendationAgent;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.Intent;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.bsc.langgraph4j.CompiledGraph;
import org.bsc.langgraph4j.GraphStateException;
import org.bsc.langgraph4j.StateGraph;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import static org.bsc.langgraph4j.StateGraph.END;
import static org.bsc.langgraph4j.StateGraph.START;
import static org.bsc.langgraph4j.action.AsyncEdgeAction.edge_async;
import static org.bsc.langgraph4j.action.AsyncNodeAction.node_async;

/**
 * One conversational turn as a LangGraph4J graph.
 *
 * <pre>
 * START → intent_extractor → barcode ─────────────────────┐
 *                          → search_llm → search_post ────┤
 *                          → logging_llm → logging_post ──┤
 *                          → analysis_llm → analysis_post ┤
 *                          → recommend_llm → recommend_post
 *                                                         ↓
 *                                      evaluator → elicitation → END
 *                                                └────────────→ END
 * </pre>
 *
 * The *_llm nodes run the handler's tool loop and pass through when no model is configured.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class NutritionWorkflow {

    static final String INTENT_EXTRACTOR = "intent_extractor";
    static final String BARCODE = "barcode";
    static final String SEARCH_LLM = "search_llm";
    static final String SEARCH_POST = "search_post";
    static final String LOGGING_LLM = "logging_llm";
    static final String LOGGING_POST = "logging_post";
    static final String ANALYSIS_LLM = "analysis_llm";
    static final String ANALYSIS_POST = "analysis_post";
    static final String RECOMMEND_LLM = "recommend_llm";
    static final String RECOMMEND_POST = "recommend_post";
    static final String EVALUATOR = "evaluator";
    static final String ELICITATION = "elicitation";

    private final IntentExtractorAgent intentExtractor;
    private final BarcodeAgent barcodeAgent;
    private final FoodSearchAgent foodSearchAgent;
    private final MealLoggingAgent mealLoggingAgent;
    private final DailyAnalysisAgent dailyAnalysisAgent;
    private final RecommendationAgent recommendationAgent;
    private final EvaluatorAgent evaluatorAgent;
    private final ElicitationAgent elicitationAgent;

    private CompiledGraph<ConversationState> compiledGraph;

    @PostConstruct
    public void initialize() throws GraphStateException {
        log.info("🚀 Initializing nutrition conversation graph...");
        StateGraph<ConversationState> graph = new StateGraph<>(ConversationState::new);

        graph.addNode(INTENT_EXTRACTOR, node_async(intentExtractor::execute));
        graph.addNode(BARCODE, node_async(barcodeAgent::execute));
        graph.addNode(SEARCH_LLM, node_async(foodSearchAgent::assist));
        graph.addNode(SEARCH_POST, node_async(foodSearchAgent::execute));
        graph.addNode(LOGGING_LLM, node_async(mealLoggingAgent::assist));
        graph.addNode(LOGGING_POST, node_async(mealLoggingAgent::execute));
        graph.addNode(ANALYSIS_LLM, node_async(dailyAnalysisAgent::assist));
        graph.addNode(ANALYSIS_POST, node_async(dailyAnalysisAgent::execute));
        graph.addNode(RECOMMEND_LLM, node_async(recommendationAgent::assist));
        graph.addNode(RECOMMEND_POST, node_async(recommendationAgent::execute));
        graph.addNode(EVALUATOR, node_async(evaluatorAgent::execute));
        graph.addNode(ELICITATION, node_async(elicitationAgent::execute));

        graph.addEdge(START, INTENT_EXTRACTOR);

        graph.addConditionalEdges(INTENT_EXTRACTOR,
                edge_async(this::routeByIntent),
                Map.of(
                        BARCODE, BARCODE,
                        SEARCH_LLM, SEARCH_LLM,
                        LOGGING_LLM, LOGGING_LLM,
                        ANALYSIS_LLM, ANALYSIS_LLM,
                        RECOMMEND_LLM, RECOMMEND_LLM
                ));

        graph.addEdge(SEARCH_LLM, SEARCH_POST);
        graph.addEdge(LOGGING_LLM, LOGGING_POST);
        graph.addEdge(ANALYSIS_LLM, ANALYSIS_POST);
        graph.addEdge(RECOMMEND_LLM, RECOMMEND_POST);

        graph.addEdge(BARCODE, EVALUATOR);
        graph.addEdge(SEARCH_POST, EVALUATOR);
        graph.addEdge(LOGGING_POST, EVALUATOR);
        graph.addEdge(ANALYSIS_POST, EVALUATOR);
        graph.addEdge(RECOMMEND_POST, EVALUATOR);

        graph.addConditionalEdges(EVALUATOR,
                edge_async(s -> s.isNeedsClarification() ? ELICITATION : END),
                Map.of(ELICITATION, ELICITATION, END, END));

        graph.addEdge(ELICITATION, END);

        this.compiledGraph = graph.compile();
        log.info("✅ Nutrition conversation graph ready");
    }

    /**
     * Runs one turn. Handled problems (validation, missing data, domain errors) come back
     * in the state; anything else is raised as {@link WorkflowExecutionException}.
     */
    public ConversationState execute(ConversationState initialState) {
        Map<String, Object> initialData = new HashMap<>(initialState.toMap());

        try {
            Optional<ConversationState> result = compiledGraph.invoke(initialData);
            return result.orElse(initialState);
        } catch (Exception e) {
            log.error("Conversation graph failed", e);
            throw new WorkflowExecutionException("Conversation graph failed: " + e.getMessage(), e);
        }
    }

    String routeByIntent(ConversationState state) {
        Intent intent = state.getIntent();
        if (intent == null) {
            return SEARCH_LLM;
        }
        return switch (intent) {
            case SCAN_BARCODE -> BARCODE;
            case SEARCH_FOOD -> SEARCH_LLM;
            case LOG_MEAL -> LOGGING_LLM;
            case DAILY_SUMMARY -> ANALYSIS_LLM;
            case RECOMMEND -> RECOMMEND_LLM;
        };
    }
}
