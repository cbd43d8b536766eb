package com.purchasingpower.micros.workflow.agents;

import com.purchasingpower.micros.client.LLMProvider;
import com.purchasingpower.micros.client.LLMProviderFactory;
import com.purchasingpower.micros.exception.IntentParseException;
import com.purchasingpower.micros.parser.HeuristicIntentParser;
import com.purchasingpower.micros.parser.IntentResponseParser;
import com.purchasingpower.micros.service.PromptLibraryService;
import com.purchasingpower.micros.workflow.state.ConversationState;
import com.purchasingpower.micros.workflow.state.IntentExtraction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Classifies the message into one of the five intents and pulls out its entities.
 *
 * Asks the model first when one is configured; an unparseable answer or a failed call
 * falls back to {@link HeuristicIntentParser}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class IntentExtractorAgent {

    private static final String AGENT_NAME = "IntentExtractor";

    private final LLMProviderFactory llmProviderFactory;
    private final PromptLibraryService promptLibrary;
    private final IntentResponseParser intentResponseParser;
    private final HeuristicIntentParser heuristicIntentParser;

    public Map<String, Object> execute(ConversationState state) {
        String text = state.getInputText();
        log.info("🎯 Extracting intent: {}", text);

        IntentExtraction extraction = extract(text);
        log.info("   → {} (confidence {}, {})", extraction.intent(), extraction.confidence(),
                extraction.fromModel() ? "model" : "heuristic");

        Map<String, Object> updates = new HashMap<>();
        updates.put(ConversationState.INTENT, extraction.intent());
        updates.put(ConversationState.ENTITIES, extraction.entities());
        updates.put(ConversationState.CONFIDENCE, extraction.confidence());
        return updates;
    }

    public IntentExtraction extract(String text) {
        Optional<LLMProvider> provider = llmProviderFactory.getProvider();
        if (provider.isEmpty()) {
            return heuristicIntentParser.parse(text);
        }

        try {
            String prompt = promptLibrary.render("intent-extractor", Map.of("message", text));
            String response = provider.get().chat(prompt, AGENT_NAME);
            return intentResponseParser.parse(response);
        } catch (IntentParseException e) {
            log.warn("⚠️ Model intent answer unusable ({}), using heuristics", e.getMessage());
            log.debug("   Raw answer: {}", e.getRawResponse());
        } catch (RuntimeException e) {
            log.warn("⚠️ Intent model call failed ({}), using heuristics", e.getMessage());
        }
        return heuristicIntentParser.parse(text);
    }
}
