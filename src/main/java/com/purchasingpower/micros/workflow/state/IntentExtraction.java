package com.purchasingpower.micros.workflow.state;

/**
 * Output of intent classification.
 *
 * @param intent     classified intent, null when the model left it unset
 * @param entities   extracted slots, never null
 * @param confidence clamped to [0, 1]; NaN becomes 0
 * @param fromModel  false when the heuristic parser produced the result
 */
public record IntentExtraction(Intent intent, ExtractedEntities entities, double confidence, boolean fromModel) {

    public IntentExtraction {
        entities = entities != null ? entities : ExtractedEntities.empty();
        confidence = Double.isNaN(confidence) ? 0.0 : Math.max(0.0, Math.min(1.0, confidence));
    }
}
