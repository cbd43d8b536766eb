package com.purchasingpower.micros.workflow.state;

import java.io.Serializable;

/**
 * A supplied entity value that failed validation.
 *
 * @param field    entity key, e.g. "grams"
 * @param question the single follow-up question to ask
 * @param response user-facing explanation
 */
public record ValidationIssue(String field, String question, String response) implements Serializable {
}
