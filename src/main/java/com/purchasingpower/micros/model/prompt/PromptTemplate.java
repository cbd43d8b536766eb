package com.purchasingpower.micros.model.prompt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.Data;

/**
 * Prompt template loaded from YAML.
 *
 * <pre>
 * name: intent-extractor
 * version: 1.0
 * description: Classifies a message into one intent
 * systemPrompt: |
 *   You classify nutrition requests...
 * userPrompt: |
 *   Message: {{message}}
 * </pre>
 *
 * @see com.purchasingpower.micros.service.PromptLibraryService
 */
@Data
@JsonIgnoreProperties(ignoreUnknown = true)
public class PromptTemplate {
    private String name;
    private String version;
    private String description;
    private String systemPrompt;
    private String userPrompt;
}
