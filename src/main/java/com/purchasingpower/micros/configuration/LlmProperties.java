package com.purchasingpower.micros.configuration;

import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Min;
import lombok.Data;

/**
 * Settings shared by every chat model, applied at the model-call boundary.
 */
@Data
public class LlmProperties {

    @Min(1)
    private int timeoutSeconds = 30;

    @Min(0)
    private int maxRetries = 2;

    @DecimalMin("0.0")
    @DecimalMax("2.0")
    private double temperature = 0.1;

    private boolean logRequests = false;

    private boolean logResponses = false;
}
