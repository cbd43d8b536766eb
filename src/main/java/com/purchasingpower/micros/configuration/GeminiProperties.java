package com.purchasingpower.micros.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class GeminiProperties {

    private String apiKey;

    @NotBlank
    private String chatModel = "gemini-1.5-flash";
}
