package com.purchasingpower.micros.configuration;

import jakarta.validation.constraints.NotBlank;
import lombok.Data;

@Data
public class OpenAiProperties {

    private String apiKey;

    @NotBlank
    private String chatModel = "gpt-4o-mini";
}
