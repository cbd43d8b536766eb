package com.purchasingpower.micros.api;

import com.purchasingpower.micros.service.NutritionAssistantService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST adapter for the conversation pipeline.
 *
 * POST /api/v1/agent
 * {"user_id": 1, "message": "log 100g food_id=1 for breakfast"}
 */
@Slf4j
@RestController
@RequestMapping("/api/v1/agent")
@RequiredArgsConstructor
public class AgentController {

    private final NutritionAssistantService assistantService;

    @PostMapping
    public ResponseEntity<TurnResult> turn(@Valid @RequestBody TurnRequest request) {
        if (request.getMessage() == null || request.getMessage().isBlank()) {
            return ResponseEntity.badRequest().body(TurnResult.error("Message is required"));
        }

        TurnResult result = assistantService.handle(request);
        if (!result.isOk()) {
            return ResponseEntity.internalServerError().body(result);
        }
        return ResponseEntity.ok(result);
    }
}
