package com.purchasingpower.micros.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.stream.Collectors;

@Slf4j
@RestControllerAdvice(assignableTypes = AgentController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class AgentExceptionAdvice {

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<TurnResult> handleInvalid(MethodArgumentNotValidException e) {
        String detail = e.getBindingResult().getFieldErrors().stream()
                .map(error -> error.getField() + " " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return ResponseEntity.badRequest().body(TurnResult.error("Invalid request: " + detail));
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<TurnResult> handleUnreadable(HttpMessageNotReadableException e) {
        log.debug("Unreadable request body: {}", e.getMessage());
        return ResponseEntity.badRequest().body(TurnResult.error("Malformed request body"));
    }

    @ExceptionHandler(RuntimeException.class)
    public ResponseEntity<TurnResult> handleUnexpected(RuntimeException e) {
        log.error("Unhandled error in agent endpoint", e);
        return ResponseEntity.status(HttpStatus.INTERNAL_SERVER_ERROR).body(TurnResult.error(e.getMessage()));
    }
}
