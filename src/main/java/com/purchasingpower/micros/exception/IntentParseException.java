package com.purchasingpower.micros.exception;

import lombok.Getter;

/**
 * Model output for intent classification could not be bound to an intent.
 * Always recovered by the heuristic parser.
 */
@Getter
public class IntentParseException extends RuntimeException {

    private final String rawResponse;

    public IntentParseException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public IntentParseException(String message, String rawResponse, Throwable cause) {
        super(message, cause);
        this.rawResponse = rawResponse;
    }
}
