package com.purchasingpower.micros.exception;

/**
 * The conversation graph failed in a way no node handled.
 */
public class WorkflowExecutionException extends RuntimeException {

    public WorkflowExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
