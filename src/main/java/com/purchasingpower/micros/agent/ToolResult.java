package com.purchasingpower.micros.agent;

/**
 * Result from a tool execution, fed back to the model as a tool-result message.
 */
public interface ToolResult {

    boolean isSuccess();

    /**
     * The primary result data (foods, a log record, a day summary, goals).
     */
    Object getData();

    /**
     * Short human-readable outcome or failure reason.
     */
    String getMessage();

    static ToolResult success(Object data, String message) {
        return new DefaultToolResult(true, data, message);
    }

    static ToolResult failure(String message) {
        return new DefaultToolResult(false, null, message);
    }
}
