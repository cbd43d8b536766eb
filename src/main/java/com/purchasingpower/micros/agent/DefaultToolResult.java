package com.purchasingpower.micros.agent;

import lombok.AllArgsConstructor;
import lombok.Getter;

@Getter
@AllArgsConstructor
public class DefaultToolResult implements ToolResult {

    private final boolean success;
    private final Object data;
    private final String message;

    @Override
    public boolean isSuccess() {
        return success;
    }
}
