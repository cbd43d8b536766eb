package com.purchasingpower.micros.agent;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Handlers that may run a tool loop, with the prompt each one uses as its system message.
 */
@Getter
@RequiredArgsConstructor
public enum HandlerKind {
    SEARCH("search-agent"),
    LOGGING("logging-agent"),
    ANALYSIS("analysis-agent"),
    RECOMMEND("recommend-agent");

    private final String promptName;
}
