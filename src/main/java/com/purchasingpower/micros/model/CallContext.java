package com.purchasingpower.micros.model;

import org.slf4j.Logger;

import java.time.Duration;
import java.time.Instant;
import java.util.UUID;

/**
 * One external call in flight: a short call id, the target and its start time.
 * Request and response lines share the id so they can be paired in the logs.
 *
 * @see com.purchasingpower.micros.util.ExternalCallLogger
 */
public class CallContext {
    private final String callId;
    private final ServiceType service;
    private final String operation;
    private final String caller;
    private final Instant startTime;
    private final Logger logger;

    public CallContext(ServiceType service, String operation, String caller, Logger logger) {
        this.callId = UUID.randomUUID().toString().substring(0, 8);
        this.service = service;
        this.operation = operation;
        this.caller = caller;
        this.startTime = Instant.now();
        this.logger = logger;
    }

    public void logRequest(String summary) {
        logger.info("{} {} → {} [{}] caller={}",
                service.getEmoji(), service.getName(), operation, callId, caller);
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Request: {}", summary);
        }
    }

    public void logResponse(String summary) {
        logger.info("{} {} ← {} [{}] ({}ms)",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs());
        if (summary != null && !summary.isEmpty()) {
            logger.debug("  Response: {}", summary);
        }
    }

    public void logError(String errorMessage, Throwable ex) {
        logger.error("{} {} ✖ {} [{}] ({}ms) - {}",
                service.getEmoji(), service.getName(), operation, callId, getElapsedMs(), errorMessage);
        if (ex != null) {
            logger.debug("  Error details:", ex);
        }
    }

    public String getCallId() {
        return callId;
    }

    public long getElapsedMs() {
        return Duration.between(startTime, Instant.now()).toMillis();
    }
}
