package com.purchasingpower.micros.util;

import com.purchasingpower.micros.model.CallContext;
import com.purchasingpower.micros.model.ServiceType;
import org.slf4j.Logger;

/**
 * Structured request/response logging for model calls and tool executions.
 */
public final class ExternalCallLogger {

    private ExternalCallLogger() {
    }

    public static CallContext startCall(ServiceType service, String operation, String caller, Logger logger) {
        return new CallContext(service, operation, caller, logger);
    }

    /**
     * Truncate large strings for logging
     */
    public static String truncate(String text, int maxLength) {
        if (text == null) {
            return "(null)";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        return text.substring(0, maxLength) + "... [+" + (text.length() - maxLength) + " chars]";
    }
}
