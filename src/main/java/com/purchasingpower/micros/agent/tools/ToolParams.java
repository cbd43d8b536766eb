package com.purchasingpower.micros.agent.tools;

import java.util.Map;

/**
 * Lenient readers for model-supplied tool arguments (numbers may arrive as strings).
 */
final class ToolParams {

    private ToolParams() {
    }

    static String string(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value == null) {
            return null;
        }
        String text = value.toString().trim();
        return text.isEmpty() ? null : text;
    }

    static int intOr(Map<String, Object> params, String key, int fallback) {
        Object value = params.get(key);
        if (value instanceof Number) {
            return ((Number) value).intValue();
        }
        String text = string(params, key);
        if (text == null) {
            return fallback;
        }
        try {
            return Integer.parseInt(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + text);
        }
    }

    static Long longValue(Map<String, Object> params, String key) {
        Object value = params.get(key);
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        String text = string(params, key);
        if (text == null) {
            return null;
        }
        try {
            return Long.parseLong(text);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("'" + key + "' must be an integer, got: " + text);
        }
    }
}
