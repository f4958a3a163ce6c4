package com.parley.channel;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Small accessors for provider JSON trees.
 */
public final class Payloads {

    private Payloads() {
    }

    /** Text of a value node, or null when missing, null, blank or not a scalar. */
    public static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || !node.isValueNode()) return null;
        String value = node.asText();
        return value.isBlank() ? null : value;
    }

    public static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) return value;
        }
        return null;
    }

    /** Parses Unix epoch seconds, returning the fallback when absent or unparseable. */
    public static Instant epochSeconds(String value, Instant fallback) {
        if (value == null) return fallback;
        try {
            return Instant.ofEpochSecond(Long.parseLong(value.trim()));
        } catch (NumberFormatException e) {
            return fallback;
        }
    }

    public static String require(String value, String field) {
        if (value == null || value.isBlank()) {
            throw new NormalizationException("missing required field: " + field);
        }
        return value;
    }
}
