package com.deepansh.trader.market;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Lenient readers for third-party JSON, where numbers arrive as strings
 * ("priceUsd": "0.0012") and any field may be missing or null.
 */
final class JsonValues {

    private JsonValues() {}

    static Double doubleOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        if (node.isNumber()) return node.asDouble();
        if (node.isTextual()) {
            try {
                return Double.parseDouble(node.asText());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    static Integer intOrNull(JsonNode node) {
        Double d = doubleOrNull(node);
        return d != null ? d.intValue() : null;
    }

    static Long longOrNull(JsonNode node) {
        Double d = doubleOrNull(node);
        return d != null ? d.longValue() : null;
    }

    static String textOrNull(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull()) return null;
        String text = node.asText();
        return text.isBlank() ? null : text;
    }
}
