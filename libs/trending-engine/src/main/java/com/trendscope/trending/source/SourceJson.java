package com.trendscope.trending.source;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Null-tolerant field readers shared by the adapters.
 */
final class SourceJson {

    private SourceJson() {
    }

    /** Non-blank textual field, or null. */
    static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        if (value == null || value.isNull() || !value.isValueNode()) {
            return null;
        }
        String text = value.asText();
        return text.isBlank() ? null : text;
    }

    static String firstText(JsonNode node, String... fields) {
        for (String field : fields) {
            String value = text(node, field);
            if (value != null) {
                return value;
            }
        }
        return null;
    }

    /** Numeric field as a Long, or null when absent. */
    static Long number(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asLong() : null;
    }

    /** Score field; missing or non-numeric counts as zero. */
    static double score(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value != null && value.isNumber() ? value.asDouble() : 0.0;
    }
}
