package com.psl.indexer.normalize;

import com.fasterxml.jackson.databind.JsonNode;

final class JsonValues {
    private JsonValues() {}

    /**
     * Trimmed scalar text, or null for missing, null, blank and container nodes.
     */
    static String text(JsonNode node) {
        if (node == null || node.isMissingNode() || node.isNull() || node.isContainerNode()) {
            return null;
        }
        String value = node.asText().trim();
        return value.isEmpty() ? null : value;
    }
}
