package com.psl.indexer.metadata;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * One raw, version-scoped metadata record as served by the metadata source. Only the normalizer reads it.
 */
public class MetadataRecord {
    private final JsonNode node;

    public MetadataRecord(JsonNode node) {
        this.node = node;
    }

    public JsonNode node() {
        return node;
    }

    public JsonNode get(String field) {
        return node.path(field);
    }

    public String text(String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        String text = value.asText().trim();
        return text.isEmpty() ? null : text;
    }

    public String paperId() {
        return text("paper_id");
    }

    /**
     * Declared version, or null when absent or not a positive integer.
     */
    public Integer version() {
        JsonNode value = node.path("version");
        if (value.isInt() || value.isLong()) {
            int version = value.asInt();
            return version > 0 ? version : null;
        }
        if (value.isTextual()) {
            try {
                int version = Integer.parseInt(value.asText().trim());
                return version > 0 ? version : null;
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }

    public boolean flag(String field) {
        JsonNode value = node.path(field);
        if (value.isBoolean()) {
            return value.asBoolean();
        }
        return value.isTextual() && "true".equalsIgnoreCase(value.asText().trim());
    }

    public Boolean optionalFlag(String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        return flag(field);
    }
}
