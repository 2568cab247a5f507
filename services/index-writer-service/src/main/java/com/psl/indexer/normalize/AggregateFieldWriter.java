package com.psl.indexer.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.schema.FieldDefinition;
import com.psl.schema.FieldRole;
import com.psl.schema.SchemaRegistry;
import com.psl.schema.document.PaperDocument;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes every aggregate field from the sources the registry declares for it, in declaration order. The only
 * code path that writes {@code combined} and {@code authors_combined}.
 */
public class AggregateFieldWriter {
    static final String COMBINED = "combined";
    static final String AUTHORS_COMBINED = "authors_combined";

    private final SchemaRegistry registry;
    private final ObjectMapper objectMapper;

    public AggregateFieldWriter(SchemaRegistry registry, ObjectMapper objectMapper) {
        this.registry = registry;
        this.objectMapper = objectMapper;
    }

    public void apply(PaperDocument document) {
        document.assignAggregates(null, null);
        JsonNode source = objectMapper.valueToTree(document);
        Map<String, String> values = compute(source);
        document.assignAggregates(values.get(COMBINED), values.get(AUTHORS_COMBINED));
    }

    Map<String, String> compute(JsonNode source) {
        Map<String, String> values = new LinkedHashMap<>();
        for (FieldDefinition target : registry.fieldsWithRole(FieldRole.COMBINED)) {
            if (target.isSubfield()) {
                continue;
            }
            List<String> parts = new ArrayList<>();
            for (FieldDefinition field : registry.copySources(target.getPath())) {
                collect(source, field.getPath().split("\\."), 0, parts);
            }
            values.put(target.getPath(), parts.isEmpty() ? null : String.join(" ", parts));
        }
        return values;
    }

    private void collect(JsonNode node, String[] segments, int index, List<String> out) {
        if (node == null || node.isMissingNode() || node.isNull()) {
            return;
        }
        if (node.isArray()) {
            for (JsonNode item : node) {
                collect(item, segments, index, out);
            }
            return;
        }
        if (index == segments.length) {
            String value = JsonValues.text(node);
            if (value != null) {
                out.add(value);
            }
            return;
        }
        collect(node.get(segments[index]), segments, index + 1, out);
    }
}
