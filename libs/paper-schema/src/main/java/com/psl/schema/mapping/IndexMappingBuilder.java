package com.psl.schema.mapping;

import com.psl.schema.FieldDefinition;
import com.psl.schema.FieldType;
import com.psl.schema.SchemaRegistry;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Renders the registry as an index creation body (settings and mappings) for the search engine.
 *
 * <p>{@code copy_to} is not rendered; aggregate fields arrive already computed in the
 * source document.</p>
 */
public class IndexMappingBuilder {
    public static final String SCHEMA_VERSION_META = "schema_version";
    private static final int KEYWORD_IGNORE_ABOVE = 2048;

    private final SchemaRegistry registry;

    public IndexMappingBuilder(SchemaRegistry registry) {
        this.registry = registry;
    }

    public Map<String, Object> buildCreateIndexBody() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("settings", Map.of("analysis", registry.getAnalysis()));
        body.put("mappings", buildMappings());
        return body;
    }

    public Map<String, Object> buildMappings() {
        Map<String, Object> mappings = new LinkedHashMap<>();
        mappings.put("dynamic", "strict");
        mappings.put("_meta", Map.of(SCHEMA_VERSION_META, registry.getVersion()));
        mappings.put("properties", properties(registry.children(null)));
        return mappings;
    }

    private Map<String, Object> properties(List<FieldDefinition> fields) {
        Map<String, Object> properties = new LinkedHashMap<>();
        for (FieldDefinition field : fields) {
            if (field.isSubfield()) {
                continue;
            }
            properties.put(field.getName(), fieldMapping(field));
        }
        return properties;
    }

    private Map<String, Object> fieldMapping(FieldDefinition field) {
        Map<String, Object> mapping = new LinkedHashMap<>();
        FieldType type = field.getType();
        if (type.isContainer()) {
            if (type == FieldType.NESTED) {
                mapping.put("type", "nested");
            }
            mapping.put("properties", properties(registry.children(field.getPath())));
            return mapping;
        }

        mapping.put("type", type.mappingName());
        if (field.getAnalyzer() != null) {
            mapping.put("analyzer", field.getAnalyzer());
        }
        if (field.getNormalizer() != null) {
            mapping.put("normalizer", field.getNormalizer());
        }
        if (field.getFormat() != null) {
            mapping.put("format", field.getFormat());
        }
        if (type == FieldType.KEYWORD) {
            mapping.put("ignore_above", KEYWORD_IGNORE_ABOVE);
        }

        Map<String, Object> subfields = new LinkedHashMap<>();
        for (FieldDefinition child : registry.children(field.getPath())) {
            if (child.isSubfield()) {
                subfields.put(child.getName(), fieldMapping(child));
            }
        }
        if (!subfields.isEmpty()) {
            mapping.put("fields", subfields);
        }
        return mapping;
    }
}
