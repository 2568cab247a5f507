package com.psl.schema;

import com.psl.schema.taxonomy.Taxonomy;
import com.psl.schema.taxonomy.TaxonomyTerm;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;

public final class SchemaRegistryValidator {
    private static final Set<String> BUILT_IN_ANALYZERS = Set.of("standard", "simple", "whitespace", "keyword", "english");

    private SchemaRegistryValidator() {}

    public static void validate(SchemaRegistry registry) {
        if (registry == null) {
            throw new IllegalStateException("schema registry missing");
        }
        if (registry.getVersion() <= 0) {
            throw new IllegalStateException("schema version must be positive");
        }
        if (registry.fields().isEmpty()) {
            throw new IllegalStateException("schema has no fields");
        }

        Set<String> analyzers = namesUnder(registry.getAnalysis(), "analyzer");
        Set<String> normalizers = namesUnder(registry.getAnalysis(), "normalizer");
        Set<String> paths = new HashSet<>();
        for (FieldDefinition field : registry.fields()) {
            if (!paths.add(field.getPath())) {
                throw new IllegalStateException("duplicate field: " + field.getPath());
            }
            if (field.getType() == null) {
                throw new IllegalStateException("field type required: " + field.getPath());
            }
            if (field.getType().isTextual() && field.getRole() == null) {
                throw new IllegalStateException("field role required: " + field.getPath());
            }
            if (field.getAnalyzer() != null
                && !analyzers.contains(field.getAnalyzer())
                && !BUILT_IN_ANALYZERS.contains(field.getAnalyzer())) {
                throw new IllegalStateException("unknown analyzer " + field.getAnalyzer() + " on " + field.getPath());
            }
            if (field.getNormalizer() != null && !normalizers.contains(field.getNormalizer())) {
                throw new IllegalStateException("unknown normalizer " + field.getNormalizer() + " on " + field.getPath());
            }
            if (!field.getCopyTo().isEmpty()) {
                if (field.getRole() == FieldRole.COMBINED) {
                    throw new IllegalStateException("combined field cannot feed another aggregate: " + field.getPath());
                }
                if (field.isSubfield()) {
                    throw new IllegalStateException("copy_to declared on a subfield: " + field.getPath());
                }
            }
            for (String target : field.getCopyTo()) {
                FieldDefinition targetField = registry.field(target)
                    .orElseThrow(() -> new IllegalStateException(
                        "copy_to target " + target + " of " + field.getPath() + " is not declared"
                    ));
                if (targetField.getRole() != FieldRole.COMBINED) {
                    throw new IllegalStateException("copy_to target is not a combined field: " + target);
                }
                if (registry.nestedPathOf(target) != null) {
                    throw new IllegalStateException("copy_to target must be a root field: " + target);
                }
            }
        }
        validateTaxonomy(registry.taxonomy());
    }

    public static void validateTaxonomy(Taxonomy taxonomy) {
        if (taxonomy == null) {
            throw new IllegalStateException("taxonomy missing");
        }
        if (taxonomy.categories().isEmpty()) {
            throw new IllegalStateException("taxonomy has no categories");
        }
        for (TaxonomyTerm archive : taxonomy.archives()) {
            if (taxonomy.group(archive.parentId()).isEmpty()) {
                throw new IllegalStateException("archive " + archive.id() + " references unknown group " + archive.parentId());
            }
        }
        for (TaxonomyTerm category : taxonomy.categories()) {
            if (taxonomy.archive(category.parentId()).isEmpty()) {
                throw new IllegalStateException(
                    "category " + category.id() + " references unknown archive " + category.parentId()
                );
            }
        }
        for (Map.Entry<String, String> entry : taxonomy.subsumed().entrySet()) {
            if (taxonomy.category(entry.getValue()).isEmpty()) {
                throw new IllegalStateException("subsumed id " + entry.getKey() + " maps to unknown category " + entry.getValue());
            }
        }
    }

    private static Set<String> namesUnder(Map<String, Object> analysis, String key) {
        Object section = analysis.get(key);
        Set<String> names = new HashSet<>();
        if (section instanceof Map<?, ?> map) {
            for (Object name : map.keySet()) {
                names.add(String.valueOf(name));
            }
        }
        return names;
    }
}
