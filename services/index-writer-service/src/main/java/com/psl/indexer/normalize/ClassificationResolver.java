package com.psl.indexer.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.psl.schema.document.Classification;
import com.psl.schema.document.ClassificationTerm;
import com.psl.schema.taxonomy.ResolvedClassification;
import com.psl.schema.taxonomy.Taxonomy;
import com.psl.schema.taxonomy.TaxonomyTerm;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Resolves raw classification entries against the closed taxonomy. An entry is a bare category id or an object
 * whose {@code category}, {@code archive} and {@code group} carry ids; names always come from the taxonomy.
 */
public class ClassificationResolver {
    private final Taxonomy taxonomy;

    public ClassificationResolver(Taxonomy taxonomy) {
        this.taxonomy = taxonomy;
    }

    public Classification resolve(String field, JsonNode entry) {
        String rawCategory = idOf(entry.isObject() ? entry.path("category") : entry);
        if (rawCategory == null) {
            throw TransformException.missing(field + ".category.id");
        }
        ResolvedClassification resolved = taxonomy.resolve(rawCategory)
            .orElseThrow(() -> new TransformException(
                field,
                "unknown_category",
                "category not in taxonomy: " + rawCategory
            ));

        boolean subsumed = !resolved.category().id().equals(rawCategory.trim());
        if (entry.isObject() && !subsumed) {
            String rawArchive = idOf(entry.path("archive"));
            if (rawArchive != null && !rawArchive.equals(resolved.archive().id())) {
                throw new TransformException(
                    field,
                    "archive_mismatch",
                    "archive " + rawArchive + " does not contain category " + resolved.category().id()
                );
            }
            String rawGroup = idOf(entry.path("group"));
            if (rawGroup != null && !rawGroup.equals(resolved.group().id())) {
                throw new TransformException(
                    field,
                    "group_mismatch",
                    "group " + rawGroup + " does not contain archive " + resolved.archive().id()
                );
            }
        }
        return new Classification(term(resolved.group()), term(resolved.archive()), term(resolved.category()));
    }

    /**
     * Secondary classifications in source order, without duplicates and without the primary category.
     */
    public List<Classification> resolveSecondaries(JsonNode raw, Classification primary) {
        Set<Classification> secondaries = new LinkedHashSet<>();
        if (raw == null || !raw.isArray()) {
            return new ArrayList<>();
        }
        for (JsonNode entry : raw) {
            Classification resolved = resolve("secondary_classification", entry);
            if (primary != null && resolved.getCategory().equals(primary.getCategory())) {
                continue;
            }
            secondaries.add(resolved);
        }
        return new ArrayList<>(secondaries);
    }

    private static ClassificationTerm term(TaxonomyTerm term) {
        return new ClassificationTerm(term.id(), term.name());
    }

    private static String idOf(JsonNode node) {
        if (node == null) {
            return null;
        }
        if (node.isObject()) {
            return JsonValues.text(node.path("id"));
        }
        return JsonValues.text(node);
    }
}
