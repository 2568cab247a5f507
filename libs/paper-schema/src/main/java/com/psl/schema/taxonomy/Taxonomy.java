package com.psl.schema.taxonomy;

import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Read-only closed taxonomy: every category belongs to one archive, every archive to one group.
 * Legacy ids that were folded into a newer category are reachable through {@link #canonicalCategoryId(String)}.
 */
public class Taxonomy {
    private final Map<String, TaxonomyTerm> groups;
    private final Map<String, TaxonomyTerm> archives;
    private final Map<String, TaxonomyTerm> categories;
    private final Map<String, String> subsumed;

    public Taxonomy(
        List<TaxonomyTerm> groups,
        List<TaxonomyTerm> archives,
        List<TaxonomyTerm> categories,
        Map<String, String> subsumed
    ) {
        this.groups = index(groups);
        this.archives = index(archives);
        this.categories = index(categories);
        this.subsumed = subsumed == null ? Map.of() : Map.copyOf(subsumed);
    }

    private static Map<String, TaxonomyTerm> index(List<TaxonomyTerm> terms) {
        Map<String, TaxonomyTerm> map = new LinkedHashMap<>();
        if (terms != null) {
            for (TaxonomyTerm term : terms) {
                if (term != null && term.id() != null) {
                    map.put(term.id(), term);
                }
            }
        }
        return Collections.unmodifiableMap(map);
    }

    public Optional<TaxonomyTerm> group(String id) {
        return Optional.ofNullable(id == null ? null : groups.get(id));
    }

    public Optional<TaxonomyTerm> archive(String id) {
        return Optional.ofNullable(id == null ? null : archives.get(id));
    }

    public Optional<TaxonomyTerm> category(String id) {
        return Optional.ofNullable(id == null ? null : categories.get(id));
    }

    public Collection<TaxonomyTerm> groups() {
        return groups.values();
    }

    public Collection<TaxonomyTerm> archives() {
        return archives.values();
    }

    public Collection<TaxonomyTerm> categories() {
        return categories.values();
    }

    public Map<String, String> subsumed() {
        return subsumed;
    }

    /**
     * Maps a legacy id onto the category that replaced it; other ids are returned trimmed.
     */
    public String canonicalCategoryId(String id) {
        if (id == null) {
            return null;
        }
        String trimmed = id.trim();
        return subsumed.getOrDefault(trimmed, trimmed);
    }

    public boolean isKnownCategory(String id) {
        return categories.containsKey(canonicalCategoryId(id));
    }

    public Optional<ResolvedClassification> resolve(String categoryId) {
        TaxonomyTerm category = categories.get(canonicalCategoryId(categoryId));
        if (category == null) {
            return Optional.empty();
        }
        TaxonomyTerm archive = archives.get(category.parentId());
        if (archive == null) {
            return Optional.empty();
        }
        TaxonomyTerm group = groups.get(archive.parentId());
        if (group == null) {
            return Optional.empty();
        }
        return Optional.of(new ResolvedClassification(group, archive, category));
    }
}
