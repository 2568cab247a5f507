package com.psl.schema.taxonomy;

/**
 * One node of the group, archive, category hierarchy. {@code parentId} is null for groups.
 */
public record TaxonomyTerm(String id, String name, String parentId) {
}
