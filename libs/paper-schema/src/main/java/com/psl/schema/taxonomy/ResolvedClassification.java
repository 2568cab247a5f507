package com.psl.schema.taxonomy;

public record ResolvedClassification(TaxonomyTerm group, TaxonomyTerm archive, TaxonomyTerm category) {
}
