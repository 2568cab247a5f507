package com.psl.search.query;

import java.util.List;

/**
 * Parsed {@code GET /papers} request, minus paging.
 *
 * @param order explicit ordering, or null to use the default for the request
 */
public record PaperQuery(
    String text,
    SearchType searchType,
    List<String> primaryCategories,
    SortOrder order,
    boolean includeOlderVersions
) {
    public PaperQuery {
        searchType = searchType == null ? SearchType.ALL : searchType;
        primaryCategories = primaryCategories == null ? List.of() : List.copyOf(primaryCategories);
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
