package com.psl.search.pagination;

import java.util.List;

/**
 * One page window: an offset window, or a cursor continuing after {@code searchAfter}.
 */
public record PagePlan(int start, int size, List<Object> searchAfter) {
    public static PagePlan offset(int start, int size) {
        return new PagePlan(start, size, null);
    }

    public static PagePlan cursor(int size, List<Object> searchAfter) {
        return new PagePlan(0, size, List.copyOf(searchAfter));
    }

    public boolean isCursor() {
        return searchAfter != null;
    }
}
