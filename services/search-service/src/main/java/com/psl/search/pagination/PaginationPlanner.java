package com.psl.search.pagination;

import com.fasterxml.jackson.databind.JsonNode;
import com.psl.search.query.CursorRequiredException;
import com.psl.search.query.QueryException;
import com.psl.search.query.SortOrder;
import org.springframework.stereotype.Component;
import org.springframework.web.util.UriComponentsBuilder;

/**
 * Offset paging up to {@code max-depth}, cursor paging beyond it. Offset windows that would reach past the
 * depth limit are refused rather than served slowly.
 */
@Component
public class PaginationPlanner {
    private final PaginationProperties properties;
    private final CursorCodec cursorCodec;

    public PaginationPlanner(PaginationProperties properties, CursorCodec cursorCodec) {
        this.properties = properties;
        this.cursorCodec = cursorCodec;
    }

    public PagePlan plan(Integer start, Integer size, String cursor, SortOrder order) {
        int pageSize = size == null ? properties.getDefaultSize() : size;
        if (pageSize < 1 || pageSize > properties.getMaxSize()) {
            throw new QueryException("size must be between 1 and " + properties.getMaxSize());
        }
        if (cursor != null && !cursor.isBlank()) {
            if (start != null) {
                throw new QueryException("start and cursor cannot be combined");
            }
            return PagePlan.cursor(pageSize, cursorCodec.decode(cursor, order));
        }
        int offset = start == null ? 0 : start;
        if (offset < 0) {
            throw new QueryException("start must not be negative");
        }
        if ((long) offset + pageSize > properties.getMaxDepth()) {
            throw new CursorRequiredException(properties.getMaxDepth());
        }
        return PagePlan.offset(offset, pageSize);
    }

    /**
     * Links relative to the current request. {@code lastSort} holds the sort values of the last hit returned.
     */
    public PageLinks links(
        PagePlan plan,
        long total,
        int returned,
        JsonNode lastSort,
        SortOrder order,
        UriComponentsBuilder request
    ) {
        String previous = null;
        if (!plan.isCursor() && plan.start() > 0) {
            previous = offsetLink(request, Math.max(0, plan.start() - plan.size()), plan.size());
        }

        String next = null;
        boolean exhausted = plan.isCursor()
            ? returned < plan.size()
            : (long) plan.start() + returned >= total;
        if (!exhausted && returned > 0) {
            int nextStart = plan.start() + plan.size();
            if (!plan.isCursor() && (long) nextStart + plan.size() <= properties.getMaxDepth()) {
                next = offsetLink(request, nextStart, plan.size());
            } else if (lastSort != null && lastSort.isArray() && !lastSort.isEmpty()) {
                next = request.cloneBuilder()
                    .replaceQueryParam("start")
                    .replaceQueryParam("size", plan.size())
                    .replaceQueryParam("cursor", cursorCodec.encode(order, lastSort))
                    .build()
                    .toUriString();
            }
        }
        return new PageLinks(next, previous);
    }

    private String offsetLink(UriComponentsBuilder request, int start, int size) {
        return request.cloneBuilder()
            .replaceQueryParam("cursor")
            .replaceQueryParam("start", start)
            .replaceQueryParam("size", size)
            .build()
            .toUriString();
    }
}
