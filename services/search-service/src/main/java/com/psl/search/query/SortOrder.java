package com.psl.search.query;

/**
 * Result orderings accepted by {@code order}. A leading {@code -} means descending.
 */
public enum SortOrder {
    RELEVANCE("relevance", "_score", "desc"),
    SUBMITTED_DATE_FIRST("submitted_date_first", "submitted_date_first", "asc"),
    SUBMITTED_DATE_FIRST_DESC("-submitted_date_first", "submitted_date_first", "desc"),
    ANNOUNCED_DATE_FIRST("announced_date_first", "announced_date_first", "asc"),
    ANNOUNCED_DATE_FIRST_DESC("-announced_date_first", "announced_date_first", "desc");

    private final String key;
    private final String field;
    private final String direction;

    SortOrder(String key, String field, String direction) {
        this.key = key;
        this.field = field;
        this.direction = direction;
    }

    /**
     * Parses the request value; null or blank means "no explicit order".
     */
    public static SortOrder from(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        String trimmed = value.trim();
        for (SortOrder order : values()) {
            if (order.key.equals(trimmed)) {
                return order;
            }
        }
        throw new QueryException("unknown order: " + value);
    }

    public String getKey() {
        return key;
    }

    public String getField() {
        return field;
    }

    public String getDirection() {
        return direction;
    }
}
