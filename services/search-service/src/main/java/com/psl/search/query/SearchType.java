package com.psl.search.query;

public enum SearchType {
    ALL,
    TITLE,
    ABSTRACT,
    AUTHOR;

    public static SearchType from(String value) {
        if (value == null || value.isBlank()) {
            return ALL;
        }
        return switch (value.trim().toLowerCase()) {
            case "all" -> ALL;
            case "title" -> TITLE;
            case "abstract" -> ABSTRACT;
            case "author" -> AUTHOR;
            default -> throw new QueryException("unknown searchtype: " + value);
        };
    }
}
