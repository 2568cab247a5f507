package com.psl.schema;

public enum FieldType {
    KEYWORD,
    TEXT,
    DATE,
    INTEGER,
    LONG,
    BOOLEAN,
    OBJECT,
    NESTED;

    public static FieldType from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "keyword" -> KEYWORD;
            case "text" -> TEXT;
            case "date" -> DATE;
            case "int", "integer" -> INTEGER;
            case "long" -> LONG;
            case "bool", "boolean" -> BOOLEAN;
            case "object" -> OBJECT;
            case "nested" -> NESTED;
            default -> null;
        };
    }

    public boolean isTextual() {
        return this == KEYWORD || this == TEXT;
    }

    public boolean isContainer() {
        return this == OBJECT || this == NESTED;
    }

    public String mappingName() {
        return name().toLowerCase();
    }
}
