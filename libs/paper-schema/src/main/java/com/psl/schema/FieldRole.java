package com.psl.schema;

/**
 * Text representation a searchable field carries in the index.
 */
public enum FieldRole {
    /** Untouched keyword; matches only the literal value. */
    EXACT,
    /** Case and diacritic insensitive variant. */
    FOLDED,
    /** Language-aware analyzed text. */
    STEMMED,
    /** Aggregate of other fields, derived only by the normalizer. */
    COMBINED;

    public static FieldRole from(String raw) {
        if (raw == null) {
            return null;
        }
        return switch (raw.trim().toLowerCase()) {
            case "exact" -> EXACT;
            case "folded" -> FOLDED;
            case "stemmed" -> STEMMED;
            case "combined" -> COMBINED;
            default -> null;
        };
    }
}
