package com.psl.schema;

import java.util.List;

public class FieldDefinition {
    private final String path;
    private final FieldType type;
    private final FieldRole role;
    private final String analyzer;
    private final String normalizer;
    private final String format;
    private final List<String> copyTo;
    private final String parentPath;
    private final boolean subfield;

    public FieldDefinition(
        String path,
        FieldType type,
        FieldRole role,
        String analyzer,
        String normalizer,
        String format,
        List<String> copyTo,
        String parentPath,
        boolean subfield
    ) {
        this.path = path;
        this.type = type;
        this.role = role;
        this.analyzer = analyzer;
        this.normalizer = normalizer;
        this.format = format;
        this.copyTo = copyTo == null ? List.of() : List.copyOf(copyTo);
        this.parentPath = parentPath;
        this.subfield = subfield;
    }

    public String getPath() {
        return path;
    }

    public FieldType getType() {
        return type;
    }

    public FieldRole getRole() {
        return role;
    }

    public String getAnalyzer() {
        return analyzer;
    }

    public String getNormalizer() {
        return normalizer;
    }

    public String getFormat() {
        return format;
    }

    public List<String> getCopyTo() {
        return copyTo;
    }

    /**
     * Path of the enclosing object, nested field or (for subfields) the field this one is a variant of.
     */
    public String getParentPath() {
        return parentPath;
    }

    /**
     * True for multi-field variants such as {@code title.exact}; they share the parent's source value.
     */
    public boolean isSubfield() {
        return subfield;
    }

    /**
     * Last path segment, the key used in the engine mapping and in the source document.
     */
    public String getName() {
        int idx = path.lastIndexOf('.');
        return idx < 0 ? path : path.substring(idx + 1);
    }
}
