package com.psl.schema;

import com.psl.schema.taxonomy.Taxonomy;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Canonical description of an indexed paper document: field paths, their engine types, the text role each one
 * plays at query time and the aggregate fields each one feeds. Also carries the closed subject taxonomy.
 *
 * <p>Changing an analyzer or a {@code copy_to} target is a breaking change; bump {@link #getVersion()} so that
 * indexing runs can detect that the live index has to be rebuilt.</p>
 */
public class SchemaRegistry {
    private final int version;
    private final Map<String, Object> analysis;
    private final Map<String, FieldDefinition> fields;
    private final Taxonomy taxonomy;

    public SchemaRegistry(int version, Map<String, Object> analysis, List<FieldDefinition> fields, Taxonomy taxonomy) {
        this.version = version;
        this.analysis = analysis == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(analysis));
        Map<String, FieldDefinition> map = new LinkedHashMap<>();
        if (fields != null) {
            for (FieldDefinition field : fields) {
                map.put(field.getPath(), field);
            }
        }
        this.fields = Collections.unmodifiableMap(map);
        this.taxonomy = taxonomy;
    }

    public int getVersion() {
        return version;
    }

    public Map<String, Object> getAnalysis() {
        return analysis;
    }

    public Taxonomy taxonomy() {
        return taxonomy;
    }

    public List<FieldDefinition> fields() {
        return List.copyOf(fields.values());
    }

    public Optional<FieldDefinition> field(String path) {
        return Optional.ofNullable(path == null ? null : fields.get(path));
    }

    public FieldDefinition requireField(String path) {
        FieldDefinition field = fields.get(path);
        if (field == null) {
            throw new IllegalArgumentException("unknown field: " + path);
        }
        return field;
    }

    public List<FieldDefinition> fieldsWithRole(FieldRole role) {
        List<FieldDefinition> matches = new ArrayList<>();
        for (FieldDefinition field : fields.values()) {
            if (field.getRole() == role) {
                matches.add(field);
            }
        }
        return matches;
    }

    public List<String> copyToTargets(String path) {
        FieldDefinition field = fields.get(path);
        return field == null ? List.of() : field.getCopyTo();
    }

    /**
     * Fields feeding {@code target}, in declaration order. This order is the concatenation order of the aggregate.
     */
    public List<FieldDefinition> copySources(String target) {
        List<FieldDefinition> sources = new ArrayList<>();
        for (FieldDefinition field : fields.values()) {
            if (field.getCopyTo().contains(target)) {
                sources.add(field);
            }
        }
        return sources;
    }

    public List<String> nestedPaths() {
        List<String> paths = new ArrayList<>();
        for (FieldDefinition field : fields.values()) {
            if (field.getType() == FieldType.NESTED) {
                paths.add(field.getPath());
            }
        }
        return paths;
    }

    /**
     * Innermost nested path enclosing {@code path}, or null when the field lives on the root document.
     */
    public String nestedPathOf(String path) {
        String current = path;
        while (current != null) {
            FieldDefinition field = fields.get(current);
            if (field == null) {
                return null;
            }
            if (field.getType() == FieldType.NESTED && !current.equals(path)) {
                return current;
            }
            current = field.getParentPath();
        }
        return null;
    }

    /**
     * Direct children of {@code parentPath}: object properties and multi-field variants. Null selects root fields.
     */
    public List<FieldDefinition> children(String parentPath) {
        List<FieldDefinition> children = new ArrayList<>();
        for (FieldDefinition field : fields.values()) {
            String parent = field.getParentPath();
            if (parentPath == null ? parent == null : parentPath.equals(parent)) {
                children.add(field);
            }
        }
        return children;
    }
}
