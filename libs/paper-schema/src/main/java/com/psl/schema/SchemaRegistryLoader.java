package com.psl.schema;

import com.psl.schema.taxonomy.Taxonomy;
import com.psl.schema.taxonomy.TaxonomyTerm;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Reads the field catalogue and the taxonomy from YAML. Locations prefixed with {@code classpath:} are read from
 * the class path, anything else from the file system.
 */
public class SchemaRegistryLoader {
    private static final Logger log = LoggerFactory.getLogger(SchemaRegistryLoader.class);
    private static final String CLASSPATH_PREFIX = "classpath:";

    public SchemaRegistry load(String fieldsLocation, String taxonomyLocation) {
        Map<String, Object> fieldsRoot = readYaml(fieldsLocation);
        Map<String, Object> taxonomyRoot = readYaml(taxonomyLocation);

        int version = asInt(fieldsRoot.get("version"), 0);
        Map<String, Object> analysis = asMap(fieldsRoot.get("analysis"));
        List<FieldDefinition> fields = new ArrayList<>();
        parseFields(fieldsRoot.get("fields"), null, fields);

        SchemaRegistry registry = new SchemaRegistry(version, analysis, fields, parseTaxonomy(taxonomyRoot));
        SchemaRegistryValidator.validate(registry);
        log.info(
            "schema registry loaded version={} fields={} categories={}",
            version,
            fields.size(),
            registry.taxonomy().categories().size()
        );
        return registry;
    }

    public Taxonomy loadTaxonomy(String taxonomyLocation) {
        Taxonomy taxonomy = parseTaxonomy(readYaml(taxonomyLocation));
        SchemaRegistryValidator.validateTaxonomy(taxonomy);
        return taxonomy;
    }

    private void parseFields(Object raw, String parentPath, List<FieldDefinition> out) {
        if (!(raw instanceof List<?> list)) {
            return;
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            Map<String, Object> entry = asMap(map);
            String name = asString(entry.get("name"), null);
            if (name == null) {
                throw new IllegalStateException("field without name under " + (parentPath == null ? "root" : parentPath));
            }
            String path = parentPath == null ? name : parentPath + "." + name;
            out.add(toDefinition(entry, path, parentPath, false));
            parseFields(entry.get("properties"), path, out);
            parseSubfields(entry.get("subfields"), path, out);
        }
    }

    private void parseSubfields(Object raw, String parentPath, List<FieldDefinition> out) {
        if (!(raw instanceof List<?> list)) {
            return;
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            Map<String, Object> entry = asMap(map);
            String name = asString(entry.get("name"), null);
            if (name == null) {
                throw new IllegalStateException("subfield without name under " + parentPath);
            }
            out.add(toDefinition(entry, parentPath + "." + name, parentPath, true));
        }
    }

    private FieldDefinition toDefinition(Map<String, Object> entry, String path, String parentPath, boolean subfield) {
        String rawType = asString(entry.get("type"), null);
        FieldType type = FieldType.from(rawType);
        if (type == null) {
            throw new IllegalStateException("unknown field type " + rawType + " for " + path);
        }
        String rawRole = asString(entry.get("role"), null);
        FieldRole role = FieldRole.from(rawRole);
        if (rawRole != null && role == null) {
            throw new IllegalStateException("unknown field role " + rawRole + " for " + path);
        }
        return new FieldDefinition(
            path,
            type,
            role,
            asString(entry.get("analyzer"), null),
            asString(entry.get("normalizer"), null),
            asString(entry.get("format"), null),
            asStringList(entry.get("copy_to")),
            parentPath,
            subfield
        );
    }

    private Taxonomy parseTaxonomy(Map<String, Object> root) {
        List<TaxonomyTerm> groups = parseTerms(root.get("groups"), null);
        List<TaxonomyTerm> archives = parseTerms(root.get("archives"), "in_group");
        List<TaxonomyTerm> categories = parseTerms(root.get("categories"), "in_archive");
        Map<String, String> subsumed = new LinkedHashMap<>();
        for (Map.Entry<String, Object> entry : asMap(root.get("subsumed")).entrySet()) {
            String target = asString(entry.getValue(), null);
            if (target != null) {
                subsumed.put(entry.getKey(), target);
            }
        }
        return new Taxonomy(groups, archives, categories, subsumed);
    }

    private List<TaxonomyTerm> parseTerms(Object raw, String parentKey) {
        List<TaxonomyTerm> terms = new ArrayList<>();
        if (!(raw instanceof List<?> list)) {
            return terms;
        }
        for (Object item : list) {
            if (!(item instanceof Map<?, ?> map)) {
                continue;
            }
            Map<String, Object> entry = asMap(map);
            String id = asString(entry.get("id"), null);
            if (id == null) {
                continue;
            }
            String name = asString(entry.get("name"), id);
            String parent = parentKey == null ? null : asString(entry.get(parentKey), null);
            terms.add(new TaxonomyTerm(id, name, parent));
        }
        return terms;
    }

    private Map<String, Object> readYaml(String location) {
        if (location == null || location.isBlank()) {
            throw new IllegalStateException("schema location missing");
        }
        try (InputStream input = open(location)) {
            Object parsed = new Yaml().load(input);
            if (!(parsed instanceof Map<?, ?> map)) {
                throw new IllegalStateException("schema document malformed (root not map): " + location);
            }
            return asMap(map);
        } catch (IOException ex) {
            throw new IllegalStateException("schema document unreadable: " + location, ex);
        }
    }

    private InputStream open(String location) throws IOException {
        if (location.startsWith(CLASSPATH_PREFIX)) {
            String resource = location.substring(CLASSPATH_PREFIX.length());
            if (resource.startsWith("/")) {
                resource = resource.substring(1);
            }
            InputStream input = Thread.currentThread().getContextClassLoader().getResourceAsStream(resource);
            if (input == null) {
                input = SchemaRegistryLoader.class.getClassLoader().getResourceAsStream(resource);
            }
            if (input == null) {
                throw new IllegalStateException("schema resource not found: " + location);
            }
            return input;
        }
        Path path = Path.of(location);
        if (!Files.exists(path)) {
            throw new IllegalStateException("schema file not found: " + location);
        }
        return Files.newInputStream(path);
    }

    private Map<String, Object> asMap(Object raw) {
        if (raw instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            for (Map.Entry<?, ?> entry : map.entrySet()) {
                copy.put(String.valueOf(entry.getKey()), entry.getValue());
            }
            return copy;
        }
        return new LinkedHashMap<>();
    }

    private List<String> asStringList(Object raw) {
        List<String> values = new ArrayList<>();
        if (raw instanceof List<?> list) {
            for (Object item : list) {
                String value = asString(item, null);
                if (value != null) {
                    values.add(value);
                }
            }
        } else {
            String single = asString(raw, null);
            if (single != null) {
                values.add(single);
            }
        }
        return values;
    }

    private String asString(Object raw, String fallback) {
        if (raw == null) {
            return fallback;
        }
        String value = raw.toString().trim();
        return value.isEmpty() ? fallback : value;
    }

    private int asInt(Object raw, int fallback) {
        if (raw instanceof Number number) {
            return number.intValue();
        }
        if (raw instanceof String text) {
            try {
                return Integer.parseInt(text.trim());
            } catch (NumberFormatException ignored) {
                return fallback;
            }
        }
        return fallback;
    }
}
