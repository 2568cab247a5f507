package com.psl.schema;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.psl.schema.taxonomy.ResolvedClassification;
import java.util.List;
import org.junit.jupiter.api.Test;

class SchemaRegistryLoaderTest {

    private final SchemaRegistryLoader loader = new SchemaRegistryLoader();

    @Test
    void loadsFieldsSubfieldsAndNestedPaths() {
        SchemaRegistry registry = loader.load("classpath:schema/test-fields.yml", "classpath:schema/test-taxonomy.yml");

        assertThat(registry.getVersion()).isEqualTo(7);
        assertThat(registry.field("title.exact")).isPresent();
        assertThat(registry.requireField("title.exact").isSubfield()).isTrue();
        assertThat(registry.requireField("authors.full_name").getParentPath()).isEqualTo("authors");
        assertThat(registry.nestedPaths()).containsExactly("authors");
        assertThat(registry.nestedPathOf("authors.full_name")).isEqualTo("authors");
        assertThat(registry.nestedPathOf("title")).isNull();
    }

    @Test
    void copySourcesFollowDeclarationOrder() {
        SchemaRegistry registry = loader.load("classpath:schema/test-fields.yml", "classpath:schema/test-taxonomy.yml");

        assertThat(registry.copySources("combined"))
            .extracting(FieldDefinition::getPath)
            .containsExactly("title", "authors.full_name");
        assertThat(registry.copySources("authors_combined"))
            .extracting(FieldDefinition::getPath)
            .containsExactly("authors.full_name");
        assertThat(registry.copyToTargets("authors.full_name")).containsExactly("authors_combined", "combined");
        assertThat(registry.fieldsWithRole(FieldRole.COMBINED))
            .extracting(FieldDefinition::getPath)
            .containsExactly("combined", "authors_combined");
    }

    @Test
    void bundledSchemaLoadsAndResolvesTaxonomy() {
        SchemaRegistry registry = loader.load("classpath:schema/paper-fields.yml", "classpath:schema/taxonomy.yml");

        assertThat(registry.nestedPaths()).contains("authors", "owners", "secondary_classification");
        assertThat(registry.copySources("combined"))
            .extracting(FieldDefinition::getPath)
            .contains("title", "abstract", "authors.full_name");

        ResolvedClassification resolved = registry.taxonomy().resolve("cs.LG").orElseThrow();
        assertThat(resolved.archive().id()).isEqualTo("cs");
        assertThat(resolved.group().id()).isEqualTo("grp_cs");
        assertThat(registry.taxonomy().canonicalCategoryId("cmp-lg")).isEqualTo("cs.CL");
    }

    @Test
    void rejectsTaxonomyWithDanglingArchive() {
        assertThatThrownBy(() -> loader.loadTaxonomy("classpath:schema/broken-taxonomy.yml"))
            .isInstanceOf(IllegalStateException.class)
            .hasMessageContaining("q-bio");
    }

    @Test
    void rejectsMissingDocument() {
        assertThatThrownBy(() -> loader.load("classpath:schema/missing.yml", "classpath:schema/test-taxonomy.yml"))
            .isInstanceOf(IllegalStateException.class);
    }

    @Test
    void copyToListIsImmutable() {
        SchemaRegistry registry = loader.load("classpath:schema/test-fields.yml", "classpath:schema/test-taxonomy.yml");
        List<String> targets = registry.copyToTargets("title");

        assertThatThrownBy(() -> targets.add("other")).isInstanceOf(UnsupportedOperationException.class);
    }
}
