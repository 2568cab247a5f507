package com.psl.indexer.normalize;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.psl.indexer.metadata.MetadataRecord;
import com.psl.indexer.metadata.PaperVersions;
import com.psl.schema.SchemaRegistry;
import com.psl.schema.SchemaRegistryLoader;
import com.psl.schema.document.Author;
import com.psl.schema.document.PaperDocument;
import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import org.junit.jupiter.api.Test;

class DocumentNormalizerTest {

    private static final SchemaRegistry REGISTRY = new SchemaRegistryLoader()
        .load("classpath:schema/paper-fields.yml", "classpath:schema/taxonomy.yml");

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final DocumentNormalizer normalizer = new DocumentNormalizer(REGISTRY, objectMapper);

    @Test
    void normalizesCurrentVersionWithSiblingAggregates() throws Exception {
        PaperVersions versions = versions(fixture("1234.5678v2"), fixture("1234.5678v1"));

        List<NormalizedDocument> documents = normalizer.normalizeAll(versions, 2);

        assertThat(documents).hasSize(1);
        PaperDocument document = documents.get(0).document();
        assertThat(documents.get(0).isFlagged()).isFalse();
        assertThat(document.getPaperIdV()).isEqualTo("1234.5678v2");
        assertThat(document.getVersion()).isEqualTo(2);
        assertThat(document.getIsCurrent()).isTrue();
        assertThat(document.getLatest()).isEqualTo("1234.5678v2");
        assertThat(document.getLatestVersion()).isEqualTo(2);
        assertThat(document.getSubmittedDateFirst()).isEqualTo("2020-01-15T09:30:00-05:00");
        assertThat(document.getSubmittedDateLatest()).isEqualTo("2020-03-02T10:00:00-05:00");
        assertThat(document.getSubmittedDateAll())
            .containsExactly("2020-01-15T09:30:00-05:00", "2020-03-02T10:00:00-05:00");
        assertThat(document.getModifiedDate()).isEqualTo("2020-03-03T00:00:00Z");
        assertThat(document.getAnnouncedDateFirst()).isEqualTo("2020-01");
        assertThat(document.getFormats()).containsExactly("other", "pdf", "ps");
        assertThat(document.getSource().getSizeBytes()).isEqualTo(123456L);
        assertThat(document.getLicense().getLabel()).isEqualTo("CC BY 4.0");
    }

    @Test
    void resolvesClassificationsThroughTaxonomy() throws Exception {
        PaperDocument document = normalizer.normalizeAll(versions(fixture("1234.5678v2")), null).get(0).document();

        assertThat(document.getPrimaryClassification().getCategory().getName()).isEqualTo("Machine Learning");
        assertThat(document.getPrimaryClassification().getArchive().getId()).isEqualTo("cs");
        assertThat(document.getPrimaryClassification().getGroup().getName()).isEqualTo("Computer Science");
        assertThat(document.getSecondaryClassification())
            .extracting(classification -> classification.getCategory().getId())
            .containsExactly("cs.CL", "stat.ML");
    }

    @Test
    void buildsAuthorNamesAndDeduplicatesOwners() throws Exception {
        PaperDocument document = normalizer.normalizeAll(versions(fixture("1234.5678v2")), null).get(0).document();

        Author first = document.getAuthors().get(0);
        assertThat(first.getFullName()).isEqualTo("Jana Maria Müller");
        assertThat(first.getInitials()).isEqualTo("J M");
        assertThat(first.getFullNameInitialized()).isEqualTo("J. M. Müller");
        assertThat(first.getAffiliation()).containsExactly("University of Zürich");
        assertThat(document.getAuthors().get(1).getFullName()).isEqualTo("John Smith Jr");
        assertThat(document.getOwners()).hasSize(1);
        assertThat(document.getSubmitter().getIsAuthor()).isTrue();
    }

    @Test
    void aggregatesContainTheirSourceFields() throws Exception {
        PaperDocument document = normalizer.normalizeAll(versions(fixture("1234.5678v2")), null).get(0).document();

        assertThat(document.getCombined())
            .contains("Sparse Attention for Long Documents")
            .contains("We study sparse attention patterns for long document modelling.")
            .contains("Jana Maria Müller")
            .contains("1234.5678");
        assertThat(document.getAuthorsCombined())
            .isEqualTo("Jana Maria Müller John Smith Jr J. M. Müller J. Smith Jr");
    }

    @Test
    void aggregatesFollowSourceChanges() throws Exception {
        ObjectNode changed = fixture("1234.5678v2");
        changed.put("abstract", "A rewritten abstract.");

        String before = normalizer.normalizeAll(versions(fixture("1234.5678v2")), null).get(0).document().getCombined();
        String after = normalizer.normalizeAll(versions(changed), null).get(0).document().getCombined();

        assertThat(after).isNotEqualTo(before).contains("A rewritten abstract.");
    }

    @Test
    void missingTitleFailsWithTransformException() throws Exception {
        ObjectNode record = fixture("1234.5678v1");
        record.remove("title");

        assertThatThrownBy(() -> normalizer.normalizeAll(versions(record), null))
            .isInstanceOf(TransformException.class)
            .satisfies(error -> assertThat(((TransformException) error).getField()).isEqualTo("title"));
    }

    @Test
    void unknownCategoryFailsWithTransformException() throws Exception {
        ObjectNode record = fixture("1234.5678v1");
        record.put("primary_classification", "cs.XX");

        assertThatThrownBy(() -> normalizer.normalizeAll(versions(record), null))
            .isInstanceOf(TransformException.class)
            .satisfies(error -> assertThat(((TransformException) error).getReason()).isEqualTo("unknown_category"));
    }

    @Test
    void conflictingArchiveFailsWithTransformException() throws Exception {
        ObjectNode record = fixture("1234.5678v2");
        ((ObjectNode) record.path("primary_classification").path("archive")).put("id", "math");

        assertThatThrownBy(() -> normalizer.normalizeAll(versions(record), null))
            .isInstanceOf(TransformException.class)
            .satisfies(error -> assertThat(((TransformException) error).getReason()).isEqualTo("archive_mismatch"));
    }

    @Test
    void withdrawnLatestVersionLeavesEarlierVersionCurrentAndIsFlagged() throws Exception {
        ObjectNode latest = fixture("1234.5678v2");
        latest.put("is_withdrawn", true);

        List<NormalizedDocument> documents = normalizer.normalizeAll(versions(latest, fixture("1234.5678v1")), null);

        NormalizedDocument v1 = documents.get(0);
        NormalizedDocument v2 = documents.get(1);
        assertThat(v1.document().getIsCurrent()).isTrue();
        assertThat(v2.document().getIsCurrent()).isFalse();
        assertThat(v2.document().getIsWithdrawn()).isTrue();
        assertThat(v2.document().getLatest()).isEqualTo("1234.5678v1");
        assertThat(v2.isFlagged()).isTrue();
        assertThat(v2.anomalies()).anyMatch(anomaly -> anomaly.startsWith("withdrawn_version_above_current"));
    }

    @Test
    void requestedVersionMustExist() throws Exception {
        assertThatThrownBy(() -> normalizer.normalizeAll(versions(fixture("1234.5678v1")), 3))
            .isInstanceOf(TransformException.class)
            .hasMessageContaining("version 3");
    }

    private PaperVersions versions(ObjectNode... records) {
        return new PaperVersions(
            "1234.5678",
            Arrays.stream(records).map(MetadataRecord::new).toList()
        );
    }

    private ObjectNode fixture(String name) throws IOException {
        try (InputStream input = getClass().getResourceAsStream("/docmeta/" + name + ".json")) {
            return (ObjectNode) objectMapper.readTree(input);
        }
    }
}
