package com.psl.indexer.normalize;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.psl.indexer.metadata.MetadataRecord;
import com.psl.indexer.metadata.PaperVersions;
import com.psl.schema.SchemaRegistry;
import com.psl.schema.document.Author;
import com.psl.schema.document.Classification;
import com.psl.schema.document.License;
import com.psl.schema.document.PaperDocument;
import com.psl.schema.document.SourceInfo;
import com.psl.schema.document.Submitter;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.TreeMap;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Turns one version record, read together with its sibling versions, into the canonical document.
 * Pure computation: no I/O, no shared mutable state.
 */
@Component
public class DocumentNormalizer {
    private static final Logger log = LoggerFactory.getLogger(DocumentNormalizer.class);

    private final VersionResolver versionResolver = new VersionResolver();
    private final AuthorNormalizer authorNormalizer = new AuthorNormalizer();
    private final ClassificationResolver classificationResolver;
    private final AggregateFieldWriter aggregateFieldWriter;

    public DocumentNormalizer(SchemaRegistry registry, ObjectMapper objectMapper) {
        this.classificationResolver = new ClassificationResolver(registry.taxonomy());
        this.aggregateFieldWriter = new AggregateFieldWriter(registry, objectMapper);
    }

    /**
     * Normalizes every version in {@code versions}, or only {@code onlyVersion} when it is not null.
     */
    public List<NormalizedDocument> normalizeAll(PaperVersions versions, Integer onlyVersion) {
        VersionResolver.Resolution resolution = versionResolver.resolve(versions);
        List<NormalizedDocument> documents = new ArrayList<>();
        for (MetadataRecord record : versions.getRecords()) {
            if (onlyVersion != null && !onlyVersion.equals(record.version())) {
                continue;
            }
            documents.add(normalize(versions, record, resolution));
        }
        if (onlyVersion != null && documents.isEmpty()) {
            throw new TransformException(
                "version",
                "unknown_version",
                "version " + onlyVersion + " not found for " + versions.getPaperId()
            );
        }
        return documents;
    }

    public NormalizedDocument normalize(PaperVersions versions, MetadataRecord record) {
        return normalize(versions, record, versionResolver.resolve(versions));
    }

    private NormalizedDocument normalize(
        PaperVersions versions,
        MetadataRecord record,
        VersionResolver.Resolution resolution
    ) {
        String paperId = record.paperId();
        if (paperId == null) {
            throw TransformException.missing("paper_id");
        }
        if (versions.getPaperId() != null && !versions.getPaperId().equals(paperId)) {
            throw new TransformException(
                "paper_id",
                "paper_id_mismatch",
                "record paper_id " + paperId + " does not belong to " + versions.getPaperId()
            );
        }
        Integer version = record.version();
        if (version == null) {
            throw TransformException.missing("version");
        }
        String title = record.text("title");
        if (title == null) {
            throw TransformException.missing("title");
        }
        if (DateValues.parse(record.text("submitted_date")) == null) {
            if (record.text("submitted_date") == null) {
                throw TransformException.missing("submitted_date_first");
            }
            throw new TransformException(
                "submitted_date",
                "malformed_date",
                "unparseable submitted_date: " + record.text("submitted_date")
            );
        }

        List<String> anomalies = new ArrayList<>(resolution.anomaliesFor(version));
        PaperDocument document = new PaperDocument();
        document.setPaperId(paperId);
        document.setVersion(version);
        document.setPaperIdV(PaperDocument.composeId(paperId, version));
        document.setIsCurrent(resolution.isCurrent(version));
        document.setIsWithdrawn(record.flag("is_withdrawn"));
        document.setLatest(PaperDocument.composeId(paperId, resolution.currentVersion()));
        document.setLatestVersion(resolution.currentVersion());

        applySubmissionDates(document, versions, anomalies);
        document.setUpdatedDate(optionalDate(record, "updated_date", anomalies));
        document.setModifiedDate(optionalDate(record, "modified_date", anomalies));
        String announced = record.text("announced_date_first");
        document.setAnnouncedDateFirst(DateValues.month(announced));
        if (announced != null && document.getAnnouncedDateFirst() == null) {
            anomalies.add("malformed_date field=announced_date_first");
        }

        document.setTitle(title);
        document.setAbstractText(record.text("abstract"));
        document.setComments(record.text("comments"));
        document.setJournalRef(record.text("journal_ref"));
        document.setReportNum(record.text("report_num"));
        document.setDoi(record.text("doi"));
        document.setMscClass(record.text("msc_class"));
        document.setAcmClass(record.text("acm_class"));
        document.setFulltext(record.text("fulltext"));
        document.setFormats(formats(record.get("formats")));
        document.setLicense(license(record.get("license")));
        document.setSource(source(record.get("source")));

        JsonNode primary = record.get("primary_classification");
        if (primary.isMissingNode() || primary.isNull()) {
            throw TransformException.missing("primary_classification");
        }
        Classification primaryClassification = classificationResolver.resolve("primary_classification", primary);
        document.setPrimaryClassification(primaryClassification);
        List<Classification> secondaries =
            classificationResolver.resolveSecondaries(record.get("secondary_classification"), primaryClassification);
        document.setSecondaryClassification(secondaries.isEmpty() ? null : secondaries);

        JsonNode rawAuthors = record.get("authors_parsed");
        if (rawAuthors.isMissingNode() || rawAuthors.isNull()) {
            rawAuthors = record.get("authors");
        }
        List<Author> authors = authorNormalizer.authors(rawAuthors);
        document.setAuthors(authors.isEmpty() ? null : authors);
        List<Author> owners = authorNormalizer.owners(record.get("owners"));
        document.setOwners(owners.isEmpty() ? null : owners);
        document.setSubmitter(submitter(record.get("submitter")));

        aggregateFieldWriter.apply(document);

        for (String anomaly : anomalies) {
            log.warn("metadata_anomaly paper_id_v={} detail=\"{}\"", document.getPaperIdV(), anomaly);
        }
        return new NormalizedDocument(document, anomalies);
    }

    private void applySubmissionDates(PaperDocument document, PaperVersions versions, List<String> anomalies) {
        TreeMap<OffsetDateTime, String> all = new TreeMap<>(Comparator.comparing(OffsetDateTime::toInstant));
        for (MetadataRecord sibling : versions.getRecords()) {
            addDate(all, sibling.text("submitted_date"), anomalies);
            for (JsonNode value : sibling.get("submitted_date_all")) {
                addDate(all, JsonValues.text(value), anomalies);
            }
        }
        document.setSubmittedDateFirst(all.firstEntry().getValue());
        document.setSubmittedDateLatest(all.lastEntry().getValue());
        document.setSubmittedDateAll(new ArrayList<>(all.values()));
    }

    private void addDate(TreeMap<OffsetDateTime, String> out, String raw, List<String> anomalies) {
        if (raw == null) {
            return;
        }
        OffsetDateTime parsed = DateValues.parse(raw);
        if (parsed == null) {
            anomalies.add("malformed_date field=submitted_date value=" + raw);
            return;
        }
        out.putIfAbsent(parsed, DateValues.format(parsed));
    }

    private String optionalDate(MetadataRecord record, String field, List<String> anomalies) {
        String raw = record.text(field);
        if (raw == null) {
            return null;
        }
        OffsetDateTime parsed = DateValues.parse(raw);
        if (parsed == null) {
            anomalies.add("malformed_date field=" + field);
            return null;
        }
        return DateValues.format(parsed);
    }

    private List<String> formats(JsonNode raw) {
        TreeSet<String> formats = new TreeSet<>();
        for (JsonNode value : raw) {
            String format = JsonValues.text(value);
            if (format != null) {
                formats.add(format);
            }
        }
        return formats.isEmpty() ? null : new ArrayList<>(formats);
    }

    private License license(JsonNode raw) {
        String uri;
        String label = null;
        if (raw.isObject()) {
            uri = JsonValues.text(raw.path("uri"));
            label = JsonValues.text(raw.path("label"));
        } else {
            uri = JsonValues.text(raw);
        }
        if (uri == null && label == null) {
            return null;
        }
        License license = new License();
        license.setUri(uri);
        license.setLabel(label);
        return license;
    }

    private SourceInfo source(JsonNode raw) {
        if (!raw.isObject()) {
            return null;
        }
        SourceInfo source = new SourceInfo();
        source.setFlags(JsonValues.text(raw.path("flags")));
        source.setFormat(JsonValues.text(raw.path("format")));
        JsonNode size = raw.path("size_bytes");
        if (size.canConvertToLong()) {
            source.setSizeBytes(size.asLong());
        } else if (size.isTextual() && size.asText().trim().matches("\\d+")) {
            source.setSizeBytes(Long.parseLong(size.asText().trim()));
        }
        return source;
    }

    private Submitter submitter(JsonNode raw) {
        if (!raw.isObject()) {
            return null;
        }
        Submitter submitter = new Submitter();
        submitter.setEmail(JsonValues.text(raw.path("email")));
        submitter.setName(JsonValues.text(raw.path("name")));
        String submitterId = JsonValues.text(raw.path("submitter_id"));
        submitter.setSubmitterId(submitterId != null ? submitterId : JsonValues.text(raw.path("id")));
        JsonNode isAuthor = raw.path("is_author");
        submitter.setIsAuthor(isAuthor.isBoolean() ? isAuthor.asBoolean() : null);
        submitter.setAuthorId(JsonValues.text(raw.path("author_id")));
        submitter.setOrcid(JsonValues.text(raw.path("orcid")));
        return submitter;
    }
}
