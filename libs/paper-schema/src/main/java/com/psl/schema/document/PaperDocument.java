package com.psl.schema.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;

/**
 * Canonical search document: one per paper version, keyed by {@code paper_id_v}. This is both the shape written
 * to the index and the record returned by the search API.
 *
 * <p>{@code combined} and {@code authors_combined} are derived from other fields and have no setters; they are
 * filled by the aggregate fan-out through {@link #assignAggregates(String, String)}.</p>
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PaperDocument {
    @JsonProperty("paper_id")
    private String paperId;

    @JsonProperty("paper_id_v")
    private String paperIdV;

    private Integer version;
    private String latest;

    @JsonProperty("latest_version")
    private Integer latestVersion;

    @JsonProperty("is_current")
    private Boolean isCurrent;

    @JsonProperty("is_withdrawn")
    private Boolean isWithdrawn;

    @JsonProperty("submitted_date_first")
    private String submittedDateFirst;

    @JsonProperty("submitted_date_latest")
    private String submittedDateLatest;

    @JsonProperty("submitted_date_all")
    private List<String> submittedDateAll;

    @JsonProperty("updated_date")
    private String updatedDate;

    @JsonProperty("modified_date")
    private String modifiedDate;

    @JsonProperty("announced_date_first")
    private String announcedDateFirst;

    private String title;

    @JsonProperty("abstract")
    private String abstractText;

    private String comments;

    @JsonProperty("journal_ref")
    private String journalRef;

    @JsonProperty("report_num")
    private String reportNum;

    private String doi;

    @JsonProperty("msc_class")
    private String mscClass;

    @JsonProperty("acm_class")
    private String acmClass;

    private List<String> formats;
    private License license;
    private SourceInfo source;

    @JsonProperty("primary_classification")
    private Classification primaryClassification;

    @JsonProperty("secondary_classification")
    private List<Classification> secondaryClassification;

    private List<Author> authors;
    private List<Author> owners;
    private Submitter submitter;
    private String fulltext;
    private String combined;

    @JsonProperty("authors_combined")
    private String authorsCombined;

    @JsonProperty("content_hash")
    private String contentHash;

    public String getPaperId() {
        return paperId;
    }

    public void setPaperId(String paperId) {
        this.paperId = paperId;
    }

    public String getPaperIdV() {
        return paperIdV;
    }

    public void setPaperIdV(String paperIdV) {
        this.paperIdV = paperIdV;
    }

    public Integer getVersion() {
        return version;
    }

    public void setVersion(Integer version) {
        this.version = version;
    }

    public String getLatest() {
        return latest;
    }

    public void setLatest(String latest) {
        this.latest = latest;
    }

    public Integer getLatestVersion() {
        return latestVersion;
    }

    public void setLatestVersion(Integer latestVersion) {
        this.latestVersion = latestVersion;
    }

    public Boolean getIsCurrent() {
        return isCurrent;
    }

    public void setIsCurrent(Boolean isCurrent) {
        this.isCurrent = isCurrent;
    }

    public Boolean getIsWithdrawn() {
        return isWithdrawn;
    }

    public void setIsWithdrawn(Boolean isWithdrawn) {
        this.isWithdrawn = isWithdrawn;
    }

    public String getSubmittedDateFirst() {
        return submittedDateFirst;
    }

    public void setSubmittedDateFirst(String submittedDateFirst) {
        this.submittedDateFirst = submittedDateFirst;
    }

    public String getSubmittedDateLatest() {
        return submittedDateLatest;
    }

    public void setSubmittedDateLatest(String submittedDateLatest) {
        this.submittedDateLatest = submittedDateLatest;
    }

    public List<String> getSubmittedDateAll() {
        return submittedDateAll;
    }

    public void setSubmittedDateAll(List<String> submittedDateAll) {
        this.submittedDateAll = submittedDateAll;
    }

    public String getUpdatedDate() {
        return updatedDate;
    }

    public void setUpdatedDate(String updatedDate) {
        this.updatedDate = updatedDate;
    }

    public String getModifiedDate() {
        return modifiedDate;
    }

    public void setModifiedDate(String modifiedDate) {
        this.modifiedDate = modifiedDate;
    }

    public String getAnnouncedDateFirst() {
        return announcedDateFirst;
    }

    public void setAnnouncedDateFirst(String announcedDateFirst) {
        this.announcedDateFirst = announcedDateFirst;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getAbstractText() {
        return abstractText;
    }

    public void setAbstractText(String abstractText) {
        this.abstractText = abstractText;
    }

    public String getComments() {
        return comments;
    }

    public void setComments(String comments) {
        this.comments = comments;
    }

    public String getJournalRef() {
        return journalRef;
    }

    public void setJournalRef(String journalRef) {
        this.journalRef = journalRef;
    }

    public String getReportNum() {
        return reportNum;
    }

    public void setReportNum(String reportNum) {
        this.reportNum = reportNum;
    }

    public String getDoi() {
        return doi;
    }

    public void setDoi(String doi) {
        this.doi = doi;
    }

    public String getMscClass() {
        return mscClass;
    }

    public void setMscClass(String mscClass) {
        this.mscClass = mscClass;
    }

    public String getAcmClass() {
        return acmClass;
    }

    public void setAcmClass(String acmClass) {
        this.acmClass = acmClass;
    }

    public List<String> getFormats() {
        return formats;
    }

    public void setFormats(List<String> formats) {
        this.formats = formats;
    }

    public License getLicense() {
        return license;
    }

    public void setLicense(License license) {
        this.license = license;
    }

    public SourceInfo getSource() {
        return source;
    }

    public void setSource(SourceInfo source) {
        this.source = source;
    }

    public Classification getPrimaryClassification() {
        return primaryClassification;
    }

    public void setPrimaryClassification(Classification primaryClassification) {
        this.primaryClassification = primaryClassification;
    }

    public List<Classification> getSecondaryClassification() {
        return secondaryClassification;
    }

    public void setSecondaryClassification(List<Classification> secondaryClassification) {
        this.secondaryClassification = secondaryClassification;
    }

    public List<Author> getAuthors() {
        return authors;
    }

    public void setAuthors(List<Author> authors) {
        this.authors = authors;
    }

    public List<Author> getOwners() {
        return owners;
    }

    public void setOwners(List<Author> owners) {
        this.owners = owners;
    }

    public Submitter getSubmitter() {
        return submitter;
    }

    public void setSubmitter(Submitter submitter) {
        this.submitter = submitter;
    }

    public String getFulltext() {
        return fulltext;
    }

    public void setFulltext(String fulltext) {
        this.fulltext = fulltext;
    }

    public String getCombined() {
        return combined;
    }

    public String getAuthorsCombined() {
        return authorsCombined;
    }

    public String getContentHash() {
        return contentHash;
    }

    public void setContentHash(String contentHash) {
        this.contentHash = contentHash;
    }

    public void assignAggregates(String combined, String authorsCombined) {
        this.combined = combined;
        this.authorsCombined = authorsCombined;
    }

    public static String composeId(String paperId, int version) {
        return paperId + "v" + version;
    }
}
