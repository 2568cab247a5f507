package com.psl.schema.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.List;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Author {
    @JsonProperty("first_name")
    private String firstName;

    @JsonProperty("last_name")
    private String lastName;

    private String initials;

    @JsonProperty("full_name")
    private String fullName;

    @JsonProperty("full_name_initialized")
    private String fullNameInitialized;

    private String suffix;

    @JsonProperty("author_id")
    private String authorId;

    private String orcid;
    private List<String> affiliation;

    public String getFirstName() {
        return firstName;
    }

    public void setFirstName(String firstName) {
        this.firstName = firstName;
    }

    public String getLastName() {
        return lastName;
    }

    public void setLastName(String lastName) {
        this.lastName = lastName;
    }

    public String getInitials() {
        return initials;
    }

    public void setInitials(String initials) {
        this.initials = initials;
    }

    public String getFullName() {
        return fullName;
    }

    public void setFullName(String fullName) {
        this.fullName = fullName;
    }

    public String getFullNameInitialized() {
        return fullNameInitialized;
    }

    public void setFullNameInitialized(String fullNameInitialized) {
        this.fullNameInitialized = fullNameInitialized;
    }

    public String getSuffix() {
        return suffix;
    }

    public void setSuffix(String suffix) {
        this.suffix = suffix;
    }

    public String getAuthorId() {
        return authorId;
    }

    public void setAuthorId(String authorId) {
        this.authorId = authorId;
    }

    public String getOrcid() {
        return orcid;
    }

    public void setOrcid(String orcid) {
        this.orcid = orcid;
    }

    public List<String> getAffiliation() {
        return affiliation;
    }

    public void setAffiliation(List<String> affiliation) {
        this.affiliation = affiliation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Author other)) {
            return false;
        }
        return Objects.equals(firstName, other.firstName)
            && Objects.equals(lastName, other.lastName)
            && Objects.equals(initials, other.initials)
            && Objects.equals(fullName, other.fullName)
            && Objects.equals(fullNameInitialized, other.fullNameInitialized)
            && Objects.equals(suffix, other.suffix)
            && Objects.equals(authorId, other.authorId)
            && Objects.equals(orcid, other.orcid)
            && Objects.equals(affiliation, other.affiliation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(firstName, lastName, initials, fullName, fullNameInitialized, suffix, authorId, orcid, affiliation);
    }
}
