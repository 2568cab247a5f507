package com.psl.schema.document;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import java.util.Objects;

@JsonInclude(JsonInclude.Include.NON_NULL)
public class Classification {
    private ClassificationTerm group;
    private ClassificationTerm archive;
    private ClassificationTerm category;

    public ClassificationTerm getGroup() {
        return group;
    }

    public void setGroup(ClassificationTerm group) {
        this.group = group;
    }

    public ClassificationTerm getArchive() {
        return archive;
    }

    public void setArchive(ClassificationTerm archive) {
        this.archive = archive;
    }

    public ClassificationTerm getCategory() {
        return category;
    }

    public void setCategory(ClassificationTerm category) {
        this.category = category;
    }

    public Classification() {
    }

    public Classification(ClassificationTerm group, ClassificationTerm archive, ClassificationTerm category) {
        this.group = group;
        this.archive = archive;
        this.category = category;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Classification other)) {
            return false;
        }
        return Objects.equals(group, other.group)
            && Objects.equals(archive, other.archive)
            && Objects.equals(category, other.category);
    }

    @Override
    public int hashCode() {
        return Objects.hash(group, archive, category);
    }
}
