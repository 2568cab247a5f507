package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import com.psl.schema.document.PaperDocument;
import java.util.List;

public class PaperHit {
    @JsonUnwrapped
    private PaperDocument document;

    @JsonProperty("matched_authors")
    @JsonInclude(JsonInclude.Include.NON_EMPTY)
    private List<MatchedAuthor> matchedAuthors;

    public PaperHit() {
    }

    public PaperHit(PaperDocument document, List<MatchedAuthor> matchedAuthors) {
        this.document = document;
        this.matchedAuthors = matchedAuthors;
    }

    public PaperDocument getDocument() {
        return document;
    }

    public void setDocument(PaperDocument document) {
        this.document = document;
    }

    public List<MatchedAuthor> getMatchedAuthors() {
        return matchedAuthors;
    }

    public void setMatchedAuthors(List<MatchedAuthor> matchedAuthors) {
        this.matchedAuthors = matchedAuthors;
    }
}
