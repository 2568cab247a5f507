package com.psl.search.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * An author that satisfied the author part of the query; {@code position} indexes the paper's author list.
 */
public record MatchedAuthor(
    @JsonProperty("position") int position,
    @JsonProperty("full_name") String fullName
) {
}
