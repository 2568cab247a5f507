package com.psl.indexer.run;

import com.fasterxml.jackson.annotation.JsonProperty;

public record DeadLetterEntry(
    @JsonProperty("identifier") String identifier,
    @JsonProperty("state") IdentifierState state,
    @JsonProperty("error_class") String errorClass,
    @JsonProperty("reason") String reason,
    @JsonProperty("attempts") int attempts
) {
}
