package com.psl.search.pagination;

import com.fasterxml.jackson.annotation.JsonInclude;

@JsonInclude(JsonInclude.Include.ALWAYS)
public record PageLinks(String next, String previous) {
    public static PageLinks none() {
        return new PageLinks(null, null);
    }
}
