package com.psl.search.api.dto;

import com.psl.search.pagination.PageLinks;
import java.util.List;
import java.util.Map;

public class DocumentSetResponse {
    private Metadata metadata;
    private List<PaperHit> results;

    public Metadata getMetadata() {
        return metadata;
    }

    public void setMetadata(Metadata metadata) {
        this.metadata = metadata;
    }

    public List<PaperHit> getResults() {
        return results;
    }

    public void setResults(List<PaperHit> results) {
        this.results = results;
    }

    public static class Metadata {
        private Map<String, Object> query;
        private long total;
        private PageLinks pagination;

        public Map<String, Object> getQuery() {
            return query;
        }

        public void setQuery(Map<String, Object> query) {
            this.query = query;
        }

        public long getTotal() {
            return total;
        }

        public void setTotal(long total) {
            this.total = total;
        }

        public PageLinks getPagination() {
            return pagination;
        }

        public void setPagination(PageLinks pagination) {
            this.pagination = pagination;
        }
    }
}
