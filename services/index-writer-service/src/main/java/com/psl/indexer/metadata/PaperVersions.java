package com.psl.indexer.metadata;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Every known version record of one paper, ordered by version number. Records without a usable version sort
 * first so the normalizer can reject them.
 */
public class PaperVersions {
    private final String paperId;
    private final List<MetadataRecord> records;

    public PaperVersions(String paperId, List<MetadataRecord> records) {
        this.paperId = paperId;
        List<MetadataRecord> sorted = new ArrayList<>(records == null ? List.of() : records);
        sorted.sort(Comparator.comparing(MetadataRecord::version, Comparator.nullsFirst(Comparator.naturalOrder())));
        this.records = List.copyOf(sorted);
    }

    public String getPaperId() {
        return paperId;
    }

    public List<MetadataRecord> getRecords() {
        return records;
    }
}
