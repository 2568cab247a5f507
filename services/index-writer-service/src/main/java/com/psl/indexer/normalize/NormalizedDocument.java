package com.psl.indexer.normalize;

import com.psl.schema.document.PaperDocument;
import java.util.List;

/**
 * A canonical document plus the upstream anomalies the normalizer overrode while producing it.
 */
public record NormalizedDocument(PaperDocument document, List<String> anomalies) {
    public NormalizedDocument {
        anomalies = anomalies == null ? List.of() : List.copyOf(anomalies);
    }

    public boolean isFlagged() {
        return !anomalies.isEmpty();
    }
}
