package com.psl.indexer.run;

import java.util.List;

/**
 * Where a run writes. A rebuild writes into a fresh concrete index and moves {@code alias} onto it afterwards.
 */
public record IndexTarget(String writeIndex, String alias, boolean rebuild, List<String> previousIndices) {
    public IndexTarget {
        previousIndices = previousIndices == null ? List.of() : List.copyOf(previousIndices);
    }
}
