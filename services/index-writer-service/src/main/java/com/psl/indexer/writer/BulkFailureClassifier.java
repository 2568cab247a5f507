package com.psl.indexer.writer;

import java.util.Set;

/**
 * Splits engine failures into transient (worth another attempt) and permanent (the document itself is wrong).
 */
public final class BulkFailureClassifier {
    private static final Set<Integer> TRANSIENT_STATUSES = Set.of(408, 409, 429, 502, 503, 504);
    private static final Set<String> TRANSIENT_TYPES = Set.of(
        "es_rejected_execution_exception",
        "circuit_breaking_exception",
        "version_conflict_engine_exception",
        "process_cluster_event_timeout_exception"
    );

    private BulkFailureClassifier() {}

    public static boolean isTransient(int status, String errorType) {
        if (errorType != null && TRANSIENT_TYPES.contains(errorType)) {
            return true;
        }
        if (TRANSIENT_STATUSES.contains(status)) {
            return true;
        }
        return status >= 500;
    }
}
