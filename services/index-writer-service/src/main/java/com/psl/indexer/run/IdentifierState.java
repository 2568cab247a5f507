package com.psl.indexer.run;

/**
 * Per-identifier lifecycle. {@code INDEXED} is the only successful terminal state; {@code CANCELLED} marks
 * identifiers a cancelled run never finished.
 */
public enum IdentifierState {
    PENDING,
    FETCHING,
    TRANSFORMING,
    BATCHED,
    INDEXED,
    FETCH_FAILED,
    TRANSFORM_FAILED,
    INDEX_FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return switch (this) {
            case INDEXED, FETCH_FAILED, TRANSFORM_FAILED, INDEX_FAILED, CANCELLED -> true;
            default -> false;
        };
    }
}
