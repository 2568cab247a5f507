package com.psl.indexer.writer;

public enum ItemOutcome {
    WRITTEN,
    REJECTED,
    RETRYABLE
}
