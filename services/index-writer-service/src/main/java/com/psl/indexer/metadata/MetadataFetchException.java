package com.psl.indexer.metadata;

public class MetadataFetchException extends RuntimeException {
    private final boolean retryable;

    public MetadataFetchException(String message, Throwable cause) {
        this(message, cause, true);
    }

    public MetadataFetchException(String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.retryable = retryable;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
