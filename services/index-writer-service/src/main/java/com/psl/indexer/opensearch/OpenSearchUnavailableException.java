package com.psl.indexer.opensearch;

public class OpenSearchUnavailableException extends RuntimeException {
    public OpenSearchUnavailableException(String message) {
        super(message);
    }

    public OpenSearchUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
