package com.psl.indexer.opensearch;

public class OpenSearchRequestException extends RuntimeException {
    private final int statusCode;

    public OpenSearchRequestException(String message, Throwable cause) {
        this(message, cause, 0);
    }

    public OpenSearchRequestException(String message, Throwable cause, int statusCode) {
        super(message, cause);
        this.statusCode = statusCode;
    }

    /**
     * HTTP status of the failed call, or 0 when the failure happened outside HTTP (for example parsing).
     */
    public int getStatusCode() {
        return statusCode;
    }
}
