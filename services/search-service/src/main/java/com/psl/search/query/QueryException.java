package com.psl.search.query;

/**
 * A search request that cannot be turned into an engine query. Reported to the caller as a client error.
 */
public class QueryException extends RuntimeException {
    public QueryException(String message) {
        super(message);
    }

    public QueryException(String message, Throwable cause) {
        super(message, cause);
    }
}
