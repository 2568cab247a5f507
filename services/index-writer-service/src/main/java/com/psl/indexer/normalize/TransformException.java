package com.psl.indexer.normalize;

/**
 * A metadata record that cannot become a document: a required field is missing or malformed, or a classification
 * does not resolve in the taxonomy. Never retried.
 */
public class TransformException extends RuntimeException {
    private final String field;
    private final String reason;

    public TransformException(String field, String reason, String message) {
        super(message);
        this.field = field;
        this.reason = reason;
    }

    public String getField() {
        return field;
    }

    public String getReason() {
        return reason;
    }

    public static TransformException missing(String field) {
        return new TransformException(field, "missing_required_field", "required field missing: " + field);
    }
}
