package com.logflow.anomaly.engine.exception;

/**
 * Raised before any detector runs when a request carries a window, bucket size or tuning value
 * that cannot produce a meaningful detection.
 */
public class InvalidDetectionConfigException extends RuntimeException {

    private final String field;

    public InvalidDetectionConfigException(String field, String message) {
        super(field + ": " + message);
        this.field = field;
    }

    public String getField() {
        return field;
    }
}
