package com.fleet.anomaly.exception;

/**
 * The feature table cannot be used for detection: a required column is absent, a key cell is
 * missing or malformed, a key repeats, or a required numeric cell does not parse.
 * Raised before any detection layer runs.
 */
public class FeatureSchemaException extends RuntimeException {

    public FeatureSchemaException(String message) {
        super(message);
    }

    public FeatureSchemaException(String message, Throwable cause) {
        super(message, cause);
    }
}
