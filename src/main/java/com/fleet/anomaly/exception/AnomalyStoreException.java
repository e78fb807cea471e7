package com.fleet.anomaly.exception;

/**
 * The anomaly table (or the feature table it is derived from) could not be read or persisted.
 */
public class AnomalyStoreException extends RuntimeException {

    public AnomalyStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
