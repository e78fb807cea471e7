package com.fleet.anomaly.exception;

/**
 * A detection request names an input or output the caller is not allowed to use.
 */
public class InvalidDetectionRequestException extends RuntimeException {

    public InvalidDetectionRequestException(String message) {
        super(message);
    }
}
