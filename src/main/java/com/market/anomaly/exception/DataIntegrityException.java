package com.market.anomaly.exception;

/**
 * A stored row holds a value this service cannot interpret, e.g. an unknown anomaly type.
 */
public class DataIntegrityException extends RuntimeException {

    public DataIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
