package com.market.anomaly.exception;

/**
 * The threshold document could not be read or parsed. No default is substituted.
 */
public class ConfigLoadException extends RuntimeException {

    public ConfigLoadException(String message) {
        super(message);
    }

    public ConfigLoadException(String message, Throwable cause) {
        super(message, cause);
    }
}
