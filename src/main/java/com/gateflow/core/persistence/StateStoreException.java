package com.gateflow.core.persistence;

/**
 * Thrown when a state record cannot be written or read.
 */
public class StateStoreException extends RuntimeException {

    private final String key;

    public StateStoreException(String key, String message, Throwable cause) {
        super(message + " [key=" + key + "]", cause);
        this.key = key;
    }

    public String getKey() {
        return key;
    }
}
