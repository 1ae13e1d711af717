package com.quarry.storage;

/**
 * Raised when storages, datasets or split specs are wired inconsistently.
 * Fatal for the request, never retried.
 */
public class StorageConfigurationException extends RuntimeException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
