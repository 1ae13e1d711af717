package com.quarry.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Physical storages the query engine can read from.
 */
public enum StorageKey {

    /**
     * Raw error events, one row per event
     */
    EVENTS("events"),

    /**
     * Raw session updates as ingested
     */
    SESSIONS_RAW("sessions_raw"),

    /**
     * Hourly rollup of sessions, materialized from the raw storage
     */
    SESSIONS_HOURLY("sessions_hourly");

    private final String value;

    StorageKey(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Parse a string value to StorageKey
     */
    public static StorageKey fromValue(String value) {
        for (StorageKey key : StorageKey.values()) {
            if (key.value.equalsIgnoreCase(value)) {
                return key;
            }
        }
        throw new IllegalArgumentException("Unknown StorageKey value: " + value);
    }
}
