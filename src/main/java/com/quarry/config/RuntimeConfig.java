package com.quarry.config;

/**
 * Source of tunables that may change while the service runs.
 * Values are looked up on every call and never cached by callers.
 */
@FunctionalInterface
public interface RuntimeConfig {

    /**
     * Raw value for {@code key}, null when unset
     */
    String get(String key);

    default int getInt(String key, int defaultValue) {
        String value = get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Runtime config " + key + " is not an integer: " + value, e);
        }
    }

    default long getLong(String key, long defaultValue) {
        String value = get(key);
        if (value == null || value.isBlank()) {
            return defaultValue;
        }
        try {
            return Long.parseLong(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Runtime config " + key + " is not an integer: " + value, e);
        }
    }
}
