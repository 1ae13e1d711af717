package com.quarry.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Runtime config backed by the Spring {@link Environment} under {@code quarry.runtime.*},
 * with in-process overrides that take effect on the next lookup.
 */
@Component
public class EnvironmentRuntimeConfig implements RuntimeConfig {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentRuntimeConfig.class);

    static final String PREFIX = "quarry.runtime.";

    private final Environment environment;
    private final Map<String, String> overrides = new ConcurrentHashMap<>();

    public EnvironmentRuntimeConfig(Environment environment) {
        this.environment = environment;
    }

    @Override
    public String get(String key) {
        String override = overrides.get(key);
        if (override != null) {
            return override;
        }
        return environment.getProperty(PREFIX + key);
    }

    /**
     * Override {@code key} until {@link #clear(String)} is called
     */
    public void set(String key, String value) {
        overrides.put(key, value);
        log.info("Runtime config override: {}={}", key, value);
    }

    public void clear(String key) {
        if (overrides.remove(key) != null) {
            log.info("Runtime config override cleared: {}", key);
        }
    }

    public Map<String, String> getOverrides() {
        return Map.copyOf(overrides);
    }
}
