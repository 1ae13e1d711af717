package com.quarry.storage;

import com.quarry.domain.StorageKey;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

/**
 * All storages known to the service, by key
 */
public class StorageRegistry {

    private static final Logger log = LoggerFactory.getLogger(StorageRegistry.class);

    private final Map<StorageKey, ReadableStorage> storages = new EnumMap<>(StorageKey.class);

    public StorageRegistry(Collection<? extends ReadableStorage> storages) {
        for (ReadableStorage storage : storages) {
            if (this.storages.put(storage.getKey(), storage) != null) {
                throw new StorageConfigurationException("Storage registered twice: " + storage.getKey().getValue());
            }
        }
        log.info("Storage registry initialized with {}", this.storages.keySet());
    }

    /**
     * @throws StorageConfigurationException if no storage is registered under {@code key}
     */
    public ReadableStorage get(StorageKey key) {
        ReadableStorage storage = storages.get(key);
        if (storage == null) {
            throw new StorageConfigurationException("Unknown storage: " + key);
        }
        return storage;
    }

    /**
     * True when {@code storage} is the very instance registered under its key
     */
    public boolean isRegistered(ReadableStorage storage) {
        return storage != null && storages.get(storage.getKey()) == storage;
    }

    /**
     * Storage whose read schema reads from {@code dataSource}
     */
    public Optional<ReadableStorage> findByDataSource(String dataSource) {
        for (ReadableStorage storage : storages.values()) {
            if (storage.getReadSchema().getDataSource().equals(dataSource)) {
                return Optional.of(storage);
            }
        }
        return Optional.empty();
    }

    public Map<StorageKey, ReadableStorage> getAll() {
        return Collections.unmodifiableMap(storages);
    }
}
