package com.quarry.config;

import com.quarry.dataset.Dataset;
import com.quarry.dataset.DatasetRegistry;
import com.quarry.storage.ReadableStorage;
import com.quarry.storage.StorageRegistry;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Registries over every storage and dataset bean in the context
 */
@Configuration
public class EngineConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public StorageRegistry storageRegistry(List<ReadableStorage> storages) {
        return new StorageRegistry(storages);
    }

    @Bean
    public DatasetRegistry datasetRegistry(List<Dataset> datasets) {
        return new DatasetRegistry(datasets);
    }
}
