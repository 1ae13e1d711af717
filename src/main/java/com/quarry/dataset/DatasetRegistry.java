package com.quarry.dataset;

import com.quarry.storage.StorageConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * All datasets the service answers queries for, by name
 */
public class DatasetRegistry {

    private static final Logger log = LoggerFactory.getLogger(DatasetRegistry.class);

    private final Map<String, Dataset> datasets = new TreeMap<>();

    public DatasetRegistry(Collection<Dataset> datasets) {
        for (Dataset dataset : datasets) {
            if (this.datasets.put(dataset.getName(), dataset) != null) {
                throw new StorageConfigurationException("Dataset registered twice: " + dataset.getName());
            }
        }
        log.info("Dataset registry initialized with {}", this.datasets.keySet());
    }

    /**
     * @throws UnknownDatasetException if no dataset is registered under {@code name}
     */
    public Dataset get(String name) {
        Dataset dataset = datasets.get(name);
        if (dataset == null) {
            throw new UnknownDatasetException(name);
        }
        return dataset;
    }

    public Set<String> getNames() {
        return datasets.keySet();
    }
}
