package com.quarry.query.plan;

import com.quarry.query.Request;
import com.quarry.query.processor.QueryProcessor;
import com.quarry.storage.ReadableStorage;
import com.quarry.storage.StorageConfigurationException;
import com.quarry.storage.StorageRegistry;
import com.quarry.storage.StorageSelector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Builds the plan for a dataset whose reads go to one of several storages,
 * e.g. raw rows or an hourly rollup. The selector is the only place that
 * decision is made.
 */
public class SelectedStorageQueryPlanBuilder implements StorageQueryPlanBuilder {

    private static final Logger log = LoggerFactory.getLogger(SelectedStorageQueryPlanBuilder.class);

    private final StorageSelector selector;
    private final StorageRegistry registry;
    private final List<QueryProcessor> postProcessors;
    private final QueryPlanExecutionStrategy executionStrategy;

    public SelectedStorageQueryPlanBuilder(StorageSelector selector, StorageRegistry registry,
                                           List<QueryProcessor> postProcessors) {
        this(selector, registry, postProcessors, new SimpleQueryPlanExecutionStrategy());
    }

    public SelectedStorageQueryPlanBuilder(StorageSelector selector, StorageRegistry registry,
                                           List<QueryProcessor> postProcessors,
                                           QueryPlanExecutionStrategy executionStrategy) {
        this.selector = Objects.requireNonNull(selector, "selector");
        this.registry = Objects.requireNonNull(registry, "registry");
        this.postProcessors = List.copyOf(postProcessors);
        this.executionStrategy = Objects.requireNonNull(executionStrategy, "executionStrategy");
    }

    /**
     * @throws StorageConfigurationException if the selector picks a storage the registry does not know
     */
    @Override
    public StorageQueryPlan buildPlan(Request request) {
        ReadableStorage storage = selector.selectStorage(request.getQuery(), request.getSettings());
        if (!registry.isRegistered(storage)) {
            throw new StorageConfigurationException("Storage selector returned an unregistered storage: " + storage);
        }
        log.debug("Selected storage {}", storage.getKey().getValue());
        return new SingleStorageQueryPlanBuilder(storage, postProcessors, executionStrategy).buildPlan(request);
    }
}
