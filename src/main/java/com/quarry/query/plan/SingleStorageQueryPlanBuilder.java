package com.quarry.query.plan;

import com.quarry.query.Request;
import com.quarry.query.processor.QueryProcessor;
import com.quarry.storage.ReadableStorage;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Builds the plan for a dataset that reads a single storage.
 *
 * The storage's own processors run first so they apply in every context the
 * storage is used in. The post processors are defined by the dataset and run
 * once per query after them, which is where a step like PREWHERE belongs when
 * several storages take part in one query.
 */
public class SingleStorageQueryPlanBuilder implements StorageQueryPlanBuilder {

    private final ReadableStorage storage;
    private final List<QueryProcessor> postProcessors;
    private final QueryPlanExecutionStrategy executionStrategy;

    public SingleStorageQueryPlanBuilder(ReadableStorage storage, List<QueryProcessor> postProcessors) {
        this(storage, postProcessors, new SimpleQueryPlanExecutionStrategy());
    }

    public SingleStorageQueryPlanBuilder(ReadableStorage storage, List<QueryProcessor> postProcessors,
                                         QueryPlanExecutionStrategy executionStrategy) {
        this.storage = Objects.requireNonNull(storage, "storage");
        this.postProcessors = List.copyOf(postProcessors);
        this.executionStrategy = Objects.requireNonNull(executionStrategy, "executionStrategy");
    }

    @Override
    public StorageQueryPlan buildPlan(Request request) {
        request.getQuery().setDataSource(storage.getReadSchema().getDataSource());

        List<QueryProcessor> processors = new ArrayList<>(storage.getQueryProcessors());
        processors.addAll(postProcessors);
        return new StorageQueryPlan(processors, executionStrategy);
    }

    public ReadableStorage getStorage() {
        return storage;
    }
}
