package com.quarry.query.plan;

import com.quarry.query.processor.QueryProcessor;

import java.util.List;
import java.util.Objects;

/**
 * Execution plan for one request: processors to run on the query, in order,
 * and the strategy that executes it
 */
public final class StorageQueryPlan {

    private final List<QueryProcessor> queryProcessors;
    private final QueryPlanExecutionStrategy executionStrategy;

    public StorageQueryPlan(List<QueryProcessor> queryProcessors, QueryPlanExecutionStrategy executionStrategy) {
        this.queryProcessors = List.copyOf(queryProcessors);
        this.executionStrategy = Objects.requireNonNull(executionStrategy, "executionStrategy");
    }

    public List<QueryProcessor> getQueryProcessors() {
        return queryProcessors;
    }

    public QueryPlanExecutionStrategy getExecutionStrategy() {
        return executionStrategy;
    }
}
