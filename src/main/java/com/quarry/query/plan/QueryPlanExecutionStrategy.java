package com.quarry.query.plan;

import com.quarry.domain.QueryResult;
import com.quarry.query.Request;

/**
 * Decides how many round trips a processed request takes and merges their results
 */
@FunctionalInterface
public interface QueryPlanExecutionStrategy {

    QueryResult execute(Request request, QueryRunner runner);
}
