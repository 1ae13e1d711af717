package com.quarry.query.plan;

import com.quarry.domain.QueryResult;
import com.quarry.query.Request;

/**
 * One round trip with the request as given
 */
public class SimpleQueryPlanExecutionStrategy implements QueryPlanExecutionStrategy {

    @Override
    public QueryResult execute(Request request, QueryRunner runner) {
        return runner.run(request);
    }
}
