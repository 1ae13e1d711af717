package com.quarry.query.split;

import com.quarry.domain.QueryResult;
import com.quarry.query.Request;
import com.quarry.query.plan.QueryPlanExecutionStrategy;
import com.quarry.query.plan.QueryRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Tries split strategies in a fixed priority order and runs the first that applies,
 * otherwise executes the request directly.
 *
 * The order matters: a column split changes the row set a time split would page over.
 * Failures of a chosen strategy propagate, there is no fallback to direct execution.
 */
public class SplitQueryPlanExecutionStrategy implements QueryPlanExecutionStrategy {

    private static final Logger log = LoggerFactory.getLogger(SplitQueryPlanExecutionStrategy.class);

    private final List<QuerySplitStrategy> splitStrategies;
    private final QueryPlanExecutionStrategy defaultStrategy;

    public SplitQueryPlanExecutionStrategy(List<QuerySplitStrategy> splitStrategies,
                                           QueryPlanExecutionStrategy defaultStrategy) {
        this.splitStrategies = List.copyOf(splitStrategies);
        this.defaultStrategy = Objects.requireNonNull(defaultStrategy, "defaultStrategy");
    }

    @Override
    public QueryResult execute(Request request, QueryRunner runner) {
        for (QuerySplitStrategy strategy : splitStrategies) {
            Optional<QueryResult> result = strategy.execute(request, runner);
            if (result.isPresent()) {
                log.debug("Query answered by {} split", strategy.getName());
                return result.get();
            }
        }
        return defaultStrategy.execute(request, runner);
    }

    public List<QuerySplitStrategy> getSplitStrategies() {
        return splitStrategies;
    }
}
