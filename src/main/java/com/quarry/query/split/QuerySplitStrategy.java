package com.quarry.query.split;

import com.quarry.domain.QueryResult;
import com.quarry.query.Request;
import com.quarry.query.plan.QueryRunner;

import java.util.Optional;

/**
 * One algorithm that answers a request with several cheaper round trips instead of one.
 *
 * Not every algorithm fits every query, so each declares its own precondition.
 * Implementations never mutate the request they are given; every sub-query is
 * issued on a copy.
 */
public interface QuerySplitStrategy {

    /**
     * Short name for logs and metrics
     */
    String getName();

    /**
     * True if this algorithm can answer {@code request}. No side effects.
     */
    boolean canExecute(Request request);

    /**
     * Run the split. Only called when {@link #canExecute(Request)} holds.
     */
    QueryResult split(Request request, QueryRunner runner);

    /**
     * Run the split if it applies
     *
     * @return the merged result, or empty when the precondition does not hold
     */
    default Optional<QueryResult> execute(Request request, QueryRunner runner) {
        if (!canExecute(request)) {
            return Optional.empty();
        }
        return Optional.of(split(request, runner));
    }
}
