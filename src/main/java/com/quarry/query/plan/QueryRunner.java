package com.quarry.query.plan;

import com.quarry.domain.QueryResult;
import com.quarry.query.Request;

/**
 * Sends one request to the store and returns its rows.
 *
 * Implementations may mutate the request they receive. Callers that need the
 * request afterwards pass a copy.
 */
@FunctionalInterface
public interface QueryRunner {

    QueryResult run(Request request);
}
