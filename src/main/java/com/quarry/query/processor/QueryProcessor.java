package com.quarry.query.processor;

import com.quarry.query.Query;
import com.quarry.query.RequestSettings;

/**
 * Transformation applied to a query after storage selection and before execution.
 * Processors run in the order the plan lists them.
 */
@FunctionalInterface
public interface QueryProcessor {

    void processQuery(Query query, RequestSettings settings);
}
