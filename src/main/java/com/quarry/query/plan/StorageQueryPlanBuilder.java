package com.quarry.query.plan;

import com.quarry.query.Request;

/**
 * Maps a logical request to the storage it reads and the plan that executes it.
 * Plans are built per request and never reused.
 */
public interface StorageQueryPlanBuilder {

    StorageQueryPlan buildPlan(Request request);
}
