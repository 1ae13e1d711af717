package com.quarry.query.split;

import com.quarry.config.RuntimeConfig;
import com.quarry.query.Query;

/**
 * Preconditions shared by every split algorithm
 */
public final class SplitPredicates {

    public static final String USE_SPLIT = "use_split";

    private SplitPredicates() {
        throw new UnsupportedOperationException("SplitPredicates is a utility class and cannot be instantiated");
    }

    /**
     * Splitting is switched on, the query pages with a positive limit and does not group.
     * Partial aggregates cannot be concatenated, so grouped queries never split.
     */
    public static boolean isQuerySplittable(Query query, RuntimeConfig config) {
        return config.getInt(USE_SPLIT, 0) > 0
            && query.getLimitOrZero() > 0
            && !query.hasGroupBy();
    }
}
