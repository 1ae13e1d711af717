package com.quarry.query;

import java.util.Set;

/**
 * A node of a query's condition tree.
 * Implementations are immutable, so condition lists can be shared between query copies.
 */
public interface Expression {

    /**
     * Add every column this expression reads to {@code columns}
     */
    void collectColumns(Set<String> columns);
}
