package com.quarry.query;

import java.util.Objects;

/**
 * Represents an aggregation function over one column
 */
public final class Aggregation {
    private final String function;
    private final String column;
    private final String alias;

    public Aggregation(String function, String column, String alias) {
        this.function = Objects.requireNonNull(function, "function");
        this.column = column;
        this.alias = alias;
    }

    public String getFunction() {
        return function;
    }

    /**
     * Column the function reads, null for functions like count()
     */
    public String getColumn() {
        return column;
    }

    public String getAlias() {
        if (alias != null) {
            return alias;
        }
        return column != null ? function + "_" + column : function;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Aggregation)) {
            return false;
        }
        Aggregation that = (Aggregation) o;
        return function.equals(that.function) && Objects.equals(column, that.column)
            && Objects.equals(alias, that.alias);
    }

    @Override
    public int hashCode() {
        return Objects.hash(function, column, alias);
    }
}
