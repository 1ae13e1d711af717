package com.quarry.query;

import java.util.Objects;

/**
 * Represents a sort field with order.
 * The textual form is the column name, prefixed with {@code -} for descending order.
 */
public final class SortField {
    private final String field;
    private final boolean ascending;

    public SortField(String field, boolean ascending) {
        this.field = Objects.requireNonNull(field, "field");
        this.ascending = ascending;
    }

    public static SortField asc(String field) {
        return new SortField(field, true);
    }

    public static SortField desc(String field) {
        return new SortField(field, false);
    }

    /**
     * Parse {@code "timestamp"} or {@code "-timestamp"}
     */
    public static SortField parse(String expression) {
        if (expression.startsWith("-")) {
            return desc(expression.substring(1));
        }
        return asc(expression);
    }

    public String getField() {
        return field;
    }

    public boolean isAscending() {
        return ascending;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof SortField)) {
            return false;
        }
        SortField that = (SortField) o;
        return ascending == that.ascending && field.equals(that.field);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, ascending);
    }

    @Override
    public String toString() {
        return ascending ? field : "-" + field;
    }
}
