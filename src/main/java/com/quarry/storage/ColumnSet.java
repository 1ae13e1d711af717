package com.quarry.storage;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Ordered set of physical columns with their ClickHouse types
 */
public final class ColumnSet {

    private final Map<String, String> columns;

    private ColumnSet(Map<String, String> columns) {
        this.columns = Collections.unmodifiableMap(columns);
    }

    public static Builder builder() {
        return new Builder();
    }

    public boolean contains(String column) {
        return columns.containsKey(column);
    }

    /**
     * ClickHouse type of {@code column}, null when absent
     */
    public String getType(String column) {
        return columns.get(column);
    }

    public Set<String> getColumnNames() {
        return columns.keySet();
    }

    public int size() {
        return columns.size();
    }

    @Override
    public boolean equals(Object o) {
        return this == o || (o instanceof ColumnSet && columns.equals(((ColumnSet) o).columns));
    }

    @Override
    public int hashCode() {
        return Objects.hash(columns);
    }

    public static final class Builder {
        private final Map<String, String> columns = new LinkedHashMap<>();

        public Builder column(String name, String type) {
            if (columns.put(name, type) != null) {
                throw new IllegalArgumentException("Duplicate column: " + name);
            }
            return this;
        }

        public Builder columns(ColumnSet other) {
            for (String name : other.getColumnNames()) {
                column(name, other.getType(name));
            }
            return this;
        }

        public ColumnSet build() {
            return new ColumnSet(new LinkedHashMap<>(columns));
        }
    }
}
