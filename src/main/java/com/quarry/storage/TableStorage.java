package com.quarry.storage;

import com.quarry.domain.StorageKey;
import com.quarry.query.processor.QueryProcessor;

import java.util.List;
import java.util.Objects;

/**
 * Storage backed by a single ClickHouse table
 */
public class TableStorage implements ReadableStorage {

    private final StorageKey key;
    private final TableSchema readSchema;
    private final List<QueryProcessor> queryProcessors;

    public TableStorage(StorageKey key, TableSchema readSchema, List<QueryProcessor> queryProcessors) {
        this.key = Objects.requireNonNull(key, "key");
        this.readSchema = Objects.requireNonNull(readSchema, "readSchema");
        this.queryProcessors = List.copyOf(queryProcessors);
    }

    @Override
    public StorageKey getKey() {
        return key;
    }

    @Override
    public TableSchema getReadSchema() {
        return readSchema;
    }

    @Override
    public List<QueryProcessor> getQueryProcessors() {
        return queryProcessors;
    }

    @Override
    public String toString() {
        return "TableStorage{" + key.getValue() + " -> " + readSchema.getDataSource() + "}";
    }
}
