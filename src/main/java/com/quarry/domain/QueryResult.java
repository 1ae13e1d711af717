package com.quarry.domain;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Response envelope for one query against the store.
 * Rows keep the order in which the store returned them.
 */
public class QueryResult {

    @JsonProperty("rows")
    private List<Map<String, Object>> rows;

    @JsonProperty("total_count")
    private long totalCount;

    @JsonProperty("storage")
    private StorageKey storage;

    @JsonProperty("sql")
    private String sql;

    @JsonProperty("execution_time_ms")
    private long executionTimeMs;

    /**
     * Default constructor
     */
    public QueryResult() {
        this.rows = new ArrayList<>();
    }

    /**
     * Constructor with rows
     */
    public QueryResult(List<Map<String, Object>> rows) {
        this.rows = rows != null ? new ArrayList<>(rows) : new ArrayList<>();
        this.totalCount = this.rows.size();
    }

    /**
     * Constructor with rows and the storage they were read from
     */
    public QueryResult(List<Map<String, Object>> rows, StorageKey storage) {
        this(rows);
        this.storage = storage;
    }

    public List<Map<String, Object>> getRows() {
        return rows;
    }

    public void setRows(List<Map<String, Object>> rows) {
        this.rows = rows;
        this.totalCount = rows.size();
    }

    public long getTotalCount() {
        return totalCount;
    }

    public void setTotalCount(long totalCount) {
        this.totalCount = totalCount;
    }

    public StorageKey getStorage() {
        return storage;
    }

    public void setStorage(StorageKey storage) {
        this.storage = storage;
    }

    public String getSql() {
        return sql;
    }

    public void setSql(String sql) {
        this.sql = sql;
    }

    public long getExecutionTimeMs() {
        return executionTimeMs;
    }

    public void setExecutionTimeMs(long executionTimeMs) {
        this.executionTimeMs = executionTimeMs;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    /**
     * Add all rows from another result, after the rows already held
     */
    public void addAll(List<Map<String, Object>> moreRows) {
        this.rows.addAll(moreRows);
        this.totalCount = this.rows.size();
    }

    /**
     * Drop the first {@code count} rows
     */
    public void dropFirst(int count) {
        this.rows = new ArrayList<>(rows.subList(count, rows.size()));
        this.totalCount = this.rows.size();
    }
}
