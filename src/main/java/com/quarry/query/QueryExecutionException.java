package com.quarry.query;

import com.quarry.domain.StorageKey;

/**
 * Exception thrown when a query round trip to the store fails
 * Provides context about which storage failed and the statement sent
 */
public class QueryExecutionException extends RuntimeException {

    private final StorageKey storage;
    private final String sql;

    public QueryExecutionException(String message, StorageKey storage) {
        super(message);
        this.storage = storage;
        this.sql = null;
    }

    public QueryExecutionException(String message, StorageKey storage, Throwable cause) {
        super(message, cause);
        this.storage = storage;
        this.sql = null;
    }

    public QueryExecutionException(String message, StorageKey storage, String sql, Throwable cause) {
        super(message, cause);
        this.storage = storage;
        this.sql = sql;
    }

    public StorageKey getStorage() {
        return storage;
    }

    public String getSql() {
        return sql;
    }

    @Override
    public String getMessage() {
        StringBuilder sb = new StringBuilder(super.getMessage());
        if (storage != null) {
            sb.append(" [Storage: ").append(storage.getValue()).append("]");
        }
        if (sql != null) {
            sb.append(" [SQL: ").append(sql).append("]");
        }
        return sb.toString();
    }
}
