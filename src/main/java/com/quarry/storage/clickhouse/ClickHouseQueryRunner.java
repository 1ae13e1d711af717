package com.quarry.storage.clickhouse;

import com.quarry.domain.QueryResult;
import com.quarry.domain.StorageKey;
import com.quarry.query.QueryExecutionException;
import com.quarry.query.QueryMetrics;
import com.quarry.query.Request;
import com.quarry.query.plan.QueryRunner;
import com.quarry.storage.ReadableStorage;
import com.quarry.storage.StorageRegistry;
import com.quarry.util.DateTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;
import org.springframework.stereotype.Component;

import java.sql.ResultSetMetaData;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Runs one processed request against ClickHouse: a single round trip, blocking.
 */
@Component
public class ClickHouseQueryRunner implements QueryRunner {

    private static final Logger log = LoggerFactory.getLogger(ClickHouseQueryRunner.class);

    private final JdbcTemplate clickHouseTemplate;
    private final ClickHouseQueryFormatter formatter;
    private final StorageRegistry storageRegistry;

    @Autowired
    QueryMetrics metrics;

    public ClickHouseQueryRunner(@Qualifier("clickHouseJdbcTemplate") JdbcTemplate clickHouseTemplate,
                                 ClickHouseQueryFormatter formatter,
                                 StorageRegistry storageRegistry) {
        this.clickHouseTemplate = clickHouseTemplate;
        this.formatter = formatter;
        this.storageRegistry = storageRegistry;
    }

    @Override
    public QueryResult run(Request request) {
        String sql = formatter.format(request.getQuery());
        StorageKey storage = storageRegistry.findByDataSource(request.getQuery().getDataSource())
            .map(ReadableStorage::getKey)
            .orElse(null);

        log.debug("Executing ClickHouse query: {}", sql);
        long startTime = System.currentTimeMillis();

        List<Map<String, Object>> rows;
        try {
            rows = clickHouseTemplate.query(sql, rowExtractor());
        } catch (DataAccessException e) {
            metrics.recordRoundTripError();
            log.error("ClickHouse query execution failed: {}", e.getMessage(), e);
            throw new QueryExecutionException("ClickHouse query execution failed: " + e.getMessage(), storage, sql, e);
        }

        long executionTime = System.currentTimeMillis() - startTime;
        metrics.recordRoundTrip(executionTime);

        QueryResult result = new QueryResult(rows != null ? rows : new ArrayList<>(), storage);
        result.setSql(sql);
        result.setExecutionTimeMs(executionTime);

        log.debug("ClickHouse query completed in {}ms, returned {} rows", executionTime, result.getTotalCount());
        return result;
    }

    /**
     * Rows keyed by column label, in column order
     */
    static ResultSetExtractor<List<Map<String, Object>>> rowExtractor() {
        return rs -> {
            List<Map<String, Object>> rows = new ArrayList<>();
            ResultSetMetaData metaData = rs.getMetaData();
            int columnCount = metaData.getColumnCount();

            while (rs.next()) {
                Map<String, Object> row = new LinkedHashMap<>();
                for (int i = 1; i <= columnCount; i++) {
                    Object value = rs.getObject(i);

                    // Handle special types
                    if (value instanceof java.sql.Timestamp) {
                        value = DateTimes.format(((java.sql.Timestamp) value).toInstant());
                    } else if (value instanceof LocalDateTime) {
                        // DateTime columns are stored in UTC
                        value = DateTimes.format(((LocalDateTime) value).toInstant(ZoneOffset.UTC));
                    } else if (value instanceof OffsetDateTime) {
                        value = DateTimes.format(((OffsetDateTime) value).toInstant());
                    } else if (value instanceof java.sql.Date) {
                        value = ((java.sql.Date) value).toLocalDate().toString();
                    } else if (value instanceof java.sql.Array) {
                        value = ((java.sql.Array) value).getArray();
                    }

                    row.put(metaData.getColumnLabel(i), value);
                }
                rows.add(row);
            }
            return rows;
        };
    }
}
