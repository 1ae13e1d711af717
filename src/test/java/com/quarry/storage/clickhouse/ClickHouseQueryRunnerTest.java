package com.quarry.storage.clickhouse;

import com.quarry.domain.QueryResult;
import com.quarry.domain.StorageKey;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.QueryExecutionException;
import com.quarry.query.QueryMetrics;
import com.quarry.query.Request;
import com.quarry.storage.ColumnSet;
import com.quarry.storage.StorageRegistry;
import com.quarry.storage.TableSchema;
import com.quarry.storage.TableStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.jdbc.BadSqlGrammarException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.ResultSetExtractor;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("ClickHouseQueryRunner Tests")
class ClickHouseQueryRunnerTest {

    private static final String SQL = "SELECT event_id FROM sentry_dist WHERE deleted = 0 LIMIT 1";

    @Mock
    private JdbcTemplate clickHouseTemplate;

    @Mock
    private QueryMetrics metrics;

    private ClickHouseQueryRunner runner;

    @BeforeEach
    void setUp() {
        TableSchema schema = new TableSchema("sentry_local", "sentry_dist",
            ColumnSet.builder().column("event_id", "String").column("deleted", "UInt8").build(),
            List.of(), List.of());
        StorageRegistry registry = new StorageRegistry(List.of(new TableStorage(StorageKey.EVENTS, schema, List.of())));
        runner = new ClickHouseQueryRunner(clickHouseTemplate, new ClickHouseQueryFormatter(), registry);
        runner.metrics = metrics;
    }

    private static Request eventsRequest() {
        Query query = new Query();
        query.setDataSource("sentry_dist");
        query.setSelectedColumns(List.of("event_id"));
        query.addCondition(new ComparisonExpression("deleted", "=", 0));
        query.setLimit(1);
        return new Request(query);
    }

    @Test
    @DisplayName("Should run the formatted SQL and wrap the rows")
    @SuppressWarnings("unchecked")
    void shouldRunFormattedSql() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("event_id", "abc");
        List<Map<String, Object>> rows = new ArrayList<>();
        rows.add(row);
        when(clickHouseTemplate.query(eq(SQL), any(ResultSetExtractor.class))).thenReturn(rows);

        QueryResult result = runner.run(eventsRequest());

        assertThat(result.getRows()).containsExactly(row);
        assertThat(result.getTotalCount()).isEqualTo(1);
        assertThat(result.getStorage()).isEqualTo(StorageKey.EVENTS);
        assertThat(result.getSql()).isEqualTo(SQL);
        verify(metrics).recordRoundTrip(anyLong());
        verify(metrics, never()).recordRoundTripError();
    }

    @Test
    @DisplayName("Should wrap store failures with the storage and statement")
    @SuppressWarnings("unchecked")
    void shouldWrapStoreFailure() {
        when(clickHouseTemplate.query(eq(SQL), any(ResultSetExtractor.class)))
            .thenThrow(new BadSqlGrammarException("query", SQL, new SQLException("Unknown column")));

        assertThatThrownBy(() -> runner.run(eventsRequest()))
            .isInstanceOf(QueryExecutionException.class)
            .hasMessageContaining("[Storage: events]")
            .hasMessageContaining("[SQL: " + SQL + "]")
            .hasCauseInstanceOf(BadSqlGrammarException.class);
        verify(metrics).recordRoundTripError();
        verify(metrics, never()).recordRoundTrip(anyLong());
    }

    @Test
    @DisplayName("Should map rows in column order with timestamps as ISO strings")
    void shouldExtractRows() throws SQLException {
        ResultSet resultSet = org.mockito.Mockito.mock(ResultSet.class);
        ResultSetMetaData metaData = org.mockito.Mockito.mock(ResultSetMetaData.class);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(2);
        when(metaData.getColumnLabel(1)).thenReturn("timestamp");
        when(metaData.getColumnLabel(2)).thenReturn("event_id");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn(Timestamp.from(Instant.parse("2020-01-01T10:00:00Z")));
        when(resultSet.getObject(2)).thenReturn("abc");

        List<Map<String, Object>> rows = ClickHouseQueryRunner.rowExtractor().extractData(resultSet);

        assertThat(rows).hasSize(1);
        assertThat(rows.get(0)).containsExactly(
            Map.entry("timestamp", "2020-01-01T10:00:00"),
            Map.entry("event_id", "abc"));
    }

    @Test
    @DisplayName("Should render driver date-time values as UTC ISO strings")
    void shouldExtractJavaTimeValues() throws SQLException {
        ResultSet resultSet = org.mockito.Mockito.mock(ResultSet.class);
        ResultSetMetaData metaData = org.mockito.Mockito.mock(ResultSetMetaData.class);
        when(resultSet.getMetaData()).thenReturn(metaData);
        when(metaData.getColumnCount()).thenReturn(2);
        when(metaData.getColumnLabel(1)).thenReturn("timestamp");
        when(metaData.getColumnLabel(2)).thenReturn("received");
        when(resultSet.next()).thenReturn(true, false);
        when(resultSet.getObject(1)).thenReturn(LocalDateTime.of(2020, 1, 9, 23, 15, 30));
        when(resultSet.getObject(2)).thenReturn(
            OffsetDateTime.of(2020, 1, 10, 1, 0, 0, 0, ZoneOffset.ofHours(2)));

        List<Map<String, Object>> rows = ClickHouseQueryRunner.rowExtractor().extractData(resultSet);

        assertThat(rows.get(0)).containsExactly(
            Map.entry("timestamp", "2020-01-09T23:15:30"),
            Map.entry("received", "2020-01-09T23:00:00"));
    }
}
