package com.quarry.storage.clickhouse;

import com.quarry.query.Aggregation;
import com.quarry.query.BinaryExpression;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.SortField;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for ClickHouseQueryFormatter
 */
class ClickHouseQueryFormatterTest {

    private ClickHouseQueryFormatter formatter;

    @BeforeEach
    void setUp() {
        formatter = new ClickHouseQueryFormatter();
    }

    @Test
    void testFullSelectQuery() {
        // Given: A processed events query with prewhere, paging and ordering
        Query query = new Query();
        query.setDataSource("sentry_dist");
        query.setSelectedColumns(List.of("event_id", "message"));
        query.setPrewhere(List.of(new ComparisonExpression("project_id", "IN", List.of(1L, 2L))));
        query.setConditions(List.of(
            new ComparisonExpression("timestamp", ">=", "2020-01-01T00:00:00"),
            new ComparisonExpression("timestamp", "<", "2020-01-02T00:00:00"),
            new ComparisonExpression("deleted", "=", 0)));
        query.setOrderBy(List.of(SortField.desc("timestamp")));
        query.setLimit(10);
        query.setOffset(5);

        // When
        String sql = formatter.format(query);

        // Then
        assertThat(sql).isEqualTo("SELECT event_id, message FROM sentry_dist"
            + " PREWHERE project_id IN (1, 2)"
            + " WHERE timestamp >= toDateTime('2020-01-01 00:00:00', 'UTC')"
            + " AND timestamp < toDateTime('2020-01-02 00:00:00', 'UTC')"
            + " AND deleted = 0"
            + " ORDER BY timestamp DESC LIMIT 10 OFFSET 5");
    }

    @Test
    void testAggregationWithGroupBy() {
        // Given: A grouped query with aggregations and no explicit projection
        Query query = new Query();
        query.setDataSource("sessions_hourly_dist");
        query.setGroupBy(List.of("project_id"));
        query.setAggregations(List.of(
            new Aggregation("count", null, "count"),
            new Aggregation("uniq", "user_id", null)));

        // When
        String sql = formatter.format(query);

        // Then: Group-by columns are selected ahead of the aggregations
        assertThat(sql).isEqualTo("SELECT project_id, count() AS count, uniq(user_id) AS uniq_user_id"
            + " FROM sessions_hourly_dist GROUP BY project_id");
    }

    @Test
    void testSelectAllWithoutProjection() {
        Query query = new Query();
        query.setDataSource("sentry_dist");
        query.setOrderBy(List.of(SortField.asc("event_id")));
        query.setLimit(3);

        assertThat(formatter.format(query)).isEqualTo("SELECT * FROM sentry_dist ORDER BY event_id ASC LIMIT 3");
    }

    @Test
    void testStringLiteralsAreEscaped() {
        assertThat(formatter.formatLiteral("it's a \\ path")).isEqualTo("'it\\'s a \\\\ path'");
        assertThat(formatter.formatLiteral("2020-01-01")).isEqualTo("'2020-01-01'");
    }

    @Test
    void testOtherLiterals() {
        assertThat(formatter.formatLiteral(null)).isEqualTo("NULL");
        assertThat(formatter.formatLiteral(true)).isEqualTo("1");
        assertThat(formatter.formatLiteral(42L)).isEqualTo("42");
        assertThat(formatter.formatLiteral(Instant.parse("2020-01-01T10:00:00Z")))
            .isEqualTo("toDateTime('2020-01-01 10:00:00', 'UTC')");
        assertThat(formatter.formatLiteral("2020-01-01 10:00:00"))
            .isEqualTo("toDateTime('2020-01-01 10:00:00', 'UTC')");
    }

    @Test
    void testNestedAndEmptyConditions() {
        Query query = new Query();
        query.setDataSource("sentry_dist");
        query.setConditions(List.of(
            BinaryExpression.or(
                new ComparisonExpression("level", "=", "error"),
                new ComparisonExpression("environment", "=", null)),
            new ComparisonExpression("event_id", "IN", List.of())));

        assertThat(formatter.format(query)).isEqualTo(
            "SELECT * FROM sentry_dist WHERE (level = 'error' OR isNull(environment)) AND 0");
    }

    @Test
    void testIdentifiersNeedingQuotesAreEscaped() {
        assertThat(ClickHouseQueryFormatter.escapeIdentifier("tags.key")).isEqualTo("tags.key");
        assertThat(ClickHouseQueryFormatter.escapeIdentifier("my col")).isEqualTo("`my col`");
    }

    @Test
    void testQueryWithoutDataSourceIsRejected() {
        assertThatThrownBy(() -> formatter.format(new Query()))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
