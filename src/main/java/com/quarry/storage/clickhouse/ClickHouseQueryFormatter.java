package com.quarry.storage.clickhouse;

import com.quarry.query.Aggregation;
import com.quarry.query.BinaryExpression;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Expression;
import com.quarry.query.Query;
import com.quarry.query.SortField;
import com.quarry.util.DateTimes;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Renders a processed {@link Query} as ClickHouse SQL
 *
 * String literals that hold a date-time are sent as {@code toDateTime(..., 'UTC')}
 * so they compare against DateTime columns regardless of the server time zone.
 */
@Component
public class ClickHouseQueryFormatter {

    private static final Pattern SIMPLE_IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern DATE_TIME_LITERAL = Pattern.compile("\\d{4}-\\d{2}-\\d{2}[T ]\\d{2}:\\d{2}:\\d{2}.*");

    /**
     * Format the query to SQL
     *
     * @throws IllegalArgumentException if the query has no data source
     */
    public String format(Query query) {
        if (query.getDataSource() == null) {
            throw new IllegalArgumentException("Query has no data source, was a plan built for it?");
        }
        StringBuilder sql = new StringBuilder();

        // SELECT clause
        sql.append("SELECT ").append(buildSelectClause(query));

        // FROM clause
        sql.append(" FROM ").append(query.getDataSource());

        // PREWHERE clause
        if (!query.getPrewhere().isEmpty()) {
            sql.append(" PREWHERE ").append(buildConjunction(query.getPrewhere()));
        }

        // WHERE clause
        if (!query.getConditions().isEmpty()) {
            sql.append(" WHERE ").append(buildConjunction(query.getConditions()));
        }

        // GROUP BY clause
        if (query.hasGroupBy()) {
            List<String> groupBy = new ArrayList<>();
            for (String column : query.getGroupBy()) {
                groupBy.add(escapeIdentifier(column));
            }
            sql.append(" GROUP BY ").append(String.join(", ", groupBy));
        }

        // ORDER BY clause
        if (!query.getOrderBy().isEmpty()) {
            List<String> orderBy = new ArrayList<>();
            for (SortField sortField : query.getOrderBy()) {
                orderBy.add(escapeIdentifier(sortField.getField()) + (sortField.isAscending() ? " ASC" : " DESC"));
            }
            sql.append(" ORDER BY ").append(String.join(", ", orderBy));
        }

        // LIMIT clause
        if (query.getLimit() != null) {
            sql.append(" LIMIT ").append(query.getLimit());
            if (query.getOffset() > 0) {
                sql.append(" OFFSET ").append(query.getOffset());
            }
        }

        return sql.toString();
    }

    private String buildSelectClause(Query query) {
        List<String> select = new ArrayList<>();
        for (String column : query.getGroupBy()) {
            if (query.getSelectedColumns() == null || !query.getSelectedColumns().contains(column)) {
                select.add(escapeIdentifier(column));
            }
        }
        if (query.getSelectedColumns() != null) {
            for (String column : query.getSelectedColumns()) {
                select.add(escapeIdentifier(column));
            }
        }
        for (Aggregation aggregation : query.getAggregations()) {
            String argument = aggregation.getColumn() != null ? escapeIdentifier(aggregation.getColumn()) : "";
            select.add(aggregation.getFunction() + "(" + argument + ") AS " + escapeIdentifier(aggregation.getAlias()));
        }
        return select.isEmpty() ? "*" : String.join(", ", select);
    }

    private String buildConjunction(List<Expression> conditions) {
        List<String> parts = new ArrayList<>();
        for (Expression condition : conditions) {
            parts.add(buildExpressionSql(condition));
        }
        return String.join(" AND ", parts);
    }

    /**
     * Build SQL expression from the condition tree
     */
    String buildExpressionSql(Expression expression) {
        if (expression instanceof BinaryExpression) {
            BinaryExpression binary = (BinaryExpression) expression;
            return "(" + buildExpressionSql(binary.getLeft()) + " " + binary.getOperator() + " "
                + buildExpressionSql(binary.getRight()) + ")";
        } else if (expression instanceof ComparisonExpression) {
            return buildComparisonSql((ComparisonExpression) expression);
        }
        throw new IllegalArgumentException("Unsupported expression: " + expression);
    }

    private String buildComparisonSql(ComparisonExpression comparison) {
        String field = escapeIdentifier(comparison.getField());
        String operator = comparison.getOperator().toUpperCase();
        Object value = comparison.getValue();

        if (value instanceof Collection) {
            Collection<?> values = (Collection<?>) value;
            if (values.isEmpty()) {
                // IN () is not valid SQL
                return "NOT IN".equals(operator) ? "1" : "0";
            }
            List<String> literals = new ArrayList<>();
            for (Object item : values) {
                literals.add(formatLiteral(item));
            }
            return field + " " + operator + " (" + String.join(", ", literals) + ")";
        }
        if (value == null) {
            if ("=".equals(operator)) {
                return "isNull(" + field + ")";
            } else if ("!=".equals(operator)) {
                return "isNotNull(" + field + ")";
            }
        }
        return field + " " + operator + " " + formatLiteral(value);
    }

    String formatLiteral(Object value) {
        if (value == null) {
            return "NULL";
        } else if (value instanceof Number) {
            return value.toString();
        } else if (value instanceof Boolean) {
            return (Boolean) value ? "1" : "0";
        } else if (value instanceof Instant) {
            return toDateTime((Instant) value);
        }
        String text = value.toString();
        if (DATE_TIME_LITERAL.matcher(text).matches()) {
            Optional<Instant> instant = DateTimes.tryParse(text);
            if (instant.isPresent()) {
                return toDateTime(instant.get());
            }
        }
        return "'" + text.replace("\\", "\\\\").replace("'", "\\'") + "'";
    }

    private static String toDateTime(Instant instant) {
        return "toDateTime('" + DateTimes.formatSql(instant) + "', 'UTC')";
    }

    static String escapeIdentifier(String identifier) {
        if (SIMPLE_IDENTIFIER.matcher(identifier).matches()) {
            return identifier;
        }
        return "`" + identifier.replace("`", "\\`") + "`";
    }
}
