package com.quarry.query.split;

import com.quarry.config.RuntimeConfig;
import com.quarry.domain.QueryResult;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.QueryExecutionException;
import com.quarry.query.Request;
import com.quarry.query.plan.QueryRunner;
import com.quarry.util.DateTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Answers a wide-projection query in two round trips.
 *
 * The first selects only id, project and timestamp to find the matching rows while
 * reading as little data as possible. The second selects every requested column for
 * exactly those ids, over the time span the candidates occupy.
 */
public class ColumnSplitQueryStrategy implements QuerySplitStrategy {

    private static final Logger log = LoggerFactory.getLogger(ColumnSplitQueryStrategy.class);

    /**
     * Timestamp granularity of the store. The upper bound is exclusive, so the narrowed
     * range ends one unit after the newest candidate.
     */
    public static final String TIMESTAMP_GRANULARITY_SECONDS = "timestamp_granularity_seconds";

    private final ColumnSplitSpec splitSpec;
    private final RuntimeConfig config;

    public ColumnSplitQueryStrategy(ColumnSplitSpec splitSpec, RuntimeConfig config) {
        this.splitSpec = splitSpec;
        this.config = config;
    }

    @Override
    public String getName() {
        return "column";
    }

    @Override
    public boolean canExecute(Request request) {
        Query query = request.getQuery();
        if (!SplitPredicates.isQuerySplittable(query, config)) {
            return false;
        }
        List<String> selected = query.getSelectedColumns();
        if (selected == null || selected.isEmpty() || query.hasAggregations()) {
            return false;
        }

        int totalColumnCount = query.getAllReferencedColumns().size();
        Query minimalQuery = query.copy();
        minimalQuery.setSelectedColumns(splitSpec.getMinColumns());
        int minColumnCount = minimalQuery.getAllReferencedColumns().size();
        return totalColumnCount > minColumnCount;
    }

    @Override
    public QueryResult split(Request request, QueryRunner runner) {
        Request minimalRequest = request.copy();
        minimalRequest.getQuery().setSelectedColumns(splitSpec.getMinColumns());
        QueryResult minimalResult = runner.run(minimalRequest);

        List<Map<String, Object>> candidates = minimalResult.getRows();
        if (candidates.isEmpty()) {
            log.debug("Column split found no candidate rows, skipping the full projection");
            return minimalResult;
        }

        Request fullRequest = request.copy();
        Query fullQuery = fullRequest.getQuery();

        List<Object> ids = distinctValues(candidates, splitSpec.getIdColumn());
        fullQuery.addCondition(new ComparisonExpression(splitSpec.getIdColumn(), ComparisonExpression.IN, ids));
        fullQuery.setOffset(0);
        fullQuery.setLimit(ids.size());

        List<Object> projects = distinctValues(candidates, splitSpec.getProjectColumn());
        fullQuery.replaceCondition(splitSpec.getProjectColumn(), ComparisonExpression.IN, projects);
        fullRequest.updateExtension(Request.PROJECT, Request.PROJECT, projects);

        narrowTimeRange(fullRequest, candidates);

        log.debug("Column split fetching {} rows across {} projects", ids.size(), projects.size());
        return runner.run(fullRequest);
    }

    private void narrowTimeRange(Request request, List<Map<String, Object>> candidates) {
        String timestampColumn = splitSpec.getTimestampColumn();
        Instant min = null;
        Instant max = null;
        for (Map<String, Object> row : candidates) {
            Instant timestamp = DateTimes.parse(requireValue(row, timestampColumn));
            if (min == null || timestamp.isBefore(min)) {
                min = timestamp;
            }
            if (max == null || timestamp.isAfter(max)) {
                max = timestamp;
            }
        }

        int granularity = config.getInt(TIMESTAMP_GRANULARITY_SECONDS, 1);
        String from = DateTimes.format(min);
        String to = DateTimes.format(max.plusSeconds(granularity));
        request.getQuery().replaceCondition(timestampColumn, ComparisonExpression.GTE, from);
        request.getQuery().replaceCondition(timestampColumn, ComparisonExpression.LT, to);
        request.updateExtension(Request.TIMESERIES, Request.FROM_DATE, from);
        request.updateExtension(Request.TIMESERIES, Request.TO_DATE, to);
    }

    private static List<Object> distinctValues(List<Map<String, Object>> rows, String column) {
        Set<Object> values = new LinkedHashSet<>();
        for (Map<String, Object> row : rows) {
            values.add(requireValue(row, column));
        }
        return new ArrayList<>(values);
    }

    private static Object requireValue(Map<String, Object> row, String column) {
        Object value = row.get(column);
        if (value == null) {
            throw new QueryExecutionException("Minimal projection row has no value for " + column, null);
        }
        return value;
    }
}
