package com.quarry.query.split;

import com.quarry.config.RuntimeConfig;
import com.quarry.domain.QueryResult;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.Request;
import com.quarry.query.SortField;
import com.quarry.query.plan.QueryRunner;
import com.quarry.util.DateTimes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Breaks the time range of a {@code timestamp DESC} query into windows and runs them
 * newest first, stopping as soon as enough rows are collected.
 *
 * Sorting the whole range to return a small page at its recent end is the expensive
 * part of such a query, and recent windows are the likeliest to hold the page.
 * Windows widen as the probe goes back: tenfold after an empty probe, otherwise by
 * the factor the last probe's row density says is needed for the remainder.
 */
public class TimeSplitQueryStrategy implements QuerySplitStrategy {

    private static final Logger log = LoggerFactory.getLogger(TimeSplitQueryStrategy.class);

    public static final String SPLIT_STEP = "split_step";
    public static final String DATE_ALIGN_SECONDS = "date_align_seconds";

    /**
     * Window growth after a probe returns nothing. From a one hour start the worst case is
     * 1+10+100+1000 hours, past a 90 day retention in four round trips.
     */
    static final int STEP_GROWTH = 10;

    /**
     * Deeper offsets gain nothing from splitting
     */
    static final int MAX_OFFSET = 1000;

    private static final int DEFAULT_SPLIT_STEP_SECONDS = 3600;

    private final String timestampColumn;
    private final RuntimeConfig config;

    public TimeSplitQueryStrategy(String timestampColumn, RuntimeConfig config) {
        this.timestampColumn = timestampColumn;
        this.config = config;
    }

    @Override
    public String getName() {
        return "time";
    }

    @Override
    public boolean canExecute(Request request) {
        Query query = request.getQuery();
        List<SortField> orderBy = query.getOrderBy();
        return SplitPredicates.isQuerySplittable(query, config)
            && query.hasCondition(timestampColumn, ComparisonExpression.GTE)
            && query.hasCondition(timestampColumn, ComparisonExpression.LT)
            && !orderBy.isEmpty()
            && orderBy.get(0).equals(SortField.desc(timestampColumn))
            && query.getOffset() < MAX_OFFSET;
    }

    @Override
    public QueryResult split(Request request, QueryRunner runner) {
        int dateAlign = config.getInt(DATE_ALIGN_SECONDS, 1);
        long splitStep = config.getLong(SPLIT_STEP, DEFAULT_SPLIT_STEP_SECONDS);
        if (splitStep <= 0) {
            throw new IllegalArgumentException("split_step must be positive, got " + splitStep);
        }

        Query query = request.getQuery();
        int limit = query.getLimitOrZero();
        int remainingOffset = query.getOffset();
        Instant fromDate = DateTimes.parse(
            query.findConditionValue(timestampColumn, ComparisonExpression.GTE).orElseThrow(), dateAlign);
        Instant toDate = DateTimes.parse(
            query.findConditionValue(timestampColumn, ComparisonExpression.LT).orElseThrow(), dateAlign);

        QueryResult overallResult = null;
        Instant splitEnd = toDate;
        Instant splitStart = windowStart(splitEnd, splitStep, fromDate);
        int totalResults = 0;
        int roundTrips = 0;

        while (splitStart.isBefore(splitEnd) && totalResults < limit) {
            // the runner may mutate what it gets, so every window runs on a fresh copy
            Request splitRequest = request.copy();
            restrictTimeRange(splitRequest, splitStart, splitEnd);
            // paged: ask for limit + offset rows from offset 0 and trim here
            splitRequest.getQuery().setOffset(0);
            splitRequest.getQuery().setLimit(limit - totalResults + remainingOffset);

            log.debug("Time split window [{}, {}) limit={}", splitStart, splitEnd,
                splitRequest.getQuery().getLimit());
            QueryResult result = runner.run(splitRequest);
            roundTrips++;
            int returned = result.getRows().size();

            if (overallResult == null) {
                overallResult = newEnvelope(result);
            } else {
                overallResult.addAll(result.getRows());
                overallResult.setExecutionTimeMs(overallResult.getExecutionTimeMs() + result.getExecutionTimeMs());
            }

            if (remainingOffset > 0 && !overallResult.isEmpty()) {
                int toTrim = Math.min(remainingOffset, overallResult.getRows().size());
                overallResult.dropFirst(toTrim);
                remainingOffset -= toTrim;
            }

            totalResults = overallResult.getRows().size();

            if (totalResults < limit) {
                splitStep = nextStep(splitStep, returned, limit - totalResults);
                splitEnd = splitStart;
                splitStart = windowStart(splitEnd, splitStep, fromDate);
            }
        }

        log.debug("Time split collected {} rows in {} round trips", totalResults, roundTrips);
        return overallResult != null ? overallResult : new QueryResult();
    }

    private void restrictTimeRange(Request request, Instant start, Instant end) {
        String from = DateTimes.format(start);
        String to = DateTimes.format(end);
        request.getQuery().replaceCondition(timestampColumn, ComparisonExpression.GTE, from);
        request.getQuery().replaceCondition(timestampColumn, ComparisonExpression.LT, to);
        request.updateExtension(Request.TIMESERIES, Request.FROM_DATE, from);
        request.updateExtension(Request.TIMESERIES, Request.TO_DATE, to);
    }

    /**
     * Window size for the next probe. Saturates instead of overflowing.
     */
    static long nextStep(long step, int returned, int remaining) {
        long factor = returned == 0
            ? STEP_GROWTH
            : (remaining + (long) returned - 1) / returned;
        try {
            return Math.multiplyExact(step, factor);
        } catch (ArithmeticException e) {
            return Long.MAX_VALUE;
        }
    }

    /**
     * {@code max(end - step, floor)}, with any overflow clamped to {@code floor}
     */
    static Instant windowStart(Instant end, long step, Instant floor) {
        try {
            Instant start = end.minusSeconds(step);
            return start.isBefore(floor) ? floor : start;
        } catch (DateTimeException | ArithmeticException e) {
            log.debug("Window of {}s before {} overflows, clamping to {}", step, end, floor);
            return floor;
        }
    }

    private static QueryResult newEnvelope(QueryResult first) {
        QueryResult envelope = new QueryResult(new ArrayList<>(first.getRows()), first.getStorage());
        envelope.setSql(first.getSql());
        envelope.setExecutionTimeMs(first.getExecutionTimeMs());
        return envelope;
    }
}
