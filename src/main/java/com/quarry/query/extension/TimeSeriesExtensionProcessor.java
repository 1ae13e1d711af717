package com.quarry.query.extension;

import com.quarry.config.RuntimeConfig;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.Request;
import com.quarry.query.split.TimeSplitQueryStrategy;
import com.quarry.util.DateTimes;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;

/**
 * Applies the {@code timeseries} extension: a {@code [from_date, to_date)} range on the
 * timestamp column, defaulting to the last {@code defaultWindow}.
 *
 * Both bounds are aligned down to {@code date_align_seconds} and written back to the
 * extension so later rewrites start from the same values the conditions hold.
 */
public class TimeSeriesExtensionProcessor implements ExtensionProcessor {

    private final String timestampColumn;
    private final Duration defaultWindow;
    private final RuntimeConfig config;
    private final Clock clock;

    public TimeSeriesExtensionProcessor(String timestampColumn, Duration defaultWindow,
                                        RuntimeConfig config, Clock clock) {
        this.timestampColumn = timestampColumn;
        this.defaultWindow = defaultWindow;
        this.config = config;
        this.clock = clock;
    }

    @Override
    public void process(Request request) {
        int dateAlign = config.getInt(TimeSplitQueryStrategy.DATE_ALIGN_SECONDS, 1);
        Map<String, Object> extension = request.getExtension(Request.TIMESERIES);

        Instant now = clock.instant();
        Object toValue = extension.get(Request.TO_DATE);
        Object fromValue = extension.get(Request.FROM_DATE);
        Instant toDate = DateTimes.parse(toValue != null ? toValue : now, dateAlign);
        Instant fromDate = DateTimes.parse(fromValue != null ? fromValue : now.minus(defaultWindow), dateAlign);
        if (fromDate.isAfter(toDate)) {
            throw new IllegalArgumentException("from_date " + fromDate + " is after to_date " + toDate);
        }

        String from = DateTimes.format(fromDate);
        String to = DateTimes.format(toDate);
        extension.put(Request.FROM_DATE, from);
        extension.put(Request.TO_DATE, to);

        Query query = request.getQuery();
        setCondition(query, ComparisonExpression.GTE, from);
        setCondition(query, ComparisonExpression.LT, to);
    }

    private void setCondition(Query query, String operator, String value) {
        if (query.replaceCondition(timestampColumn, operator, value) == 0) {
            query.addCondition(new ComparisonExpression(timestampColumn, operator, value));
        }
    }
}
