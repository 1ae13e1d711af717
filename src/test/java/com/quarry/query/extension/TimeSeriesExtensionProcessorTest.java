package com.quarry.query.extension;

import com.quarry.config.RuntimeConfig;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.Request;
import com.quarry.query.RequestSettings;
import com.quarry.query.split.TimeSplitQueryStrategy;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TimeSeriesExtensionProcessor Tests")
class TimeSeriesExtensionProcessorTest {

    private Map<String, String> settings;
    private TimeSeriesExtensionProcessor processor;

    @BeforeEach
    void setUp() {
        settings = new HashMap<>();
        RuntimeConfig config = settings::get;
        Clock clock = Clock.fixed(Instant.parse("2020-01-10T12:34:56Z"), ZoneOffset.UTC);
        processor = new TimeSeriesExtensionProcessor("timestamp", Duration.ofDays(5), config, clock);
    }

    private static Request requestWith(Map<String, Object> timeseries) {
        Map<String, Map<String, Object>> extensions = new LinkedHashMap<>();
        if (timeseries != null) {
            extensions.put(Request.TIMESERIES, timeseries);
        }
        return new Request(new Query(), extensions, RequestSettings.defaults());
    }

    @Test
    @DisplayName("Should default to the window ending now")
    void shouldDefaultToWindowEndingNow() {
        Request request = requestWith(null);

        processor.process(request);

        assertThat(request.getQuery().getConditions()).containsExactly(
            new ComparisonExpression("timestamp", ComparisonExpression.GTE, "2020-01-05T12:34:56"),
            new ComparisonExpression("timestamp", ComparisonExpression.LT, "2020-01-10T12:34:56"));
        assertThat(request.getExtension(Request.TIMESERIES))
            .containsEntry(Request.FROM_DATE, "2020-01-05T12:34:56")
            .containsEntry(Request.TO_DATE, "2020-01-10T12:34:56");
    }

    @Test
    @DisplayName("Should align explicit bounds and write them back")
    void shouldAlignAndWriteBack() {
        settings.put(TimeSplitQueryStrategy.DATE_ALIGN_SECONDS, "3600");
        Map<String, Object> timeseries = new LinkedHashMap<>();
        timeseries.put(Request.FROM_DATE, "2020-01-01 10:15:00");
        timeseries.put(Request.TO_DATE, "2020-01-02T11:59:59");
        Request request = requestWith(timeseries);

        processor.process(request);

        assertThat(request.getExtension(Request.TIMESERIES))
            .containsEntry(Request.FROM_DATE, "2020-01-01T10:00:00")
            .containsEntry(Request.TO_DATE, "2020-01-02T11:00:00");
        assertThat(request.getQuery().findConditionValue("timestamp", ComparisonExpression.LT))
            .contains("2020-01-02T11:00:00");
    }

    @Test
    @DisplayName("Should replace existing bounds instead of adding more")
    void shouldReplaceExistingConditions() {
        Map<String, Object> timeseries = new LinkedHashMap<>();
        timeseries.put(Request.FROM_DATE, "2020-01-01T00:00:00");
        timeseries.put(Request.TO_DATE, "2020-01-02T00:00:00");
        Request request = requestWith(timeseries);
        request.getQuery().setConditions(List.of(
            new ComparisonExpression("timestamp", ComparisonExpression.GTE, "2019-01-01T00:00:00")));

        processor.process(request);

        assertThat(request.getQuery().getConditions()).containsExactly(
            new ComparisonExpression("timestamp", ComparisonExpression.GTE, "2020-01-01T00:00:00"),
            new ComparisonExpression("timestamp", ComparisonExpression.LT, "2020-01-02T00:00:00"));
    }

    @Test
    @DisplayName("Should reject an inverted range")
    void shouldRejectInvertedRange() {
        Map<String, Object> timeseries = new LinkedHashMap<>();
        timeseries.put(Request.FROM_DATE, "2020-01-03T00:00:00");
        timeseries.put(Request.TO_DATE, "2020-01-02T00:00:00");

        assertThatThrownBy(() -> processor.process(requestWith(timeseries)))
            .isInstanceOf(IllegalArgumentException.class)
            .hasMessageContaining("after");
    }
}
