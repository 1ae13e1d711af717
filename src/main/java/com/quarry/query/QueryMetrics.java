package com.quarry.query;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Metrics collector for query execution
 * Tracks request outcomes and latency, store round trips per request
 * (more than one means the request was split) and result sizes
 */
@Component
public class QueryMetrics {

    @Autowired
    MeterRegistry meterRegistry;

    private Counter queriesExecuted;
    private Counter queriesFailed;
    private Counter roundTrips;
    private Counter roundTripErrors;
    private Timer queryExecutionLatency;
    private Timer roundTripLatency;
    private DistributionSummary resultSize;
    private DistributionSummary roundTripsPerQuery;

    @PostConstruct
    public void init() {
        queriesExecuted = Counter.builder("quarry.query.executed")
            .description("Total number of queries executed")
            .register(meterRegistry);

        queriesFailed = Counter.builder("quarry.query.failed")
            .description("Total number of queries that failed")
            .register(meterRegistry);

        roundTrips = Counter.builder("quarry.store.roundtrips")
            .description("Total number of round trips to the store")
            .register(meterRegistry);

        roundTripErrors = Counter.builder("quarry.store.errors")
            .description("Total number of failed round trips to the store")
            .register(meterRegistry);

        // Timers with histogram support for percentile calculation
        queryExecutionLatency = Timer.builder("quarry.query.execution.latency")
            .description("Latency of overall query execution, all round trips included")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(10))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        roundTripLatency = Timer.builder("quarry.store.roundtrip.latency")
            .description("Latency of a single round trip to the store")
            .publishPercentiles(0.5, 0.95, 0.99)
            .publishPercentileHistogram()
            .minimumExpectedValue(Duration.ofMillis(1))
            .maximumExpectedValue(Duration.ofSeconds(30))
            .register(meterRegistry);

        resultSize = DistributionSummary.builder("quarry.query.result.size")
            .description("Distribution of query result sizes (number of rows)")
            .baseUnit("rows")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);

        roundTripsPerQuery = DistributionSummary.builder("quarry.query.roundtrips")
            .description("Round trips to the store needed to answer one query")
            .baseUnit("roundtrips")
            .publishPercentiles(0.5, 0.95, 0.99)
            .register(meterRegistry);
    }

    public void recordQueryExecuted() {
        queriesExecuted.increment();
    }

    public void recordQueryFailed() {
        queriesFailed.increment();
    }

    public Timer.Sample startQueryTimer() {
        return Timer.start(meterRegistry);
    }

    public void recordQueryLatency(Timer.Sample sample) {
        sample.stop(queryExecutionLatency);
    }

    public void recordResultSize(long size) {
        resultSize.record(size);
    }

    public void recordRoundTripsPerQuery(int count) {
        roundTripsPerQuery.record(count);
    }

    public void recordRoundTrip(long durationMs) {
        roundTrips.increment();
        roundTripLatency.record(Duration.ofMillis(durationMs));
    }

    public void recordRoundTripError() {
        roundTripErrors.increment();
    }

    // Getter methods for testing
    public Counter getQueriesExecuted() {
        return queriesExecuted;
    }

    public Counter getQueriesFailed() {
        return queriesFailed;
    }

    public Counter getRoundTrips() {
        return roundTrips;
    }

    public Counter getRoundTripErrors() {
        return roundTripErrors;
    }

    public Timer getQueryExecutionLatency() {
        return queryExecutionLatency;
    }

    public Timer getRoundTripLatency() {
        return roundTripLatency;
    }

    public DistributionSummary getResultSize() {
        return resultSize;
    }

    public DistributionSummary getRoundTripsPerQuery() {
        return roundTripsPerQuery;
    }
}
