package com.quarry.query;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Test suite for QueryMetrics
 * Tests query counters, round trip tracking and result size distribution
 */
@DisplayName("QueryMetrics Tests")
class QueryMetricsTest {

    private QueryMetrics queryMetrics;
    private MeterRegistry meterRegistry;

    @BeforeEach
    void setUp() {
        meterRegistry = new SimpleMeterRegistry();
        queryMetrics = new QueryMetrics();
        queryMetrics.meterRegistry = meterRegistry;
        queryMetrics.init();
    }

    @Test
    @DisplayName("Should register every meter under the quarry prefix")
    void shouldRegisterMeters() {
        assertThat(meterRegistry.find("quarry.query.executed").counter()).isNotNull();
        assertThat(meterRegistry.find("quarry.query.failed").counter()).isNotNull();
        assertThat(meterRegistry.find("quarry.store.roundtrips").counter()).isNotNull();
        assertThat(meterRegistry.find("quarry.store.errors").counter()).isNotNull();
        assertThat(meterRegistry.find("quarry.query.execution.latency").timer()).isNotNull();
        assertThat(meterRegistry.find("quarry.store.roundtrip.latency").timer()).isNotNull();
        assertThat(meterRegistry.find("quarry.query.result.size").summary()).isNotNull();
        assertThat(meterRegistry.find("quarry.query.roundtrips").summary()).isNotNull();
    }

    @Test
    @DisplayName("Should count executed and failed queries")
    void shouldCountQueries() {
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryExecuted();
        queryMetrics.recordQueryFailed();

        assertThat(queryMetrics.getQueriesExecuted().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getQueriesFailed().count()).isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should record round trips with their latency")
    void shouldRecordRoundTrips() {
        queryMetrics.recordRoundTrip(120);
        queryMetrics.recordRoundTrip(80);
        queryMetrics.recordRoundTripError();

        assertThat(queryMetrics.getRoundTrips().count()).isEqualTo(2.0);
        assertThat(queryMetrics.getRoundTripErrors().count()).isEqualTo(1.0);
        assertThat(queryMetrics.getRoundTripLatency().count()).isEqualTo(2);
        assertThat(queryMetrics.getRoundTripLatency().totalTime(TimeUnit.MILLISECONDS)).isEqualTo(200.0);
    }

    @Test
    @DisplayName("Should track round trips per query and result sizes")
    void shouldTrackDistributions() {
        queryMetrics.recordRoundTripsPerQuery(1);
        queryMetrics.recordRoundTripsPerQuery(3);
        queryMetrics.recordResultSize(50);

        assertThat(queryMetrics.getRoundTripsPerQuery().count()).isEqualTo(2);
        assertThat(queryMetrics.getRoundTripsPerQuery().max()).isEqualTo(3.0);
        assertThat(queryMetrics.getResultSize().totalAmount()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Should stop a started query timer")
    void shouldRecordQueryLatency() {
        Timer.Sample sample = queryMetrics.startQueryTimer();

        queryMetrics.recordQueryLatency(sample);

        assertThat(queryMetrics.getQueryExecutionLatency().count()).isEqualTo(1);
    }
}
