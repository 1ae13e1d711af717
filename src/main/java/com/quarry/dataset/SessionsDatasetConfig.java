package com.quarry.dataset;

import com.quarry.config.RuntimeConfig;
import com.quarry.domain.StorageKey;
import com.quarry.query.extension.ProjectExtensionProcessor;
import com.quarry.query.extension.TimeSeriesExtensionProcessor;
import com.quarry.query.plan.SelectedStorageQueryPlanBuilder;
import com.quarry.query.processor.PrewhereProcessor;
import com.quarry.storage.ColumnSet;
import com.quarry.storage.StorageRegistry;
import com.quarry.storage.TableSchema;
import com.quarry.storage.TableStorage;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.Duration;
import java.util.List;

/**
 * The sessions dataset: raw session updates plus an hourly rollup of them.
 * Reads go to one of the two depending on granularity and are never split.
 */
@Configuration
public class SessionsDatasetConfig {

    public static final String DATASET_NAME = "sessions";

    static final String TIMESTAMP_COLUMN = "started";
    static final String PROJECT_COLUMN = "project_id";
    static final List<String> PREWHERE_CANDIDATES = List.of("project_id", "org_id");

    @Value("${quarry.datasets.sessions.default-window-days:7}")
    private int defaultWindowDays;

    static ColumnSet sessionsKeyColumns() {
        return ColumnSet.builder()
            .column("org_id", "UInt64")
            .column("project_id", "UInt64")
            .column("started", "DateTime")
            .column("release", "LowCardinality(String)")
            .column("environment", "LowCardinality(String)")
            .build();
    }

    static ColumnSet sessionsRawColumns() {
        return ColumnSet.builder()
            .column("session_id", "UUID")
            .column("distinct_id", "UUID")
            .column("seq", "UInt64")
            .columns(sessionsKeyColumns())
            .column("received", "DateTime")
            .column("duration", "UInt32")
            .column("status", "UInt8")
            .column("errors", "UInt16")
            .column("retention_days", "UInt16")
            .build();
    }

    static ColumnSet sessionsHourlyColumns() {
        return ColumnSet.builder()
            .columns(sessionsKeyColumns())
            .column("duration_quantiles", "AggregateFunction(quantilesIf(0.5, 0.9), UInt32, UInt8)")
            .column("sessions", "AggregateFunction(countIf, UUID, UInt8)")
            .column("users", "AggregateFunction(uniqIf, UUID, UInt8)")
            .column("sessions_crashed", "AggregateFunction(countIf, UUID, UInt8)")
            .column("sessions_abnormal", "AggregateFunction(countIf, UUID, UInt8)")
            .column("sessions_errored", "AggregateFunction(uniqIf, UUID, UInt8)")
            .column("users_crashed", "AggregateFunction(uniqIf, UUID, UInt8)")
            .column("users_abnormal", "AggregateFunction(uniqIf, UUID, UInt8)")
            .column("users_errored", "AggregateFunction(uniqIf, UUID, UInt8)")
            .build();
    }

    @Bean
    @Qualifier("sessionsRawStorage")
    public TableStorage sessionsRawStorage() {
        TableSchema schema = new TableSchema("sessions_raw_local", "sessions_raw_dist",
            sessionsRawColumns(), List.of(), PREWHERE_CANDIDATES);
        return new TableStorage(StorageKey.SESSIONS_RAW, schema, List.of());
    }

    @Bean
    @Qualifier("sessionsHourlyStorage")
    public TableStorage sessionsHourlyStorage() {
        TableSchema schema = new TableSchema("sessions_hourly_local", "sessions_hourly_dist",
            sessionsHourlyColumns(), List.of(), PREWHERE_CANDIDATES);
        return new TableStorage(StorageKey.SESSIONS_HOURLY, schema, List.of());
    }

    @Bean
    public Dataset sessionsDataset(@Qualifier("sessionsRawStorage") TableStorage sessionsRawStorage,
                                   @Qualifier("sessionsHourlyStorage") TableStorage sessionsHourlyStorage,
                                   StorageRegistry storageRegistry,
                                   RuntimeConfig runtimeConfig, Clock clock) {
        SelectedStorageQueryPlanBuilder planBuilder = new SelectedStorageQueryPlanBuilder(
            new SessionsStorageSelector(sessionsRawStorage, sessionsHourlyStorage),
            storageRegistry,
            List.of(new PrewhereProcessor(PREWHERE_CANDIDATES, runtimeConfig)));

        return new Dataset(DATASET_NAME,
            List.of(
                new TimeSeriesExtensionProcessor(TIMESTAMP_COLUMN, Duration.ofDays(defaultWindowDays),
                    runtimeConfig, clock),
                new ProjectExtensionProcessor(PROJECT_COLUMN)),
            planBuilder);
    }
}
