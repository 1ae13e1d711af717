package com.quarry.dataset;

import com.quarry.config.RuntimeConfig;
import com.quarry.domain.StorageKey;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.extension.ProjectExtensionProcessor;
import com.quarry.query.extension.TimeSeriesExtensionProcessor;
import com.quarry.query.plan.SimpleQueryPlanExecutionStrategy;
import com.quarry.query.plan.SingleStorageQueryPlanBuilder;
import com.quarry.query.processor.MandatoryConditionsProcessor;
import com.quarry.query.processor.PrewhereProcessor;
import com.quarry.query.split.ColumnSplitQueryStrategy;
import com.quarry.query.split.ColumnSplitSpec;
import com.quarry.query.split.SplitQueryPlanExecutionStrategy;
import com.quarry.query.split.TimeSplitQueryStrategy;
import com.quarry.storage.ColumnSet;
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
 * The events dataset: one row per error event in a single table. Large
 * ungrouped reads are split by columns first, then by time.
 */
@Configuration
public class EventsDatasetConfig {

    public static final String DATASET_NAME = "events";

    static final String TIMESTAMP_COLUMN = "timestamp";
    static final String PROJECT_COLUMN = "project_id";
    static final String ID_COLUMN = "event_id";

    @Value("${quarry.datasets.events.local-table:sentry_local}")
    private String localTable;

    @Value("${quarry.datasets.events.dist-table:sentry_dist}")
    private String distTable;

    @Value("${quarry.datasets.events.default-window-days:5}")
    private int defaultWindowDays;

    static ColumnSet eventsColumns() {
        return ColumnSet.builder()
            .column("event_id", "FixedString(32)")
            .column("project_id", "UInt64")
            .column("group_id", "UInt64")
            .column("timestamp", "DateTime")
            .column("deleted", "UInt8")
            .column("retention_days", "UInt16")
            .column("platform", "Nullable(String)")
            .column("message", "Nullable(String)")
            .column("primary_hash", "Nullable(FixedString(32))")
            .column("received", "Nullable(DateTime)")
            .column("title", "Nullable(String)")
            .column("type", "Nullable(String)")
            .column("level", "Nullable(String)")
            .column("logger", "Nullable(String)")
            .column("environment", "Nullable(String)")
            .column("release", "Nullable(String)")
            .column("user_id", "Nullable(String)")
            .column("culprit", "Nullable(String)")
            .column("tags.key", "Array(String)")
            .column("tags.value", "Array(String)")
            .build();
    }

    @Bean
    @Qualifier("eventsStorage")
    public TableStorage eventsStorage() {
        TableSchema schema = new TableSchema(localTable, distTable, eventsColumns(),
            List.of(new ComparisonExpression("deleted", ComparisonExpression.EQ, 0)),
            List.of("event_id", "group_id", "message", "environment", "project_id"));
        return new TableStorage(StorageKey.EVENTS, schema,
            List.of(new MandatoryConditionsProcessor(schema.getMandatoryConditions())));
    }

    @Bean
    public Dataset eventsDataset(@Qualifier("eventsStorage") TableStorage eventsStorage,
                                 RuntimeConfig runtimeConfig, Clock clock) {
        TableSchema schema = eventsStorage.getReadSchema();
        ColumnSplitSpec splitSpec = new ColumnSplitSpec(ID_COLUMN, PROJECT_COLUMN, TIMESTAMP_COLUMN)
            .validate(schema.getColumns());

        SplitQueryPlanExecutionStrategy splitStrategy = new SplitQueryPlanExecutionStrategy(
            List.of(
                new ColumnSplitQueryStrategy(splitSpec, runtimeConfig),
                new TimeSplitQueryStrategy(TIMESTAMP_COLUMN, runtimeConfig)),
            new SimpleQueryPlanExecutionStrategy());

        SingleStorageQueryPlanBuilder planBuilder = new SingleStorageQueryPlanBuilder(eventsStorage,
            List.of(new PrewhereProcessor(schema.getPrewhereCandidates(), runtimeConfig)),
            splitStrategy);

        return new Dataset(DATASET_NAME,
            List.of(
                new TimeSeriesExtensionProcessor(TIMESTAMP_COLUMN, Duration.ofDays(defaultWindowDays),
                    runtimeConfig, clock),
                new ProjectExtensionProcessor(PROJECT_COLUMN)),
            planBuilder);
    }
}
