package com.quarry.query.plan;

import com.quarry.domain.QueryResult;
import com.quarry.domain.StorageKey;
import com.quarry.query.ComparisonExpression;
import com.quarry.query.Query;
import com.quarry.query.Request;
import com.quarry.query.processor.MandatoryConditionsProcessor;
import com.quarry.query.processor.QueryProcessor;
import com.quarry.storage.ColumnSet;
import com.quarry.storage.TableSchema;
import com.quarry.storage.TableStorage;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SingleStorageQueryPlanBuilder Tests")
class SingleStorageQueryPlanBuilderTest {

    private QueryProcessor storageProcessor;
    private TableStorage storage;

    @BeforeEach
    void setUp() {
        TableSchema schema = new TableSchema("events_local", "events_dist",
            ColumnSet.builder().column("event_id", "String").column("deleted", "UInt8").build(),
            List.of(new ComparisonExpression("deleted", "=", 0)), List.of("event_id"));
        storageProcessor = new MandatoryConditionsProcessor(schema.getMandatoryConditions());
        storage = new TableStorage(StorageKey.EVENTS, schema, List.of(storageProcessor));
    }

    @Test
    @DisplayName("Should point the query at the storage's table")
    void shouldSetDataSource() {
        Request request = new Request(new Query());

        new SingleStorageQueryPlanBuilder(storage, List.of()).buildPlan(request);

        assertThat(request.getQuery().getDataSource()).isEqualTo("events_dist");
    }

    @Test
    @DisplayName("Should run storage processors before post processors")
    void shouldOrderProcessors() {
        QueryProcessor postProcessor = (query, settings) -> query.setLimit(1);

        StorageQueryPlan plan = new SingleStorageQueryPlanBuilder(storage, List.of(postProcessor))
            .buildPlan(new Request(new Query()));

        assertThat(plan.getQueryProcessors()).containsExactly(storageProcessor, postProcessor);
    }

    @Test
    @DisplayName("Should default to a single round trip")
    void shouldDefaultToSimpleExecution() {
        StorageQueryPlan plan = new SingleStorageQueryPlanBuilder(storage, List.of())
            .buildPlan(new Request(new Query()));
        QueryResult expected = new QueryResult();

        assertThat(plan.getExecutionStrategy()).isInstanceOf(SimpleQueryPlanExecutionStrategy.class);
        assertThat(plan.getExecutionStrategy().execute(new Request(new Query()), request -> expected))
            .isSameAs(expected);
    }

    @Test
    @DisplayName("Should carry the configured execution strategy")
    void shouldUseConfiguredStrategy() {
        QueryPlanExecutionStrategy strategy = (request, runner) -> new QueryResult();

        StorageQueryPlan plan = new SingleStorageQueryPlanBuilder(storage, List.of(), strategy)
            .buildPlan(new Request(new Query()));

        assertThat(plan.getExecutionStrategy()).isSameAs(strategy);
    }
}
