package com.quarry.query;

import com.quarry.dataset.Dataset;
import com.quarry.dataset.DatasetRegistry;
import com.quarry.domain.QueryResult;
import com.quarry.query.extension.ExtensionProcessor;
import com.quarry.query.plan.QueryRunner;
import com.quarry.query.plan.StorageQueryPlan;
import com.quarry.query.processor.QueryProcessor;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * QueryExecutor answers one request against a dataset.
 *
 * This service:
 * - Works on a copy of the caller's request, which is never modified
 * - Applies the dataset's extensions, then builds the storage query plan
 * - Runs the plan's query processors in order
 * - Hands the processed request and the store runner to the plan's execution strategy,
 *   which decides how many round trips the request takes
 *
 * Round trips run one after another on a bounded elastic worker, the JDBC
 * calls underneath block.
 */
@Service
public class QueryExecutor {

    private static final Logger log = LoggerFactory.getLogger(QueryExecutor.class);

    private final DatasetRegistry datasetRegistry;
    private final QueryRunner queryRunner;
    private final QueryMetrics metrics;

    @Value("${quarry.query.timeout:30s}")
    private Duration timeout = Duration.ofSeconds(30);

    public QueryExecutor(DatasetRegistry datasetRegistry, QueryRunner queryRunner, QueryMetrics metrics) {
        this.datasetRegistry = datasetRegistry;
        this.queryRunner = queryRunner;
        this.metrics = metrics;
    }

    /**
     * Execute a request against the named dataset
     *
     * @param datasetName dataset to read from
     * @param request the caller's request, left untouched
     * @return A Mono emitting the rows, or an error when any round trip fails or the
     *         overall timeout elapses
     */
    public Mono<QueryResult> execute(String datasetName, Request request) {
        return Mono.fromCallable(() -> executeBlocking(datasetName, request))
            .subscribeOn(Schedulers.boundedElastic())
            .timeout(timeout)
            .doOnError(error -> log.error("Query against dataset {} failed: {}",
                datasetName, error.getMessage(), error));
    }

    /**
     * Execute a request on the calling thread
     */
    public QueryResult executeBlocking(String datasetName, Request request) {
        Timer.Sample sample = metrics.startQueryTimer();
        try {
            Dataset dataset = datasetRegistry.get(datasetName);
            Request working = request.copy();

            for (ExtensionProcessor extensionProcessor : dataset.getExtensionProcessors()) {
                extensionProcessor.process(working);
            }

            StorageQueryPlan plan = dataset.getPlanBuilder().buildPlan(working);
            for (QueryProcessor processor : plan.getQueryProcessors()) {
                processor.processQuery(working.getQuery(), working.getSettings());
            }

            AtomicInteger roundTrips = new AtomicInteger();
            QueryRunner countingRunner = req -> {
                roundTrips.incrementAndGet();
                return queryRunner.run(req);
            };

            QueryResult result = plan.getExecutionStrategy().execute(working, countingRunner);

            metrics.recordQueryExecuted();
            metrics.recordRoundTripsPerQuery(roundTrips.get());
            metrics.recordResultSize(result.getTotalCount());
            log.info("Query against dataset {} completed in {} round trip(s) with {} rows",
                datasetName, roundTrips.get(), result.getTotalCount());
            return result;
        } catch (RuntimeException e) {
            metrics.recordQueryFailed();
            throw e;
        } finally {
            metrics.recordQueryLatency(sample);
        }
    }
}
