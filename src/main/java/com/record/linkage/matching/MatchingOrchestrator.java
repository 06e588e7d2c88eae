package com.record.linkage.matching;

import com.record.linkage.bulk.ProgressCallback;
import com.record.linkage.config.MatchingOptions;
import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.TextRecord;
import com.record.linkage.logging.LogContext;
import com.record.linkage.metrics.MetricsService;
import com.record.linkage.metrics.NoOpMetricsService;
import com.record.linkage.similarity.MatchingAlgorithm;
import com.record.linkage.similarity.MatchingAlgorithmFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Runs prepare → search → classify for one {@link MatchingTask}.
 *
 * <p>Every run gets its own algorithm instance. After {@code prepare}, one task per query is submitted to a
 * bounded worker pool. Each task's outcome is captured as success or failure; failed queries are logged and
 * reported in {@link MatchingRun#failures()} instead of aborting the run. Results are reassembled in query
 * input order before thresholding.</p>
 */
public class MatchingOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(MatchingOrchestrator.class);

    private static final int PROGRESS_INTERVAL = 100;

    private final MatchingOptions options;
    private final MetricsService metrics;
    private final Function<AlgorithmType, MatchingAlgorithm> algorithmFactory;
    private final ExecutorService executor;

    public MatchingOrchestrator() {
        this(MatchingOptions.defaults());
    }

    public MatchingOrchestrator(MatchingOptions options) {
        this(options, new NoOpMetricsService());
    }

    public MatchingOrchestrator(MatchingOptions options, MetricsService metrics) {
        this(options, metrics, type -> MatchingAlgorithmFactory.create(type, options));
    }

    /**
     * Creates an orchestrator with a custom algorithm source. The factory must return a new instance per call.
     */
    public MatchingOrchestrator(MatchingOptions options, MetricsService metrics,
                                Function<AlgorithmType, MatchingAlgorithm> algorithmFactory) {
        this.options = Objects.requireNonNull(options, "options is required");
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
        this.algorithmFactory = Objects.requireNonNull(algorithmFactory, "algorithmFactory is required");
        this.executor = Executors.newFixedThreadPool(options.getMaxWorkers(), new WorkerThreadFactory());
    }

    public MatchingOptions getOptions() {
        return options;
    }

    /**
     * Runs one task without progress reporting.
     */
    public MatchingRun run(MatchingTask task) {
        return run(task, ProgressCallback.NOOP);
    }

    /**
     * Runs one task. The supplied corpus and query lists are not modified.
     *
     * @throws RejectedExecutionException if the orchestrator has been closed
     */
    public MatchingRun run(MatchingTask task, ProgressCallback callback) {
        Objects.requireNonNull(task, "task is required");
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        AlgorithmType type = task.algorithm();
        double threshold = options.getThreshold(type);

        try (LogContext ctx = LogContext.forMatching(LogContext.generateRunId(), type.name(),
                task.key().sourceName(), task.key().column())) {
            long start = System.nanoTime();
            log.info("matching.started references={} queries={} threshold={}",
                    task.reference().size(), task.queries().size(), threshold);

            MatchingAlgorithm algorithm = algorithmFactory.apply(type);
            algorithm.prepare(task.reference(), task.queries());

            List<QueryOutcome> outcomes = searchAll(algorithm, task.queries(), cb);
            algorithm.completeSearch();

            List<MatchResult> found = new ArrayList<>(outcomes.size());
            List<QueryFailure> failures = new ArrayList<>();
            for (QueryOutcome outcome : outcomes) {
                if (outcome.failure() != null) {
                    QueryFailure failure = outcome.failure();
                    log.warn("matching.queryFailed index={} algorithm={} key={} error={}: {}",
                            failure.queryIndex(), type, task.key(), failure.errorType(), failure.message());
                    metrics.incrementQueryFailed(type);
                    failures.add(failure);
                } else {
                    found.add(outcome.result());
                    metrics.incrementQueryMatched(type);
                }
            }

            List<MatchResult> classified = algorithm.classify(found, threshold);
            for (MatchResult result : classified) {
                if (result.score() != null) {
                    metrics.recordSimilarityScore(type, result.score());
                }
                if (result.isAccepted()) {
                    metrics.incrementMatchAccepted(type);
                }
            }

            Duration duration = Duration.ofNanos(System.nanoTime() - start);
            metrics.recordMatchingDuration(type, duration);
            MatchingRun run = new MatchingRun(task.key(), threshold, classified, failures, duration);
            cb.onProgress(task.queries().size(), task.queries().size(), "Matching completed");
            log.info("matching.completed results={} accepted={} failures={} durationMs={}",
                    classified.size(), run.acceptedCount(), failures.size(), duration.toMillis());
            return run;
        }
    }

    private List<QueryOutcome> searchAll(MatchingAlgorithm algorithm, List<TextRecord> queries,
                                         ProgressCallback cb) {
        long total = queries.size();
        AtomicLong processed = new AtomicLong();

        List<CompletableFuture<QueryOutcome>> futures = new ArrayList<>(queries.size());
        for (int i = 0; i < queries.size(); i++) {
            final int position = i;
            TextRecord query = queries.get(i);
            futures.add(CompletableFuture
                    .supplyAsync(() -> algorithm.findMatch(position), executor)
                    .handle((result, error) -> {
                        long done = processed.incrementAndGet();
                        if (done % PROGRESS_INTERVAL == 0) {
                            cb.onProgress(done, total, "Matched " + done + " queries");
                        }
                        if (error != null) {
                            return QueryOutcome.failed(QueryFailure.of(query.index(), query.original(), unwrap(error)));
                        }
                        return QueryOutcome.succeeded(result);
                    }));
        }

        // handle() never completes exceptionally, so join() only waits; the list keeps input order
        List<QueryOutcome> outcomes = new ArrayList<>(futures.size());
        for (CompletableFuture<QueryOutcome> future : futures) {
            outcomes.add(future.join());
        }
        return outcomes;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    @Override
    public void close() {
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private record QueryOutcome(MatchResult result, QueryFailure failure) {

        static QueryOutcome succeeded(MatchResult result) {
            return new QueryOutcome(result, null);
        }

        static QueryOutcome failed(QueryFailure failure) {
            return new QueryOutcome(null, failure);
        }
    }

    private static final class WorkerThreadFactory implements ThreadFactory {
        private static final AtomicInteger POOL_SEQUENCE = new AtomicInteger();

        private final int pool = POOL_SEQUENCE.incrementAndGet();
        private final AtomicInteger threadSequence = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "linkage-" + pool + "-worker-" + threadSequence.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
