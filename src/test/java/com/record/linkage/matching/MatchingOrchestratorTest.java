package com.record.linkage.matching;

import com.record.linkage.bulk.ProgressCallback;
import com.record.linkage.config.MatchingOptions;
import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.MatchingState;
import com.record.linkage.core.model.ResultKey;
import com.record.linkage.core.model.TextRecord;
import com.record.linkage.metrics.MicrometerMetricsService;
import com.record.linkage.rules.DefaultNormalizationRules;
import com.record.linkage.rules.NormalizationEngine;
import com.record.linkage.similarity.LevenshteinMatcher;
import com.record.linkage.similarity.MatchingAlgorithm;
import com.record.linkage.similarity.MatchingAlgorithmFactory;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.*;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class MatchingOrchestratorTest {

    private static final NormalizationEngine ENGINE = DefaultNormalizationRules.createDefaultEngine();

    private static final List<TextRecord> CORPUS = ENGINE.normalizeAll(List.of(
            "Hauptstraße 1", "Schlossstraße", "Am Markt 3", "Lindenallee 5"));

    private SimpleMeterRegistry registry;
    private MatchingOrchestrator orchestrator;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        orchestrator = new MatchingOrchestrator(MatchingOptions.builder().maxWorkers(4).build(),
                new MicrometerMetricsService(registry));
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    private static List<TextRecord> queries(int count) {
        List<String> values = new ArrayList<>();
        String[] samples = {"Hauptstr. 1", "Schlossstr.", "Markt 3", "", "Lindenallee", "Unbekannt"};
        for (int i = 0; i < count; i++) {
            values.add(samples[i % samples.length]);
        }
        return ENGINE.normalizeAll(values);
    }

    private static MatchingTask task(AlgorithmType type, List<TextRecord> queries) {
        return new MatchingTask(new ResultKey("source.csv", "STREET", type), CORPUS, queries);
    }

    @ParameterizedTest
    @DisplayName("Should return one result per query in input order")
    @EnumSource(AlgorithmType.class)
    void resultsInOrder(AlgorithmType type) {
        List<TextRecord> queries = queries(250);

        MatchingRun run = orchestrator.run(task(type, queries));

        assertEquals(queries.size(), run.results().size());
        assertFalse(run.hasFailures());
        for (int i = 0; i < queries.size(); i++) {
            assertEquals(i, run.results().get(i).queryIndex());
        }
        assertEquals(type, run.algorithm());
        assertEquals(queries.size(), run.queryCount());
    }

    @Test
    @DisplayName("Parallel search should agree with sequential search")
    void matchesSequentialSearch() {
        List<TextRecord> queries = queries(60);
        MatchingAlgorithm sequential = MatchingAlgorithmFactory.create(AlgorithmType.DICE);
        sequential.prepare(CORPUS, queries);
        List<MatchResult> expected = sequential.classify(sequential.findMatches(), 0.5);

        MatchingRun run = orchestrator.run(task(AlgorithmType.DICE, queries));

        assertEquals(expected, run.results());
    }

    @Test
    @DisplayName("Should classify with the configured threshold")
    void appliesThreshold() {
        MatchingRun run = orchestrator.run(task(AlgorithmType.LEVENSHTEIN, ENGINE.normalizeAll(List.of("Schlossstr.", ""))));

        assertEquals(0.8, run.threshold());
        assertTrue(run.results().get(0).isAccepted());
        assertFalse(run.results().get(1).isAccepted());
        assertNull(run.results().get(1).score());
        assertEquals(1, run.acceptedCount());
        assertEquals(1, run.matchedCount());
    }

    @Test
    @DisplayName("The run's algorithm should pass through the searched state before classification")
    void searchCompletesBeforeClassification() {
        List<MatchingState> statesAtClassify = new CopyOnWriteArrayList<>();
        try (MatchingOrchestrator recording = new MatchingOrchestrator(
                MatchingOptions.builder().maxWorkers(2).build(),
                new MicrometerMetricsService(registry),
                type -> new LevenshteinMatcher() {
                    @Override
                    public List<MatchResult> classify(List<MatchResult> results, double threshold) {
                        statesAtClassify.add(state());
                        return super.classify(results, threshold);
                    }
                })) {

            MatchingRun run = recording.run(task(AlgorithmType.LEVENSHTEIN, queries(6)));

            assertEquals(List.of(MatchingState.SEARCHED), statesAtClassify);
            assertEquals(6, run.results().size());
        }
    }

    @Test
    @DisplayName("A failing query should be reported and left out of the results")
    void failedQueriesAreContained() {
        try (MatchingOrchestrator failing = new MatchingOrchestrator(
                MatchingOptions.builder().maxWorkers(2).build(),
                new MicrometerMetricsService(registry),
                type -> new FailingMatcher("Markt 3"))) {

            List<TextRecord> queries = queries(12);
            MatchingRun run = failing.run(task(AlgorithmType.LEVENSHTEIN, queries));

            assertEquals(2, run.failures().size());
            assertEquals(10, run.results().size());
            assertEquals(queries.size(), run.results().size() + run.failures().size());

            QueryFailure failure = run.failures().get(0);
            assertEquals(2, failure.queryIndex());
            assertEquals("Markt 3", failure.query());
            assertEquals("IllegalStateException", failure.errorType());
            assertEquals("search exploded", failure.message());
            assertEquals(8, run.failures().get(1).queryIndex());

            Set<Integer> indices = run.results().stream().map(MatchResult::queryIndex).collect(Collectors.toSet());
            assertEquals(10, indices.size());
            assertFalse(indices.contains(2));
            assertFalse(indices.contains(8));

            Counter failed = registry.find("linkage.query.failed").tag("algorithm", "LEVENSHTEIN").counter();
            assertNotNull(failed);
            assertEquals(2.0, failed.count());
        }
    }

    @Test
    @DisplayName("Should record matching metrics")
    void recordsMetrics() {
        orchestrator.run(task(AlgorithmType.JACCARD, queries(6)));

        Timer timer = registry.find("linkage.matching.duration").tag("algorithm", "JACCARD").timer();
        Counter matched = registry.find("linkage.query.matched").tag("algorithm", "JACCARD").counter();
        assertNotNull(timer);
        assertEquals(1, timer.count());
        assertNotNull(matched);
        assertEquals(6.0, matched.count());
        assertNotNull(registry.find("linkage.similarity.score").tag("algorithm", "JACCARD").summary());
    }

    @Test
    @DisplayName("Should report completion through the progress callback")
    void reportsProgress() {
        ProgressCallback callback = mock(ProgressCallback.class);

        orchestrator.run(task(AlgorithmType.NGRAM, queries(5)), callback);

        verify(callback).onProgress(5, 5, "Matching completed");
    }

    @Test
    @DisplayName("An empty query set should produce an empty run")
    void emptyQueries() {
        MatchingRun run = orchestrator.run(task(AlgorithmType.TFIDF, List.of()));
        assertTrue(run.results().isEmpty());
        assertFalse(run.hasFailures());
    }

    @Test
    @DisplayName("Concurrent runs should not share algorithm state")
    void concurrentRuns() throws Exception {
        ExecutorService callers = Executors.newFixedThreadPool(3);
        try {
            List<Future<MatchingRun>> futures = new ArrayList<>();
            for (AlgorithmType type : List.of(AlgorithmType.TFIDF, AlgorithmType.DICE, AlgorithmType.JACCARD)) {
                futures.add(callers.submit(() -> orchestrator.run(task(type, queries(40)))));
            }
            for (Future<MatchingRun> future : futures) {
                MatchingRun run = future.get(30, TimeUnit.SECONDS);
                assertEquals(40, run.results().size());
                assertFalse(run.hasFailures());
            }
        } finally {
            callers.shutdownNow();
        }
    }

    @Test
    @DisplayName("A closed orchestrator should refuse new work")
    void closed() {
        orchestrator.close();
        assertThrows(RejectedExecutionException.class,
                () -> orchestrator.run(task(AlgorithmType.DICE, queries(3))));
    }

    /**
     * Levenshtein matcher whose search fails for one query text.
     */
    private static final class FailingMatcher extends LevenshteinMatcher {
        private final String poison;

        FailingMatcher(String poison) {
            this.poison = poison;
        }

        @Override
        protected MatchResult search(TextRecord query, int queryPosition) {
            if (query.original().equals(poison)) {
                throw new IllegalStateException("search exploded");
            }
            return super.search(query, queryPosition);
        }
    }
}
