package com.record.linkage.matching;

import com.record.linkage.bulk.ResultSink;
import com.record.linkage.config.MatchingOptions;
import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.Dataset;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.metrics.NoOpMetricsService;
import com.record.linkage.rules.DefaultNormalizationRules;
import com.record.linkage.similarity.MatchingAlgorithmFactory;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class LinkagePipelineTest {

    @Mock
    private ResultSink sink;

    private MatchingOrchestrator orchestrator;
    private LinkagePipeline pipeline;

    private final Dataset reference = Dataset.of(
            List.of("FIRSTNAME", "LASTNAME", "STREET_NAME", "STREET_NO"),
            List.of(
                    List.of("Anna", "Schmidt", "Hauptstraße", "1"),
                    List.of("Jörg", "Müller", "Schlossstraße", "12")));

    private final Dataset queries = Dataset.of(
            List.of("FULLNAME", "STREET"),
            List.of(
                    List.of("Joerg Mueller", "Schlossstr. 12"),
                    List.of("Anna Schmid", "Hauptstr. 1"),
                    List.of("", "")));

    @BeforeEach
    void setUp() {
        orchestrator = new MatchingOrchestrator(MatchingOptions.builder().maxWorkers(2).build());
        pipeline = new LinkagePipeline(DefaultNormalizationRules.createDefaultEngine(), orchestrator, sink);
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
    }

    @Test
    @DisplayName("Should run every algorithm on every mapping and hand each run to the sink")
    void runsAll() {
        LinkageResult result = pipeline.link("customers.csv", reference, queries,
                List.of(ColumnMapping.same("STREET"), ColumnMapping.same("FULLNAME")),
                List.of(AlgorithmType.LEVENSHTEIN, AlgorithmType.JACCARD));

        assertEquals(4, result.runs().size());
        assertTrue(result.skippedMappings().isEmpty());
        assertTrue(result.failedRuns().isEmpty());
        verify(sink, times(4)).accept(any(MatchingRun.class));
    }

    @Test
    @DisplayName("Should match normalized values through derived columns")
    void matchesDerivedColumns() {
        ArgumentCaptor<MatchingRun> captor = ArgumentCaptor.forClass(MatchingRun.class);

        pipeline.link("customers.csv", reference, queries,
                List.of(ColumnMapping.same("FULLNAME")), List.of(AlgorithmType.LEVENSHTEIN));

        verify(sink).accept(captor.capture());
        MatchingRun run = captor.getValue();
        assertEquals("customers.csv", run.key().sourceName());
        assertEquals("FULLNAME", run.key().column());

        List<MatchResult> results = run.results();
        assertEquals(3, results.size());
        assertEquals("Jörg Müller", results.get(0).bestMatch());
        assertEquals(1.0, results.get(0).score());
        assertEquals("Anna Schmidt", results.get(1).bestMatch());
        assertTrue(results.get(1).isAccepted());
        assertFalse(results.get(2).hasMatch());
    }

    @Test
    @DisplayName("Runs should be keyed by the reference column of their mapping")
    void keysByReferenceColumn() {
        Dataset contacts = Dataset.of(List.of("CONTACT"), List.of(List.of("Joerg Mueller"), List.of("Anna Schmidt")));
        ArgumentCaptor<MatchingRun> captor = ArgumentCaptor.forClass(MatchingRun.class);

        LinkageResult result = pipeline.link("contacts_2024.csv", reference, contacts,
                List.of(new ColumnMapping("FULLNAME", "CONTACT")), List.of(AlgorithmType.LEVENSHTEIN));

        verify(sink).accept(captor.capture());
        MatchingRun run = captor.getValue();
        assertEquals("FULLNAME", run.key().column());
        assertEquals("contacts_2024_FULLNAME_LEVENSHTEIN", run.key().fileStem());
        assertEquals(1, result.runs().size());
        assertEquals("Jörg Müller", run.results().get(0).bestMatch());
    }

    @Test
    @DisplayName("Should skip mappings whose columns are missing")
    void skipsMissingColumns() {
        LinkageResult result = pipeline.link("customers.csv", reference, queries,
                List.of(ColumnMapping.same("EMAIL"), new ColumnMapping("STREET", "STREET")),
                List.of(AlgorithmType.REGEX));

        assertEquals(List.of(ColumnMapping.same("EMAIL")), result.skippedMappings());
        assertEquals(1, result.runs().size());
        verify(sink, times(1)).accept(any(MatchingRun.class));
    }

    @Test
    @DisplayName("A run that fails as a whole should not stop the others")
    void containsFailedRuns() {
        try (MatchingOrchestrator flaky = new MatchingOrchestrator(MatchingOptions.defaults(), new NoOpMetricsService(),
                type -> {
                    if (type == AlgorithmType.TFIDF) {
                        throw new IllegalStateException("vocabulary unavailable");
                    }
                    return MatchingAlgorithmFactory.create(type);
                })) {
            LinkagePipeline flakyPipeline = new LinkagePipeline(
                    DefaultNormalizationRules.createDefaultEngine(), flaky, sink);

            LinkageResult result = flakyPipeline.link("customers.csv", reference, queries,
                    List.of(ColumnMapping.same("STREET")), List.of(AlgorithmType.TFIDF, AlgorithmType.DICE));

            assertEquals(1, result.runs().size());
            assertEquals(AlgorithmType.DICE, result.runs().get(0).algorithm());
            assertEquals(1, result.failedRuns().size());
            assertEquals(AlgorithmType.TFIDF, result.failedRuns().get(0).key().algorithm());
            assertEquals("vocabulary unavailable", result.failedRuns().get(0).message());
            assertTrue(result.hasFailures());
            verify(sink, times(1)).accept(any(MatchingRun.class));
        }
    }

    @Test
    @DisplayName("Should not modify the input tables")
    void inputsUntouched() {
        pipeline.link("customers.csv", reference, queries,
                List.of(ColumnMapping.same("STREET")), List.of(AlgorithmType.DICE));

        assertFalse(reference.hasColumn("STREET"));
        assertEquals(List.of("FULLNAME", "STREET"), queries.columns());
    }
}
