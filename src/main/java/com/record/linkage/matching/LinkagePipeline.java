package com.record.linkage.matching;

import com.record.linkage.bulk.ResultSink;
import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.Dataset;
import com.record.linkage.core.model.ResultKey;
import com.record.linkage.core.model.TextRecord;
import com.record.linkage.rules.NormalizationEngine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * Links a query table against a reference table column by column.
 *
 * <p>Both tables get their convenience columns derived and the mapped columns normalized. Then every
 * requested algorithm runs on every mapping and each finished run goes to the {@link ResultSink}.
 * A mapping naming a column one of the tables lacks is skipped. A run that aborts as a whole is logged
 * and reported without stopping the remaining runs.</p>
 */
public class LinkagePipeline {
    private static final Logger log = LoggerFactory.getLogger(LinkagePipeline.class);

    private final NormalizationEngine engine;
    private final MatchingOrchestrator orchestrator;
    private final ResultSink sink;

    public LinkagePipeline(NormalizationEngine engine, MatchingOrchestrator orchestrator, ResultSink sink) {
        this.engine = Objects.requireNonNull(engine, "engine is required");
        this.orchestrator = Objects.requireNonNull(orchestrator, "orchestrator is required");
        this.sink = sink != null ? sink : ResultSink.DISCARD;
    }

    /**
     * Runs all algorithms on all mappings.
     *
     * @param sourceName identifies the query input in result keys, usually its file name
     */
    public LinkageResult link(String sourceName, Dataset reference, Dataset queries,
                              List<ColumnMapping> mappings, Collection<AlgorithmType> algorithms) {
        Objects.requireNonNull(sourceName, "sourceName is required");
        Dataset referenceTable = ConvenienceColumns.derive(reference);
        Dataset queryTable = ConvenienceColumns.derive(queries);
        log.info("linkage.started source={} references={} queries={} mappings={} algorithms={}",
                sourceName, referenceTable.rowCount(), queryTable.rowCount(), mappings.size(), algorithms);

        List<MatchingRun> runs = new ArrayList<>();
        List<ColumnMapping> skipped = new ArrayList<>();
        List<LinkageResult.RunFailure> failed = new ArrayList<>();

        for (ColumnMapping mapping : mappings) {
            if (!referenceTable.hasColumn(mapping.referenceColumn()) || !queryTable.hasColumn(mapping.queryColumn())) {
                log.warn("linkage.mappingSkipped source={} mapping={} reason=missing column", sourceName, mapping);
                skipped.add(mapping);
                continue;
            }

            List<TextRecord> referenceRecords = engine.normalizeColumn(referenceTable, mapping.referenceColumn());
            List<TextRecord> queryRecords = engine.normalizeColumn(queryTable, mapping.queryColumn());

            for (AlgorithmType algorithm : algorithms) {
                // runs are correlated by the reference column, e.g. CONTACT queries land in the FULLNAME results
                ResultKey key = new ResultKey(sourceName, mapping.referenceColumn(), algorithm);
                MatchingRun run;
                try {
                    run = orchestrator.run(new MatchingTask(key, referenceRecords, queryRecords));
                } catch (RuntimeException e) {
                    log.error("linkage.runFailed key={} error={}: {}", key, e.getClass().getSimpleName(), e.getMessage());
                    failed.add(new LinkageResult.RunFailure(key, e.getClass().getSimpleName(), e.getMessage()));
                    continue;
                }
                runs.add(run);
                sink.accept(run);
            }
        }

        LinkageResult result = new LinkageResult(runs, skipped, failed);
        log.info("linkage.completed source={} result={}", sourceName, result);
        return result;
    }
}
