package com.record.linkage.evaluation;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.Dataset;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.logging.LogContext;
import com.record.linkage.metrics.MetricsService;
import com.record.linkage.metrics.NoOpMetricsService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Scores thresholded decisions against human-validated labels.
 *
 * <p>For each algorithm the validated table must carry {@code <ALGO>_TRUE_MATCH} and
 * {@code <ALGO>_BEST_MATCH_BINARY}. Rows missing either value are ignored. An algorithm that cannot be
 * evaluated is reported as skipped; the others are still evaluated.</p>
 */
public class Evaluator {
    private static final Logger log = LoggerFactory.getLogger(Evaluator.class);

    private final MetricsService metrics;

    public Evaluator() {
        this(new NoOpMetricsService());
    }

    public Evaluator(MetricsService metrics) {
        this.metrics = metrics != null ? metrics : new NoOpMetricsService();
    }

    /**
     * Evaluates every algorithm on a validated table.
     */
    public EvaluationReport evaluate(String datasetName, Dataset validated) {
        return evaluate(datasetName, validated, Arrays.asList(AlgorithmType.values()));
    }

    /**
     * Evaluates the given algorithms on a validated table.
     */
    public EvaluationReport evaluate(String datasetName, Dataset validated, Collection<AlgorithmType> algorithms) {
        try (LogContext ctx = LogContext.forEvaluation(datasetName)) {
            List<AlgorithmEvaluation> evaluations = new ArrayList<>();
            List<SkippedEvaluation> skipped = new ArrayList<>();

            for (AlgorithmType algorithm : algorithms) {
                String truthColumn = algorithm.trueMatchColumn();
                String predictionColumn = algorithm.binaryColumn();

                if (!validated.hasColumns(truthColumn, predictionColumn)) {
                    skip(datasetName, skipped, new SkippedEvaluation(algorithm, SkipReason.MISSING_COLUMNS,
                            "Columns " + truthColumn + " / " + predictionColumn + " not found"));
                    continue;
                }

                List<Boolean> actual = new ArrayList<>();
                List<Boolean> predicted = new ArrayList<>();
                try {
                    for (int row = 0; row < validated.rowCount(); row++) {
                        String truthCell = validated.get(row, truthColumn);
                        String predictionCell = validated.get(row, predictionColumn);
                        // unlabelled rows are dropped before their values are checked
                        if (LabelCoercion.isMissing(truthCell) || LabelCoercion.isMissing(predictionCell)) {
                            continue;
                        }
                        actual.add(LabelCoercion.coerce(truthColumn, truthCell));
                        predicted.add(LabelCoercion.coerce(predictionColumn, predictionCell));
                    }
                } catch (LabelDomainException e) {
                    skip(datasetName, skipped, new SkippedEvaluation(algorithm, SkipReason.LABEL_DOMAIN, e.getMessage()));
                    continue;
                }

                if (actual.isEmpty()) {
                    skip(datasetName, skipped, new SkippedEvaluation(algorithm, SkipReason.NO_LABELLED_ROWS,
                            "No row has both a label and a prediction"));
                    continue;
                }

                evaluations.add(record(algorithm, ConfusionMatrix.of(actual, predicted)));
            }

            EvaluationReport report = new EvaluationReport(datasetName, evaluations, skipped);
            log.info("evaluation.completed rows={} report={}", validated.rowCount(), report);
            return report;
        }
    }

    /**
     * Evaluates the row-wise concatenation of several validated tables, e.g. all columns of a source at once.
     */
    public EvaluationReport evaluateCombined(String datasetName, Dataset... validated) {
        Dataset combined = Dataset.empty();
        for (Dataset table : validated) {
            combined = combined.concat(table);
        }
        return evaluate(datasetName, combined);
    }

    /**
     * Evaluates results that already carry ground truth and a threshold decision.
     * Results missing either are ignored.
     *
     * @return the evaluation, empty if no result was labelled
     */
    public Optional<AlgorithmEvaluation> evaluate(AlgorithmType algorithm, List<MatchResult> results) {
        List<Boolean> actual = new ArrayList<>();
        List<Boolean> predicted = new ArrayList<>();
        for (MatchResult result : results) {
            if (result.groundTruth() != null && result.accepted() != null) {
                actual.add(result.groundTruth());
                predicted.add(result.accepted());
            }
        }
        if (actual.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(record(algorithm, ConfusionMatrix.of(actual, predicted)));
    }

    private AlgorithmEvaluation record(AlgorithmType algorithm, ConfusionMatrix matrix) {
        AlgorithmEvaluation evaluation = AlgorithmEvaluation.of(algorithm, matrix);
        log.debug("evaluation.algorithm algorithm={} rows={} metrics={}",
                algorithm, evaluation.labelledRows(), evaluation.metrics());
        return evaluation;
    }

    private void skip(String datasetName, List<SkippedEvaluation> skipped, SkippedEvaluation skip) {
        log.warn("evaluation.skipped algorithm={} reason={} message={}", skip.algorithm(), skip.reason(), skip.message());
        metrics.incrementEvaluationSkipped(datasetName, skip.reason().name());
        skipped.add(skip);
    }
}
