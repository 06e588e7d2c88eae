package com.record.linkage.bulk;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.evaluation.AlgorithmEvaluation;
import com.record.linkage.evaluation.ConfusionMatrix;
import com.record.linkage.evaluation.EvaluationReport;
import com.record.linkage.evaluation.Metric;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes evaluation reports as flat CSV.
 *
 * <p>Metrics table:</p>
 * <pre>
 * METRIC;LEVENSHTEIN;JACCARD
 * Accuracy;0.75;0.5
 * ...
 * </pre>
 *
 * <p>Confusion matrix, one file per algorithm:</p>
 * <pre>
 * ;Predicted Negative;Predicted Positive
 * True Negative;3;1
 * True Positive;0;4
 * </pre>
 */
public class EvaluationReportExporter {
    private static final Logger log = LoggerFactory.getLogger(EvaluationReportExporter.class);

    static final String METRIC_COLUMN = "METRIC";

    private final char delimiter;

    public EvaluationReportExporter() {
        this(CsvFormat.DEFAULT_DELIMITER);
    }

    public EvaluationReportExporter(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Writes the metrics table. The writer is flushed, not closed.
     */
    public void writeMetrics(EvaluationReport report, Writer writer) throws IOException {
        Map<Metric, Map<AlgorithmType, Double>> table = report.metricsTable();

        StringBuilder header = new StringBuilder(METRIC_COLUMN);
        for (AlgorithmEvaluation evaluation : report.evaluations()) {
            header.append(delimiter).append(evaluation.algorithm().getExportName());
        }
        writer.write(header.append('\n').toString());

        for (Map.Entry<Metric, Map<AlgorithmType, Double>> row : table.entrySet()) {
            StringBuilder line = new StringBuilder(CsvFormat.escape(row.getKey().getDisplayName(), delimiter));
            for (Double value : row.getValue().values()) {
                line.append(delimiter).append(value);
            }
            writer.write(line.append('\n').toString());
        }
        writer.flush();
    }

    /**
     * Writes one confusion matrix. The writer is flushed, not closed.
     */
    public void writeConfusionMatrix(ConfusionMatrix matrix, Writer writer) throws IOException {
        writer.write(delimiter + "Predicted Negative" + delimiter + "Predicted Positive\n");
        writer.write("True Negative" + delimiter + matrix.trueNegatives() + delimiter + matrix.falsePositives() + '\n');
        writer.write("True Positive" + delimiter + matrix.falseNegatives() + delimiter + matrix.truePositives() + '\n');
        writer.flush();
    }

    /**
     * Writes {@code <dataset>_eval_results.csv} and one {@code <ALGO>_<dataset>_confusion_matrix.csv}
     * per evaluated algorithm into {@code directory}.
     *
     * @return the files written
     * @throws UncheckedIOException if a file cannot be written
     */
    public List<Path> exportToDirectory(EvaluationReport report, Path directory) {
        List<Path> written = new ArrayList<>();
        try {
            Files.createDirectories(directory);
            Path metricsFile = directory.resolve(report.datasetName() + "_eval_results.csv");
            try (Writer writer = Files.newBufferedWriter(metricsFile, StandardCharsets.UTF_8)) {
                writeMetrics(report, writer);
            }
            written.add(metricsFile);

            for (AlgorithmEvaluation evaluation : report.evaluations()) {
                Path matrixFile = directory.resolve(evaluation.algorithm().getExportName() + "_"
                        + report.datasetName() + "_confusion_matrix.csv");
                try (Writer writer = Files.newBufferedWriter(matrixFile, StandardCharsets.UTF_8)) {
                    writeConfusionMatrix(evaluation.matrix(), writer);
                }
                written.add(matrixFile);
            }
        } catch (IOException e) {
            log.error("evaluationExport.failed dataset={} error={}", report.datasetName(), e.getMessage());
            throw new UncheckedIOException("Cannot export evaluation of " + report.datasetName(), e);
        }
        log.info("evaluationExport.completed dataset={} files={}", report.datasetName(), written.size());
        return written;
    }
}
