package com.record.linkage.bulk;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.evaluation.AlgorithmEvaluation;
import com.record.linkage.evaluation.ConfusionMatrix;
import com.record.linkage.evaluation.EvaluationReport;
import com.record.linkage.evaluation.SkipReason;
import com.record.linkage.evaluation.SkippedEvaluation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class EvaluationReportExporterTest {

    private final EvaluationReportExporter exporter = new EvaluationReportExporter();

    private static EvaluationReport report() {
        return new EvaluationReport("STREET", List.of(
                AlgorithmEvaluation.of(AlgorithmType.LEVENSHTEIN, new ConfusionMatrix(1, 0, 0, 1)),
                AlgorithmEvaluation.of(AlgorithmType.DICE, new ConfusionMatrix(0, 0, 1, 1))),
                List.of(new SkippedEvaluation(AlgorithmType.TFIDF, SkipReason.MISSING_COLUMNS, "missing")));
    }

    @Test
    @DisplayName("Should write one metric per row and one algorithm per column")
    void metricsTable() throws Exception {
        StringWriter writer = new StringWriter();

        exporter.writeMetrics(report(), writer);

        assertEquals(List.of(
                "METRIC;LEVENSHTEIN;DICE",
                "Accuracy;1.0;0.5",
                "Precision;1.0;1.0",
                "Recall;1.0;0.5",
                "F1-Score;1.0;0.6666666666666666",
                "ROC-AUC;1.0;NaN"), writer.toString().lines().toList());
    }

    @Test
    @DisplayName("Should write the confusion matrix with labelled rows and columns")
    void confusionMatrix() throws Exception {
        StringWriter writer = new StringWriter();

        exporter.writeConfusionMatrix(new ConfusionMatrix(3, 1, 0, 4), writer);

        assertEquals(List.of(
                ";Predicted Negative;Predicted Positive",
                "True Negative;3;1",
                "True Positive;0;4"), writer.toString().lines().toList());
    }

    @Test
    @DisplayName("Should write the metrics file and one matrix file per evaluated algorithm")
    void exportToDirectory(@TempDir Path dir) throws Exception {
        List<Path> files = exporter.exportToDirectory(report(), dir);

        assertEquals(3, files.size());
        assertTrue(Files.exists(dir.resolve("STREET_eval_results.csv")));
        Path matrix = dir.resolve("DICE_STREET_confusion_matrix.csv");
        assertEquals("True Positive;1;1", Files.readAllLines(matrix, StandardCharsets.UTF_8).get(2));
        assertFalse(Files.exists(dir.resolve("TFIDF_STREET_confusion_matrix.csv")));
    }
}
