package com.record.linkage.bulk;

import com.record.linkage.core.model.AlgorithmType;
import com.record.linkage.core.model.MatchResult;
import com.record.linkage.core.model.ScoreKind;
import com.record.linkage.matching.MatchingRun;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV exporter for matching runs, producing the tables handed out for human validation.
 *
 * <p>Output format (semicolon separated, UTF-8):</p>
 * <pre>
 * INDEX;MATCH;DICE_BEST_FOUND_MATCH;DICE_TRUE_MATCH;DICE_BEST_MATCH;DICE_BEST_MATCH_BINARY
 * 0;Hauptstraße 1;Hauptstrasse 1;;0.9166666666666666;True
 * 1;Unbekannt;;;;False
 * </pre>
 *
 * <p>{@code TRUE_MATCH} is written from the result's ground truth, which is empty until a reviewer fills it.
 * Containment scores are written as {@code True}/{@code False}.</p>
 */
public class CsvResultExporter implements ResultExporter {
    private static final Logger log = LoggerFactory.getLogger(CsvResultExporter.class);
    private static final int PROGRESS_INTERVAL = 500;

    public static final String INDEX_COLUMN = "INDEX";
    public static final String MATCH_COLUMN = "MATCH";

    private final char delimiter;

    public CsvResultExporter() {
        this(CsvFormat.DEFAULT_DELIMITER);
    }

    public CsvResultExporter(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Returns the header row for the given algorithm.
     */
    public static List<String> header(AlgorithmType algorithm) {
        String prefix = algorithm.getExportName();
        return List.of(INDEX_COLUMN, MATCH_COLUMN,
                prefix + "_BEST_FOUND_MATCH",
                algorithm.trueMatchColumn(),
                prefix + "_BEST_MATCH",
                algorithm.binaryColumn());
    }

    /**
     * Returns a sink that exports every run into {@code directory}.
     */
    public ResultSink toDirectory(Path directory) {
        return run -> exportToDirectory(run, directory, ProgressCallback.NOOP);
    }

    @Override
    public ExportResult export(MatchingRun run, OutputStream output, ProgressCallback callback) {
        return export(run, new OutputStreamWriter(output, StandardCharsets.UTF_8), callback, "stream");
    }

    @Override
    public ExportResult export(MatchingRun run, Writer writer, ProgressCallback callback) {
        return export(run, writer, callback, "stream");
    }

    @Override
    public ExportResult exportToDirectory(MatchingRun run, Path directory, ProgressCallback callback) {
        Path file = directory.resolve(run.key().fileStem() + ".csv");
        try {
            Files.createDirectories(directory);
            try (Writer writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8)) {
                return export(run, writer, callback, file.toString());
            }
        } catch (IOException e) {
            log.error("export.failed key={} file={} error={}", run.key(), file, e.getMessage());
            throw new UncheckedIOException("Cannot write " + file, e);
        }
    }

    @Override
    public String getFormat() {
        return "csv";
    }

    private ExportResult export(MatchingRun run, Writer writer, ProgressCallback callback, String target) {
        ProgressCallback cb = callback != null ? callback : ProgressCallback.NOOP;
        AlgorithmType algorithm = run.algorithm();
        long total = run.results().size();
        long rows = 0;

        try {
            BufferedWriter out = writer instanceof BufferedWriter b ? b : new BufferedWriter(writer);
            writeRow(out, header(algorithm));
            for (MatchResult result : run.results()) {
                writeRow(out, List.of(
                        Integer.toString(result.queryIndex()),
                        escape(result.query()),
                        escape(result.bestMatch()),
                        formatBoolean(result.groundTruth()),
                        formatScore(result.score(), algorithm.getScoreKind()),
                        formatBoolean(result.isAccepted())));
                rows++;
                if (rows % PROGRESS_INTERVAL == 0) {
                    cb.onProgress(rows, total, "Exported " + rows + " rows");
                }
            }
            out.flush();
        } catch (IOException e) {
            log.error("export.failed key={} target={} error={}", run.key(), target, e.getMessage());
            throw new UncheckedIOException("Cannot export " + run.key(), e);
        }

        ExportResult result = new ExportResult(target, rows, run.failures().size());
        cb.onProgress(rows, total, "Export completed");
        log.info("export.completed key={} result={}", run.key(), result);
        return result;
    }

    private void writeRow(Writer out, List<String> cells) throws IOException {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) {
                out.write(delimiter);
            }
            out.write(cells.get(i));
        }
        out.write('\n');
    }

    private String escape(String value) {
        return CsvFormat.escape(value, delimiter);
    }

    static String formatScore(Double score, ScoreKind kind) {
        if (score == null) return "";
        if (kind == ScoreKind.BOOLEAN) {
            return formatBoolean(score >= 1.0);
        }
        return Double.toString(score);
    }

    static String formatBoolean(Boolean value) {
        if (value == null) return "";
        return value ? "True" : "False";
    }
}
