package com.record.linkage.bulk;

import com.record.linkage.matching.MatchingRun;

import java.io.OutputStream;
import java.io.Writer;
import java.nio.file.Path;

/**
 * Interface for writing matching runs in a review-friendly format.
 */
public interface ResultExporter {

    /**
     * Exports a run to an output stream.
     *
     * @param run      the run to export
     * @param output   the output stream to write to
     * @param callback optional progress callback
     * @return the export result
     */
    ExportResult export(MatchingRun run, OutputStream output, ProgressCallback callback);

    /**
     * Exports a run to a writer. The writer is flushed, not closed.
     *
     * @param run      the run to export
     * @param writer   the writer to write to
     * @param callback optional progress callback
     * @return the export result
     */
    ExportResult export(MatchingRun run, Writer writer, ProgressCallback callback);

    /**
     * Exports a run into {@code directory}, naming the file after the run's {@code ResultKey.fileStem()}.
     */
    ExportResult exportToDirectory(MatchingRun run, Path directory, ProgressCallback callback);

    /**
     * Returns the format produced by this exporter (e.g., "csv").
     */
    String getFormat();
}
