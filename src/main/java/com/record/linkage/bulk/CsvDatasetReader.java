package com.record.linkage.bulk;

import com.record.linkage.core.model.Dataset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * CSV reader producing a {@link Dataset}.
 *
 * <p>The first record is the header. Cells may be quoted with {@code "}; inside quotes the delimiter and
 * line breaks are literal and {@code ""} stands for one quote. An empty unquoted cell is a missing value,
 * an empty quoted cell is the empty string. Short rows are padded with missing cells.</p>
 */
public class CsvDatasetReader {
    private static final Logger log = LoggerFactory.getLogger(CsvDatasetReader.class);

    private final char delimiter;

    public CsvDatasetReader() {
        this(CsvFormat.DEFAULT_DELIMITER);
    }

    public CsvDatasetReader(char delimiter) {
        this.delimiter = delimiter;
    }

    /**
     * Reads a UTF-8 file.
     *
     * @throws UncheckedIOException if the file cannot be read
     */
    public Dataset read(Path path) {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            Dataset dataset = read(reader);
            log.info("csv.read file={} columns={} rows={}", path, dataset.columns().size(), dataset.rowCount());
            return dataset;
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + path, e);
        }
    }

    /**
     * Reads UTF-8 bytes from a stream. The stream is not closed.
     */
    public Dataset read(InputStream input) {
        return read(new InputStreamReader(input, StandardCharsets.UTF_8));
    }

    /**
     * Reads from a character source. The reader is not closed.
     *
     * @throws UncheckedIOException     if reading fails
     * @throws IllegalArgumentException if a row is wider than the header or the header repeats a column
     */
    public Dataset read(Reader reader) {
        List<List<String>> records;
        try {
            records = parse(reader instanceof BufferedReader b ? b : new BufferedReader(reader));
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read CSV input", e);
        }
        if (records.isEmpty()) {
            return Dataset.empty();
        }

        List<String> header = new ArrayList<>(records.get(0).size());
        for (String name : records.get(0)) {
            header.add(name != null ? name.strip() : "");
        }
        if (!header.isEmpty()) {
            header.set(0, stripByteOrderMark(header.get(0)));
        }

        List<List<String>> rows = new ArrayList<>(records.size() - 1);
        for (int r = 1; r < records.size(); r++) {
            List<String> record = records.get(r);
            if (record.size() > header.size()) {
                throw new IllegalArgumentException("Record " + (r + 1) + " has " + record.size()
                        + " cells, header has " + header.size());
            }
            while (record.size() < header.size()) {
                record.add(null);
            }
            rows.add(record);
        }
        return Dataset.of(header, rows);
    }

    private List<List<String>> parse(BufferedReader in) throws IOException {
        List<List<String>> records = new ArrayList<>();
        List<String> current = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean inQuotes = false;
        boolean quoted = false;
        boolean recordStarted = false;

        int c;
        while ((c = in.read()) != -1) {
            char ch = (char) c;
            if (inQuotes) {
                if (ch == CsvFormat.QUOTE) {
                    in.mark(1);
                    int next = in.read();
                    if (next == CsvFormat.QUOTE) {
                        cell.append(CsvFormat.QUOTE);
                    } else {
                        inQuotes = false;
                        if (next != -1) {
                            in.reset();
                        }
                    }
                } else {
                    cell.append(ch);
                }
                continue;
            }

            if (ch == CsvFormat.QUOTE && cell.length() == 0 && !quoted) {
                inQuotes = true;
                quoted = true;
                recordStarted = true;
            } else if (ch == delimiter) {
                current.add(finishCell(cell, quoted));
                quoted = false;
                recordStarted = true;
            } else if (ch == '\n' || ch == '\r') {
                if (ch == '\r') {
                    in.mark(1);
                    if (in.read() != '\n') {
                        in.reset();
                    }
                }
                if (recordStarted || cell.length() > 0) {
                    current.add(finishCell(cell, quoted));
                    records.add(current);
                }
                current = new ArrayList<>();
                quoted = false;
                recordStarted = false;
            } else {
                cell.append(ch);
                recordStarted = true;
            }
        }
        if (inQuotes) {
            throw new IOException("Unterminated quoted cell at end of input");
        }
        if (recordStarted || cell.length() > 0) {
            current.add(finishCell(cell, quoted));
            records.add(current);
        }
        return records;
    }

    private static String finishCell(StringBuilder cell, boolean quoted) {
        String value = cell.toString();
        cell.setLength(0);
        if (value.isEmpty() && !quoted) {
            return null;
        }
        return value;
    }

    private static String stripByteOrderMark(String value) {
        return !value.isEmpty() && value.charAt(0) == '\uFEFF' ? value.substring(1) : value;
    }
}
