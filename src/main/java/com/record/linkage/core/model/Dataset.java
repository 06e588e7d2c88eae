package com.record.linkage.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable rectangular table of text cells. A {@code null} cell is a missing value.
 * This is the in-memory handoff format between the matching core and its input/export collaborators.
 */
public final class Dataset {

    private final List<String> columns;
    private final Map<String, Integer> columnIndex;
    private final List<List<String>> rows;

    private Dataset(List<String> columns, List<List<String>> rows) {
        this.columns = List.copyOf(columns);
        this.columnIndex = new LinkedHashMap<>();
        for (int i = 0; i < this.columns.size(); i++) {
            if (columnIndex.put(this.columns.get(i), i) != null) {
                throw new IllegalArgumentException("Duplicate column: " + this.columns.get(i));
            }
        }
        List<List<String>> copy = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = rows.get(r);
            if (row.size() != this.columns.size()) {
                throw new IllegalArgumentException("Row " + r + " has " + row.size()
                        + " cells, expected " + this.columns.size());
            }
            copy.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Creates a table from column names and rows of equal width.
     */
    public static Dataset of(List<String> columns, List<List<String>> rows) {
        Objects.requireNonNull(columns, "columns is required");
        Objects.requireNonNull(rows, "rows is required");
        return new Dataset(columns, rows);
    }

    /**
     * Creates a single-column table.
     */
    public static Dataset ofColumn(String column, List<String> values) {
        List<List<String>> rows = new ArrayList<>(values.size());
        for (String value : values) {
            rows.add(Collections.singletonList(value));
        }
        return new Dataset(List.of(column), rows);
    }

    /**
     * Creates a table without columns or rows.
     */
    public static Dataset empty() {
        return new Dataset(List.of(), List.of());
    }

    public List<String> columns() {
        return columns;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public boolean hasColumn(String column) {
        return columnIndex.containsKey(column);
    }

    public boolean hasColumns(String... names) {
        for (String name : names) {
            if (!hasColumn(name)) {
                return false;
            }
        }
        return true;
    }

    /**
     * Returns the row as an unmodifiable list of cells.
     */
    public List<String> row(int rowIndex) {
        return rows.get(rowIndex);
    }

    /**
     * Returns a single cell, {@code null} if missing.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public String get(int rowIndex, String column) {
        return rows.get(rowIndex).get(requireColumn(column));
    }

    /**
     * Returns all values of a column in row order.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<String> column(String column) {
        int idx = requireColumn(column);
        List<String> values = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            values.add(row.get(idx));
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Returns the column values if the column exists.
     */
    public Optional<List<String>> findColumn(String column) {
        return hasColumn(column) ? Optional.of(column(column)) : Optional.empty();
    }

    /**
     * Derives a column by joining source columns with a separator, e.g. {@code FULLNAME = FIRSTNAME + " " + LASTNAME}.
     * If any source column is absent the table is returned unchanged; if any source cell is missing the
     * derived cell is missing. An existing target column is replaced.
     */
    public Dataset withConcatenatedColumn(String target, String separator, String... sources) {
        if (sources.length == 0 || !hasColumns(sources)) {
            return this;
        }
        int[] sourceIdx = new int[sources.length];
        for (int i = 0; i < sources.length; i++) {
            sourceIdx[i] = columnIndex.get(sources[i]);
        }

        List<String> newColumns = new ArrayList<>(columns);
        Integer targetIdx = columnIndex.get(target);
        if (targetIdx == null) {
            newColumns.add(target);
        }

        List<List<String>> newRows = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            String derived = concatenate(row, sourceIdx, separator);
            List<String> newRow = new ArrayList<>(row);
            if (targetIdx == null) {
                newRow.add(derived);
            } else {
                newRow.set(targetIdx, derived);
            }
            newRows.add(newRow);
        }
        return new Dataset(newColumns, newRows);
    }

    /**
     * Stacks the rows of another table below this one. Columns are the union of both tables,
     * cells of columns a table lacks are missing.
     */
    public Dataset concat(Dataset other) {
        List<String> union = new ArrayList<>(columns);
        for (String column : other.columns) {
            if (!columnIndex.containsKey(column)) {
                union.add(column);
            }
        }
        List<List<String>> newRows = new ArrayList<>(rows.size() + other.rows.size());
        appendAligned(this, union, newRows);
        appendAligned(other, union, newRows);
        return new Dataset(union, newRows);
    }

    /**
     * Places the columns of another table next to this one, aligned by row position.
     * Columns already present here are kept as they are. The result has as many rows as the
     * longer table; cells past the end of the shorter table are missing.
     */
    public Dataset joinColumns(Dataset other) {
        List<String> added = new ArrayList<>();
        for (String column : other.columns) {
            if (!columnIndex.containsKey(column)) {
                added.add(column);
            }
        }
        List<String> newColumns = new ArrayList<>(columns);
        newColumns.addAll(added);

        int rowTotal = Math.max(rows.size(), other.rows.size());
        List<List<String>> newRows = new ArrayList<>(rowTotal);
        for (int r = 0; r < rowTotal; r++) {
            List<String> newRow = new ArrayList<>(newColumns.size());
            for (int c = 0; c < columns.size(); c++) {
                newRow.add(r < rows.size() ? rows.get(r).get(c) : null);
            }
            for (String column : added) {
                newRow.add(r < other.rows.size() ? other.get(r, column) : null);
            }
            newRows.add(newRow);
        }
        return new Dataset(newColumns, newRows);
    }

    private static void appendAligned(Dataset source, List<String> columns, List<List<String>> target) {
        for (List<String> row : source.rows) {
            List<String> aligned = new ArrayList<>(columns.size());
            for (String column : columns) {
                Integer idx = source.columnIndex.get(column);
                aligned.add(idx != null ? row.get(idx) : null);
            }
            target.add(aligned);
        }
    }

    private static String concatenate(List<String> row, int[] sourceIdx, String separator) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < sourceIdx.length; i++) {
            String cell = row.get(sourceIdx[i]);
            if (cell == null) {
                return null;
            }
            if (i > 0) {
                sb.append(separator);
            }
            sb.append(cell);
        }
        return sb.toString();
    }

    private int requireColumn(String column) {
        Integer idx = columnIndex.get(column);
        if (idx == null) {
            throw new IllegalArgumentException("Unknown column: " + column + " (available: " + columns + ")");
        }
        return idx;
    }

    @Override
    public String toString() {
        return "Dataset{columns=" + columns + ", rows=" + rows.size() + '}';
    }
}
