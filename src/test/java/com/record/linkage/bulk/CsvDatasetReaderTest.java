package com.record.linkage.bulk;

import com.record.linkage.core.model.Dataset;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CsvDatasetReaderTest {

    private final CsvDatasetReader reader = new CsvDatasetReader();

    @Test
    @DisplayName("Should read a semicolon separated table with header")
    void readsTable() {
        String csv = """
                FIRSTNAME;LASTNAME;STREET
                Anna;Schmidt;Hauptstraße 1
                Jörg;Müller;Schlossstr. 12
                """;

        Dataset dataset = reader.read(new StringReader(csv));

        assertEquals(List.of("FIRSTNAME", "LASTNAME", "STREET"), dataset.columns());
        assertEquals(2, dataset.rowCount());
        assertEquals("Schlossstr. 12", dataset.get(1, "STREET"));
    }

    @Test
    @DisplayName("Should handle quoted values")
    void quotedValues() {
        String csv = "A;B\n\"x;y\";\"Big \"\"Blue\"\"\"\n\"multi\nline\";plain\n";

        Dataset dataset = reader.read(new StringReader(csv));

        assertEquals(2, dataset.rowCount());
        assertEquals("x;y", dataset.get(0, "A"));
        assertEquals("Big \"Blue\"", dataset.get(0, "B"));
        assertEquals("multi\nline", dataset.get(1, "A"));
    }

    @Test
    @DisplayName("Empty unquoted cells are missing, empty quoted cells are empty strings")
    void missingCells() {
        Dataset dataset = reader.read(new StringReader("A;B;C\n;\"\";x\n1\n"));

        assertEquals(Arrays.asList(null, "", "x"), dataset.row(0));
        assertEquals(Arrays.asList("1", null, null), dataset.row(1));
    }

    @Test
    @DisplayName("Should accept CRLF line endings, a byte order mark and skip blank lines")
    void lineEndings() {
        Dataset dataset = reader.read(new StringReader("\uFEFFA;B\r\n1;2\r\n\r\n3;4"));

        assertEquals(List.of("A", "B"), dataset.columns());
        assertEquals(2, dataset.rowCount());
        assertEquals("4", dataset.get(1, "B"));
    }

    @Test
    @DisplayName("Should read UTF-8 streams")
    void stream() {
        byte[] bytes = "NAME\nMüller\n".getBytes(StandardCharsets.UTF_8);
        assertEquals("Müller", reader.read(new ByteArrayInputStream(bytes)).get(0, "NAME"));
    }

    @Test
    @DisplayName("Should honour a custom delimiter")
    void customDelimiter() {
        Dataset dataset = new CsvDatasetReader(',').read(new StringReader("A,B\n1,2\n"));
        assertEquals("2", dataset.get(0, "B"));
    }

    @Test
    @DisplayName("Empty input should yield an empty table")
    void emptyInput() {
        Dataset dataset = reader.read(new StringReader(""));
        assertTrue(dataset.columns().isEmpty());
        assertTrue(dataset.isEmpty());
    }

    @Test
    @DisplayName("Should reject rows wider than the header and unterminated quotes")
    void malformed() {
        assertThrows(IllegalArgumentException.class, () -> reader.read(new StringReader("A\n1;2\n")));
        assertThrows(UncheckedIOException.class, () -> reader.read(new StringReader("A\n\"open\n")));
    }

    @Test
    @DisplayName("Should read files and fail for missing ones")
    void files(@TempDir Path dir) throws Exception {
        Path file = dir.resolve("people.csv");
        Files.writeString(file, "NAME\nAnna\n", StandardCharsets.UTF_8);

        assertEquals("Anna", reader.read(file).get(0, "NAME"));
        assertThrows(UncheckedIOException.class, () -> reader.read(dir.resolve("missing.csv")));
    }
}
