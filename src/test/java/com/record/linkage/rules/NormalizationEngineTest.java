package com.record.linkage.rules;

import com.record.linkage.core.model.Dataset;
import com.record.linkage.core.model.TextRecord;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NormalizationEngineTest {

    private NormalizationEngine engine;

    @BeforeEach
    void setUp() {
        engine = DefaultNormalizationRules.createDefaultEngine();
    }

    @Test
    @DisplayName("Should handle null and blank inputs")
    void testNullAndBlankInputs() {
        assertEquals("", engine.normalize(null));
        assertEquals("", engine.normalize(""));
        assertEquals("", engine.normalize("   "));
        assertEquals("", engine.normalize(" - "));
    }

    @ParameterizedTest
    @DisplayName("Should fold umlauts and sharp s")
    @CsvSource({
            "Hauptstraße 1,hauptstrasse 1",
            "Müller,mueller",
            "ÄÖÜ,aeoeue",
            "Größe,groesse",
            "GROẞE,grosse"
    })
    void testFolding(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @ParameterizedTest
    @DisplayName("Should expand the street abbreviation")
    @CsvSource({
            "Schlossstr.,schlossstrasse",
            "Hauptstr. 5,hauptstrasse 5",
            "BAHNHOFSTR.,bahnhofstrasse"
    })
    void testAbbreviation(String input, String expected) {
        assertEquals(expected, engine.normalize(input));
    }

    @Test
    @DisplayName("Should lowercase, trim and drop punctuation")
    void testPunctuationAndCase() {
        assertEquals("muellerluedenscheidt", engine.normalize("  Müller-Lüdenscheidt "));
        assertEquals("hello  world", engine.normalize("Hello,  World!"));
        assertEquals("st strasse", engine.normalize("St. Str."));
        assertEquals("a", engine.normalize("a -"));
    }

    @ParameterizedTest
    @DisplayName("Normalization should be idempotent")
    @ValueSource(strings = {
            "Schlossstr.", "Hauptstraße 1", "  Müller-Lüdenscheidt ", "a -", "- a", "Str.Str.",
            "ÄÖÜß", "Hello,  World!", "12 / 3b", "\tTabs\tand\nnewlines\n", "Ünïcödé ☃ text"
    })
    void testIdempotence(String input) {
        String once = engine.normalize(input);
        assertEquals(once, engine.normalize(once));
    }

    @Test
    @DisplayName("Should check equivalence after normalization")
    void testAreEquivalent() {
        assertTrue(engine.areEquivalent("Schlossstr.", "Schlossstraße"));
        assertTrue(engine.areEquivalent("MÜLLER", "mueller"));
        assertFalse(engine.areEquivalent("Mueller", "Muller"));
    }

    @Test
    @DisplayName("Should normalize a column keeping row positions")
    void testNormalizeColumn() {
        Dataset dataset = Dataset.of(List.of("NAME"), List.of(
                List.of("Müller"),
                Arrays.asList((String) null),
                List.of("Straße")));

        List<TextRecord> records = engine.normalizeColumn(dataset, "NAME");

        assertEquals(3, records.size());
        assertEquals(new TextRecord(0, "Müller", "mueller"), records.get(0));
        assertEquals(new TextRecord(1, "", ""), records.get(1));
        assertTrue(records.get(1).isBlank());
        assertEquals("strasse", records.get(2).normalized());
    }

    @Test
    @DisplayName("Should reject unknown columns")
    void testNormalizeUnknownColumn() {
        Dataset dataset = Dataset.ofColumn("NAME", List.of("a"));
        assertThrows(IllegalArgumentException.class, () -> engine.normalizeColumn(dataset, "STREET"));
    }

    @Test
    @DisplayName("Should apply rules in priority order")
    void testRulePriority() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.builder()
                .name("second").literal("b").replacement("c").priority(20).build());
        custom.addRule(NormalizationRule.builder()
                .name("first").literal("a").replacement("b").priority(10).build());

        assertEquals("c", custom.normalize("a"));
        assertEquals("first", custom.getRules().get(0).getName());
    }

    @Test
    @DisplayName("Should add and remove rules by name")
    void testAddRemoveRule() {
        NormalizationEngine custom = new NormalizationEngine();
        custom.addRule(NormalizationRule.builder()
                .name("weg").pattern("\\bwg\\b").replacement("weg").build());

        assertEquals("am weg", custom.normalize("Am Wg"));
        assertTrue(custom.removeRule("weg"));
        assertFalse(custom.removeRule("weg"));
        assertEquals("am wg", custom.normalize("Am Wg"));
    }

    @Test
    @DisplayName("Literal rules should not interpret regex characters")
    void testLiteralRule() {
        NormalizationRule rule = NormalizationRule.builder()
                .name("dot").literal(".").replacement(" ").build();
        assertEquals("a b", rule.apply("a.b"));
        assertEquals("ab", rule.apply("ab"));
        assertNull(rule.apply(null));
    }

    @Test
    @DisplayName("Should require name, pattern and replacement")
    void testRuleBuilderValidation() {
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().literal("a").replacement("b").build());
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().name("x").replacement("b").build());
        assertThrows(NullPointerException.class, () -> NormalizationRule.builder().name("x").literal("a").build());
    }
}
