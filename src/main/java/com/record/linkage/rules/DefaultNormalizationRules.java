package com.record.linkage.rules;

import java.util.List;

/**
 * Built-in replacement rules for German street and person data.
 * Abbreviations run before diacritic folding so that patterns containing
 * diacritics are not broken up by the folding step.
 */
public final class DefaultNormalizationRules {

    static final int ABBREVIATION_PRIORITY = 10;
    static final int FOLDING_PRIORITY = 20;

    private DefaultNormalizationRules() {
        // Utility class
    }

    /**
     * Creates a NormalizationEngine with all default rules.
     */
    public static NormalizationEngine createDefaultEngine() {
        NormalizationEngine engine = new NormalizationEngine();
        engine.addRules(getAbbreviationRules());
        engine.addRules(getFoldingRules());
        return engine;
    }

    /**
     * Gets abbreviation expansions.
     */
    public static List<NormalizationRule> getAbbreviationRules() {
        return List.of(
                // "Schlossstr." -> "Schlossstrasse"
                NormalizationRule.builder()
                        .name("abbreviation-str")
                        .pattern("str\\.")
                        .replacement("strasse")
                        .priority(ABBREVIATION_PRIORITY)
                        .build()
        );
    }

    /**
     * Gets umlaut and sharp-s folding rules.
     */
    public static List<NormalizationRule> getFoldingRules() {
        return List.of(
                fold("fold-ae", "ä", "ae"),
                fold("fold-oe", "ö", "oe"),
                fold("fold-ue", "ü", "ue"),
                fold("fold-capital-sharp-s", "ẞ", "ss"),
                fold("fold-sharp-s", "ß", "ss")
        );
    }

    private static NormalizationRule fold(String name, String character, String replacement) {
        return NormalizationRule.builder()
                .name(name)
                .literal(character)
                .replacement(replacement)
                .priority(FOLDING_PRIORITY)
                .build();
    }
}
