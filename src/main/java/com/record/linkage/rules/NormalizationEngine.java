package com.record.linkage.rules;

import com.record.linkage.core.model.Dataset;
import com.record.linkage.core.model.TextRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Engine that turns free text into its canonical comparison form.
 *
 * <p>Steps, in order:</p>
 * <ol>
 *   <li>replacement rules in priority order (lower number first)</li>
 *   <li>lower-casing</li>
 *   <li>trimming of leading and trailing whitespace</li>
 *   <li>removal of every character that is neither a letter, a digit nor whitespace</li>
 * </ol>
 * The result is trimmed once more so that {@code normalize(normalize(x)).equals(normalize(x))}.
 */
public class NormalizationEngine {
    private static final Logger log = LoggerFactory.getLogger(NormalizationEngine.class);

    private static final Pattern EDGE_WHITESPACE =
            Pattern.compile("^\\s+|\\s+$", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern NON_ALPHANUMERIC =
            Pattern.compile("[^\\p{L}\\p{N}\\s]", Pattern.UNICODE_CHARACTER_CLASS);

    private final List<NormalizationRule> rules;

    public NormalizationEngine() {
        this.rules = new ArrayList<>();
    }

    public NormalizationEngine(List<NormalizationRule> rules) {
        this.rules = new ArrayList<>(rules);
        sortRules();
    }

    /**
     * Adds a rule to the engine.
     */
    public void addRule(NormalizationRule rule) {
        rules.add(rule);
        sortRules();
    }

    /**
     * Adds multiple rules to the engine.
     */
    public void addRules(List<NormalizationRule> newRules) {
        rules.addAll(newRules);
        sortRules();
    }

    /**
     * Removes a rule by name.
     */
    public boolean removeRule(String ruleName) {
        return rules.removeIf(r -> r.getName().equals(ruleName));
    }

    /**
     * Gets all rules currently in the engine.
     */
    public List<NormalizationRule> getRules() {
        return List.copyOf(rules);
    }

    /**
     * Normalizes the given text. {@code null} is treated as the empty string.
     */
    public String normalize(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }

        String result = text;
        for (NormalizationRule rule : rules) {
            String before = result;
            result = rule.apply(result);
            if (log.isTraceEnabled() && !before.equals(result)) {
                log.trace("Rule '{}' transformed '{}' -> '{}'", rule.getName(), before, result);
            }
        }

        result = strip(result.toLowerCase(Locale.ROOT));
        result = NON_ALPHANUMERIC.matcher(result).replaceAll("");
        return strip(result);
    }

    /**
     * Normalizes one column of a table into records keyed by row position.
     * Missing cells become empty records.
     *
     * @throws IllegalArgumentException if the column does not exist
     */
    public List<TextRecord> normalizeColumn(Dataset dataset, String column) {
        return normalizeAll(dataset.column(column));
    }

    /**
     * Normalizes plain values into records keyed by list position.
     */
    public List<TextRecord> normalizeAll(List<String> values) {
        List<TextRecord> records = new ArrayList<>(values.size());
        for (int i = 0; i < values.size(); i++) {
            String original = values.get(i) != null ? values.get(i) : "";
            records.add(new TextRecord(i, original, normalize(original)));
        }
        return records;
    }

    /**
     * Checks if two texts are equal after normalization.
     */
    public boolean areEquivalent(String text1, String text2) {
        return normalize(text1).equals(normalize(text2));
    }

    private static String strip(String value) {
        return EDGE_WHITESPACE.matcher(value).replaceAll("");
    }

    private void sortRules() {
        // stable sort keeps insertion order within a priority
        rules.sort(Comparator.comparingInt(NormalizationRule::getPriority));
    }
}
