package com.record.linkage.similarity;

import java.util.Locale;

/**
 * Substring containment in either direction, case-insensitive.
 * Returns 1.0 when one string contains the other and 0.0 otherwise.
 */
public class ContainmentSimilarity implements SimilarityAlgorithm {

    @Override
    public double compute(String s1, String s2) {
        return contains(s1, s2) ? 1.0 : 0.0;
    }

    /**
     * Returns true if either non-empty string contains the other.
     */
    public boolean contains(String s1, String s2) {
        if (s1 == null || s2 == null || s1.isEmpty() || s2.isEmpty()) {
            return false;
        }
        String a = s1.toLowerCase(Locale.ROOT);
        String b = s2.toLowerCase(Locale.ROOT);
        return a.contains(b) || b.contains(a);
    }

    @Override
    public String getName() {
        return "Containment";
    }
}
