package com.record.linkage.similarity;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Splits normalized text into the terms that make up its vector representation.
 */
@FunctionalInterface
public interface TermAnalyzer {

    Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    /**
     * Returns the terms of the text in order, with repetitions.
     */
    List<String> terms(String text);

    /**
     * Whitespace-separated tokens.
     */
    static TermAnalyzer words() {
        return text -> {
            List<String> tokens = new ArrayList<>();
            for (String token : WHITESPACE.split(text)) {
                if (!token.isEmpty()) {
                    tokens.add(token);
                }
            }
            return tokens;
        };
    }

    /**
     * Overlapping character n-grams over the whole text, runs of whitespace collapsed to one space.
     * Texts shorter than {@code n} code points have no n-grams.
     */
    static TermAnalyzer charNGrams(int n) {
        if (n <= 0) {
            throw new IllegalArgumentException("n must be positive");
        }
        return text -> {
            int[] codePoints = WHITESPACE.matcher(text).replaceAll(" ").codePoints().toArray();
            List<String> grams = new ArrayList<>(Math.max(0, codePoints.length - n + 1));
            for (int i = 0; i + n <= codePoints.length; i++) {
                grams.add(new String(codePoints, i, n));
            }
            return grams;
        };
    }
}
