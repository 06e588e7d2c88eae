package com.record.linkage.similarity;

import com.record.linkage.core.model.TextRecord;

import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Term-to-index mapping fitted on one corpus/query pair so that the vectors of both are comparable.
 * Ids are assigned in order of first appearance. Immutable once fitted.
 */
public final class Vocabulary {

    private final TermAnalyzer analyzer;
    private final Map<String, Integer> termIds;

    private Vocabulary(TermAnalyzer analyzer, Map<String, Integer> termIds) {
        this.analyzer = analyzer;
        this.termIds = Collections.unmodifiableMap(termIds);
    }

    /**
     * Fits a vocabulary on the normalized text of all given record lists.
     */
    @SafeVarargs
    public static Vocabulary fit(TermAnalyzer analyzer, List<TextRecord>... sources) {
        Map<String, Integer> ids = new LinkedHashMap<>();
        for (List<TextRecord> source : sources) {
            for (TextRecord record : source) {
                for (String term : analyzer.terms(record.normalized())) {
                    ids.putIfAbsent(term, ids.size());
                }
            }
        }
        return new Vocabulary(analyzer, ids);
    }

    public int size() {
        return termIds.size();
    }

    /**
     * Returns the id of a term, or -1 if the term was not seen while fitting.
     */
    public int indexOf(String term) {
        Integer id = termIds.get(term);
        return id != null ? id : -1;
    }

    /**
     * Builds the term-count vector of a text. Unknown terms are ignored.
     *
     * @param binary if true every present term counts once
     */
    public SparseVector vectorize(String text, boolean binary) {
        Map<Integer, Double> counts = new HashMap<>();
        for (String term : analyzer.terms(text)) {
            int id = indexOf(term);
            if (id >= 0) {
                if (binary) {
                    counts.put(id, 1.0);
                } else {
                    counts.merge(id, 1.0, Double::sum);
                }
            }
        }
        return SparseVector.of(counts);
    }
}
