package com.record.linkage.similarity;

import com.record.linkage.core.model.AlgorithmType;

import java.util.ArrayList;
import java.util.List;

/**
 * Cosine similarity of TF-IDF weighted word vectors.
 *
 * <p>Term frequency is the raw count, inverse document frequency is smoothed:
 * {@code idf(t) = ln((1 + N) / (1 + df(t))) + 1}, where {@code N} counts corpus and query documents.
 * Vectors are scaled to unit length, so the dot product is the cosine.</p>
 */
public class TfIdfMatcher extends AbstractVectorMatchingAlgorithm {

    @Override
    public AlgorithmType type() {
        return AlgorithmType.TFIDF;
    }

    @Override
    protected TermAnalyzer analyzer() {
        return TermAnalyzer.words();
    }

    @Override
    protected Vectors weigh(Vocabulary vocabulary, Vectors counts) {
        int[] documentFrequency = new int[vocabulary.size()];
        countDocuments(counts.reference(), documentFrequency);
        countDocuments(counts.queries(), documentFrequency);

        int documents = counts.reference().size() + counts.queries().size();
        double[] idf = new double[vocabulary.size()];
        for (int t = 0; t < idf.length; t++) {
            idf[t] = Math.log((1.0 + documents) / (1.0 + documentFrequency[t])) + 1.0;
        }
        return new Vectors(normalize(counts.reference(), idf), normalize(counts.queries(), idf));
    }

    @Override
    protected double combine(double queryWeight, double referenceWeight) {
        return queryWeight * referenceWeight;
    }

    @Override
    protected double similarity(double overlap, SparseVector query, SparseVector reference) {
        double normProduct = query.norm() * reference.norm();
        return normProduct > 0.0 ? overlap / normProduct : 0.0;
    }

    private static void countDocuments(List<SparseVector> vectors, int[] documentFrequency) {
        for (SparseVector vector : vectors) {
            for (int i = 0; i < vector.nnz(); i++) {
                documentFrequency[vector.indexAt(i)]++;
            }
        }
    }

    private static List<SparseVector> normalize(List<SparseVector> vectors, double[] idf) {
        List<SparseVector> weighted = new ArrayList<>(vectors.size());
        for (SparseVector vector : vectors) {
            weighted.add(vector.reweighAndNormalize(idf));
        }
        return List.copyOf(weighted);
    }
}
