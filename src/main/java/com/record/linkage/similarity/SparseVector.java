package com.record.linkage.similarity;

import java.util.Arrays;
import java.util.Map;
import java.util.TreeMap;

/**
 * Immutable sparse vector over a {@link Vocabulary}, indices in ascending order.
 */
public final class SparseVector {

    private static final SparseVector EMPTY = new SparseVector(new int[0], new double[0]);

    private final int[] indices;
    private final double[] values;
    private final double sum;
    private final double norm;

    private SparseVector(int[] indices, double[] values) {
        this.indices = indices;
        this.values = values;
        double s = 0.0;
        double sq = 0.0;
        for (double v : values) {
            s += v;
            sq += v * v;
        }
        this.sum = s;
        this.norm = Math.sqrt(sq);
    }

    /**
     * Creates a vector from term id to weight. Zero weights are dropped.
     */
    public static SparseVector of(Map<Integer, Double> weights) {
        TreeMap<Integer, Double> sorted = new TreeMap<>(weights);
        sorted.values().removeIf(v -> v == 0.0);
        if (sorted.isEmpty()) {
            return EMPTY;
        }
        int[] idx = new int[sorted.size()];
        double[] val = new double[sorted.size()];
        int i = 0;
        for (Map.Entry<Integer, Double> e : sorted.entrySet()) {
            idx[i] = e.getKey();
            val[i] = e.getValue();
            i++;
        }
        return new SparseVector(idx, val);
    }

    public static SparseVector empty() {
        return EMPTY;
    }

    /**
     * Number of non-zero entries.
     */
    public int nnz() {
        return indices.length;
    }

    public boolean isEmpty() {
        return indices.length == 0;
    }

    public int indexAt(int position) {
        return indices[position];
    }

    public double valueAt(int position) {
        return values[position];
    }

    /**
     * Sum of all weights; the multiset size for count vectors.
     */
    public double sum() {
        return sum;
    }

    /**
     * Euclidean length.
     */
    public double norm() {
        return norm;
    }

    /**
     * Returns a copy with every weight multiplied by the weight of its index in {@code factors}
     * and then scaled to unit length. An empty vector stays empty.
     */
    public SparseVector reweighAndNormalize(double[] factors) {
        if (isEmpty()) {
            return this;
        }
        double[] scaled = new double[values.length];
        double sq = 0.0;
        for (int i = 0; i < values.length; i++) {
            scaled[i] = values[i] * factors[indices[i]];
            sq += scaled[i] * scaled[i];
        }
        double length = Math.sqrt(sq);
        if (length == 0.0) {
            return EMPTY;
        }
        for (int i = 0; i < scaled.length; i++) {
            scaled[i] /= length;
        }
        return new SparseVector(indices.clone(), scaled);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        SparseVector that = (SparseVector) o;
        return Arrays.equals(indices, that.indices) && Arrays.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(indices) + Arrays.hashCode(values);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("SparseVector{");
        for (int i = 0; i < indices.length; i++) {
            if (i > 0) sb.append(", ");
            sb.append(indices[i]).append('=').append(values[i]);
        }
        return sb.append('}').toString();
    }
}
