package com.record.linkage.evaluation;

import java.util.EnumMap;
import java.util.Map;

/**
 * Metric values computed from one confusion matrix.
 * Precision, recall and F1 are 0 when their denominator is 0. ROC-AUC is {@code NaN} when the
 * ground truth contains a single class.
 */
public record MetricSet(double accuracy, double precision, double recall, double f1Score, double rocAuc) {

    public static MetricSet from(ConfusionMatrix cm) {
        long n = cm.total();
        double accuracy = n == 0 ? 0.0 : (double) (cm.truePositives() + cm.trueNegatives()) / n;
        double precision = ratio(cm.truePositives(), cm.truePositives() + cm.falsePositives());
        double recall = ratio(cm.truePositives(), cm.actualPositives());
        double f1 = precision + recall == 0.0 ? 0.0 : 2 * precision * recall / (precision + recall);

        double rocAuc;
        if (cm.actualPositives() == 0 || cm.actualNegatives() == 0) {
            rocAuc = Double.NaN;
        } else {
            // a single operating point: area under the two-segment curve through (FPR, TPR)
            double tpr = (double) cm.truePositives() / cm.actualPositives();
            double tnr = (double) cm.trueNegatives() / cm.actualNegatives();
            rocAuc = (tpr + tnr) / 2.0;
        }
        return new MetricSet(accuracy, precision, recall, f1, rocAuc);
    }

    public double get(Metric metric) {
        return switch (metric) {
            case ACCURACY -> accuracy;
            case PRECISION -> precision;
            case RECALL -> recall;
            case F1_SCORE -> f1Score;
            case ROC_AUC -> rocAuc;
        };
    }

    public Map<Metric, Double> asMap() {
        Map<Metric, Double> values = new EnumMap<>(Metric.class);
        for (Metric metric : Metric.values()) {
            values.put(metric, get(metric));
        }
        return values;
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }
}
