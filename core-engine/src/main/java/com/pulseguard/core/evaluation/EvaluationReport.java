package com.pulseguard.core.evaluation;

import java.util.Locale;

/**
 * Confusion-matrix counts and the derived precision, recall and F1 score.
 *
 * <p>
 * A ratio whose denominator is zero is reported as {@code 0}.
 * </p>
 *
 * @since 1.0.0
 */
public final class EvaluationReport {

    private final long truePositives;
    private final long falsePositives;
    private final long falseNegatives;
    private final long trueNegatives;

    public EvaluationReport(long truePositives, long falsePositives,
            long falseNegatives, long trueNegatives) {
        this.truePositives = truePositives;
        this.falsePositives = falsePositives;
        this.falseNegatives = falseNegatives;
        this.trueNegatives = trueNegatives;
    }

    public double precision() {
        return ratio(truePositives, truePositives + falsePositives);
    }

    public double recall() {
        return ratio(truePositives, truePositives + falseNegatives);
    }

    public double f1() {
        double p = precision();
        double r = recall();
        return (p + r) == 0 ? 0.0 : 2 * p * r / (p + r);
    }

    public long total() {
        return truePositives + falsePositives + falseNegatives + trueNegatives;
    }

    public long getTruePositives() {
        return truePositives;
    }

    public long getFalsePositives() {
        return falsePositives;
    }

    public long getFalseNegatives() {
        return falseNegatives;
    }

    public long getTrueNegatives() {
        return trueNegatives;
    }

    private static double ratio(long numerator, long denominator) {
        return denominator == 0 ? 0.0 : (double) numerator / denominator;
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT,
                "EvaluationReport{tp=%d, fp=%d, fn=%d, tn=%d, precision=%.2f, recall=%.2f, f1=%.2f}",
                truePositives, falsePositives, falseNegatives, trueNegatives,
                precision(), recall(), f1());
    }
}
