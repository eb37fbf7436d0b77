package com.pulseguard.core.evaluation;

import java.util.List;
import java.util.Objects;

/**
 * Accumulates predicted verdicts against ground-truth labels, index for
 * index, and summarises them as an {@link EvaluationReport}.
 *
 * <p>
 * Not thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectionEvaluator {

    private long truePositives;
    private long falsePositives;
    private long falseNegatives;
    private long trueNegatives;

    /**
     * Record one aligned pair.
     *
     * @param actual    ground-truth label
     * @param predicted detector verdict
     */
    public void record(boolean actual, boolean predicted) {
        if (actual && predicted) {
            truePositives++;
        } else if (predicted) {
            falsePositives++;
        } else if (actual) {
            falseNegatives++;
        } else {
            trueNegatives++;
        }
    }

    /** @return a snapshot of the counts recorded so far */
    public EvaluationReport report() {
        return new EvaluationReport(truePositives, falsePositives, falseNegatives, trueNegatives);
    }

    /**
     * Score two label sequences. When their lengths differ the longer one is
     * truncated so that only aligned positions are compared.
     *
     * @param actual    ground-truth labels; must not be {@code null}
     * @param predicted detector verdicts; must not be {@code null}
     * @return the report for the aligned prefix
     */
    public static EvaluationReport evaluate(List<Boolean> actual, List<Boolean> predicted) {
        Objects.requireNonNull(actual, "Ground-truth labels must not be null");
        Objects.requireNonNull(predicted, "Predictions must not be null");

        DetectionEvaluator evaluator = new DetectionEvaluator();
        int aligned = Math.min(actual.size(), predicted.size());
        for (int i = 0; i < aligned; i++) {
            evaluator.record(actual.get(i), predicted.get(i));
        }
        return evaluator.report();
    }
}
