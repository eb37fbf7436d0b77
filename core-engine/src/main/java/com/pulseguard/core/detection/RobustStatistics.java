package com.pulseguard.core.detection;

import java.util.Arrays;
import java.util.Objects;

/**
 * Order-statistic helpers used for the dispersion estimate.
 *
 * <p>
 * Sort-based; inputs are small (bounded by the detector window) so no
 * selection algorithm is needed. Inputs are never modified.
 * </p>
 *
 * @since 1.0.0
 */
public final class RobustStatistics {

    /** Rescales MAD to the standard deviation of a normal distribution. */
    public static final double MAD_NORMAL_CONSISTENCY = 0.6745;

    private RobustStatistics() {
        // utility class — not instantiable
    }

    /**
     * Median of {@code values[from, to)}. For an even count this is the mean
     * of the two middle order statistics.
     *
     * @param values source array; must not be {@code null}
     * @param from   inclusive start index
     * @param to     exclusive end index
     * @return the median
     * @throws IllegalArgumentException if the range is empty
     */
    public static double median(double[] values, int from, int to) {
        Objects.requireNonNull(values, "Values must not be null");
        if (to <= from) {
            throw new IllegalArgumentException("Cannot take the median of an empty range");
        }
        double[] sorted = Arrays.copyOfRange(values, from, to);
        Arrays.sort(sorted);
        int n = sorted.length;
        int mid = n / 2;
        // Halve before adding so two large middle values cannot overflow
        return (n % 2 == 1) ? sorted[mid] : sorted[mid - 1] / 2.0 + sorted[mid] / 2.0;
    }

    public static double median(double[] values) {
        Objects.requireNonNull(values, "Values must not be null");
        return median(values, 0, values.length);
    }

    /**
     * Median absolute deviation of {@code values[from, to)} around the
     * median of that same range. Deviations beyond the double range are
     * saturated at {@link Double#MAX_VALUE}, so the result stays finite for
     * finite input.
     *
     * @param values source array; must not be {@code null}
     * @param from   inclusive start index
     * @param to     exclusive end index
     * @return the MAD, always {@code >= 0}
     * @throws IllegalArgumentException if the range is empty
     */
    public static double medianAbsoluteDeviation(double[] values, int from, int to) {
        double centre = median(values, from, to);
        double[] deviations = new double[to - from];
        for (int i = from; i < to; i++) {
            deviations[i - from] = Math.min(Math.abs(values[i] - centre), Double.MAX_VALUE);
        }
        return median(deviations);
    }

    public static double medianAbsoluteDeviation(double[] values) {
        Objects.requireNonNull(values, "Values must not be null");
        return medianAbsoluteDeviation(values, 0, values.length);
    }
}
