package com.pulseguard.core.detection;

import java.util.Arrays;

/**
 * Append-only residual history that never discards anything.
 *
 * <p>
 * Memory grows linearly with the stream length; use
 * {@link RingBufferResidualHistory} for long-lived streams.
 * </p>
 */
final class UnboundedResidualHistory implements ResidualHistory {

    private static final long serialVersionUID = 1L;
    private static final int INITIAL_CAPACITY = 64;

    private final int windowSize;
    private double[] residuals;
    private int count;

    UnboundedResidualHistory(int windowSize) {
        this.windowSize = windowSize;
        this.residuals = new double[Math.max(INITIAL_CAPACITY, windowSize)];
    }

    @Override
    public void append(double residual) {
        if (count == residuals.length) {
            residuals = Arrays.copyOf(residuals, residuals.length * 2);
        }
        residuals[count++] = residual;
    }

    @Override
    public long size() {
        return count;
    }

    @Override
    public double dispersion() {
        if (count == 0) {
            return 0.0;
        }
        int from = count < windowSize ? 0 : count - windowSize;
        return RobustStatistics.medianAbsoluteDeviation(residuals, from, count);
    }

    @Override
    public double[] retained() {
        return Arrays.copyOf(residuals, count);
    }
}
