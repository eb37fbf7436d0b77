package com.pulseguard.core.detection;

/**
 * Fixed-capacity residual history holding only the trailing window.
 *
 * <p>
 * Before the window fills up the buffer still contains the entire history,
 * so the dispersion matches {@link UnboundedResidualHistory} at every step.
 * </p>
 */
final class RingBufferResidualHistory implements ResidualHistory {

    private static final long serialVersionUID = 1L;

    private final double[] buffer;

    /** Slot the next residual is written to. */
    private int next;

    private long count;

    RingBufferResidualHistory(int windowSize) {
        this.buffer = new double[windowSize];
    }

    @Override
    public void append(double residual) {
        buffer[next] = residual;
        next = (next + 1) % buffer.length;
        count++;
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
        return RobustStatistics.medianAbsoluteDeviation(retained());
    }

    @Override
    public double[] retained() {
        int filled = (int) Math.min(count, buffer.length);
        double[] ordered = new double[filled];
        int oldest = filled < buffer.length ? 0 : next;
        for (int i = 0; i < filled; i++) {
            ordered[i] = buffer[(oldest + i) % buffer.length];
        }
        return ordered;
    }
}
