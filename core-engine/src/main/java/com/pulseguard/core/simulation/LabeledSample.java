package com.pulseguard.core.simulation;

/**
 * One synthetic observation together with its ground-truth label.
 *
 * @since 1.0.0
 */
public final class LabeledSample {

    private final long index;
    private final double value;
    private final boolean anomalous;

    public LabeledSample(long index, double value, boolean anomalous) {
        this.index = index;
        this.value = value;
        this.anomalous = anomalous;
    }

    public long getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    /** @return {@code true} if an anomaly was injected into this sample */
    public boolean isAnomalous() {
        return anomalous;
    }

    @Override
    public String toString() {
        return "LabeledSample{index=" + index + ", value=" + value + ", anomalous=" + anomalous + '}';
    }
}
