package com.pulseguard.core.detection;

import java.io.Serializable;

/**
 * Outcome of scoring a single observation, with the statistics behind the
 * verdict.
 *
 * @since 1.0.0
 */
public final class DetectionResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long index;
    private final double value;
    private final double baseline;
    private final double residual;
    private final double mad;
    private final double modifiedZScore;
    private final boolean anomalous;

    DetectionResult(long index, double value, double baseline, double residual,
            double mad, double modifiedZScore, boolean anomalous) {
        this.index = index;
        this.value = value;
        this.baseline = baseline;
        this.residual = residual;
        this.mad = mad;
        this.modifiedZScore = modifiedZScore;
        this.anomalous = anomalous;
    }

    /** @return zero-based position of the observation in its stream */
    public long getIndex() {
        return index;
    }

    public double getValue() {
        return value;
    }

    /** @return the EMA the residual was measured against */
    public double getBaseline() {
        return baseline;
    }

    public double getResidual() {
        return residual;
    }

    public double getMad() {
        return mad;
    }

    public double getModifiedZScore() {
        return modifiedZScore;
    }

    public boolean isAnomalous() {
        return anomalous;
    }

    @Override
    public String toString() {
        return "DetectionResult{" +
                "index=" + index +
                ", value=" + value +
                ", baseline=" + baseline +
                ", residual=" + residual +
                ", mad=" + mad +
                ", modifiedZScore=" + modifiedZScore +
                ", anomalous=" + anomalous +
                '}';
    }
}
