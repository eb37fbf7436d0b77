package com.pulseguard.core.detection;

import java.io.Serializable;

/**
 * Ordered residual store backing a {@link StreamAnomalyDetector}.
 *
 * <p>
 * The dispersion is the median absolute deviation over the whole history
 * while fewer than {@code windowSize} residuals have been appended, and over
 * the trailing {@code windowSize} residuals from then on.
 * </p>
 */
interface ResidualHistory extends Serializable {

    void append(double residual);

    /** @return number of residuals appended since construction */
    long size();

    /** @return MAD of the active window, {@code 0} when empty */
    double dispersion();

    /** @return copy of the retained residuals, oldest first */
    double[] retained();
}
