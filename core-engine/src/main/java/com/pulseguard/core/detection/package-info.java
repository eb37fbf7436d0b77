/**
 * Online anomaly detection for numeric streams.
 *
 * <p>
 * {@link com.pulseguard.core.detection.StreamAnomalyDetector} combines an
 * exponential moving average baseline with a median-absolute-deviation
 * dispersion estimate and flags observations by modified z-score. Residual
 * retention is pluggable through
 * {@link com.pulseguard.core.detection.HistoryMode}; the residual baseline is
 * selected by {@link com.pulseguard.core.detection.ScoringMode}.
 * </p>
 *
 * @since 1.0.0
 */
package com.pulseguard.core.detection;
