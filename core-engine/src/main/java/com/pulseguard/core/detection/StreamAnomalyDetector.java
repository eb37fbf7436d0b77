package com.pulseguard.core.detection;

import com.pulseguard.core.config.DetectorSettings;
import com.pulseguard.core.model.Alert;
import com.pulseguard.core.model.Reading;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalDouble;

/**
 * Online anomaly detector for a single numeric stream.
 *
 * <p>
 * Tracks an exponential moving average of the stream as its baseline and the
 * median absolute deviation (MAD) of the residuals around it as a robust
 * dispersion estimate. Each observation is scored with the modified z-score
 * {@code 0.6745 * residual / MAD} and flagged when its magnitude exceeds the
 * threshold.
 * </p>
 *
 * <h3>Per-observation steps</h3>
 * <ol>
 * <li>First observation: the EMA is seeded with it, a residual of {@code 0}
 * is recorded and the verdict is always {@code false}.</li>
 * <li>{@code ema = alpha * value + (1 - alpha) * ema}</li>
 * <li>{@code residual = value - ema}, against the updated EMA in
 * {@link ScoringMode#SELF_INCLUSIVE} mode or the previous one in
 * {@link ScoringMode#PRE_UPDATE} mode.</li>
 * <li>MAD over all residuals while fewer than {@code windowSize} exist, over
 * the trailing {@code windowSize} afterwards.</li>
 * <li>A MAD of {@code 0} yields a z-score of {@code 0}, so nothing is flagged
 * while the residuals are constant.</li>
 * </ol>
 *
 * <h3>State</h3>
 * <p>
 * This detector is <strong>stateful</strong> and <strong>not</strong>
 * thread-safe: one instance per stream, with calls serialized by the caller.
 * Non-finite observations are rejected with {@link InvalidInputException}
 * before any state is touched.
 * </p>
 *
 * @since 1.0.0
 */
public class StreamAnomalyDetector implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(StreamAnomalyDetector.class);

    private final String name;
    private final double alpha;
    private final double threshold;
    private final int windowSize;
    private final ScoringMode scoringMode;
    private final HistoryMode historyMode;

    private final ResidualHistory history;

    /** {@code false} until the first observation seeds the EMA. */
    private boolean seeded;
    private double ema;
    private double mad;

    /**
     * Detector with alpha {@value DetectorSettings#DEFAULT_ALPHA} and threshold
     * {@value DetectorSettings#DEFAULT_THRESHOLD}.
     */
    public StreamAnomalyDetector() {
        this(DetectorSettings.DEFAULT_ALPHA, DetectorSettings.DEFAULT_THRESHOLD);
    }

    /**
     * @param alpha     EMA smoothing factor in (0, 1]
     * @param threshold modified z-score cutoff, {@code > 0}
     * @throws InvalidParameterException if either parameter is out of range
     */
    public StreamAnomalyDetector(double alpha, double threshold) {
        this(DetectorSettings.DEFAULT_NAME, alpha, threshold, DetectorSettings.DEFAULT_WINDOW_SIZE,
                ScoringMode.SELF_INCLUSIVE, HistoryMode.UNBOUNDED);
    }

    /**
     * @param settings detector configuration; must not be {@code null}
     * @throws InvalidParameterException if a numeric parameter is out of range
     * @throws IllegalArgumentException  if a mode string is unknown
     */
    public StreamAnomalyDetector(DetectorSettings settings) {
        this(Objects.requireNonNull(settings, "DetectorSettings must not be null").getName(),
                settings.getAlpha(),
                settings.getThreshold(),
                settings.getWindowSize(),
                settings.resolveScoringMode(),
                settings.resolveHistoryMode());
    }

    /**
     * @param name        name used in alerts and logs; must not be {@code null}
     * @param alpha       EMA smoothing factor in (0, 1]
     * @param threshold   modified z-score cutoff, {@code > 0}
     * @param windowSize  trailing residual window for the MAD, {@code >= 1}
     * @param scoringMode baseline the residual is measured against
     * @param historyMode residual retention strategy
     * @throws InvalidParameterException if a numeric parameter is out of range
     */
    public StreamAnomalyDetector(String name, double alpha, double threshold, int windowSize,
            ScoringMode scoringMode, HistoryMode historyMode) {
        this.name = Objects.requireNonNull(name, "Detector name must not be null");
        this.scoringMode = Objects.requireNonNull(scoringMode, "Scoring mode must not be null");
        this.historyMode = Objects.requireNonNull(historyMode, "History mode must not be null");

        // Negated comparisons so that NaN is rejected too
        if (!(alpha > 0 && alpha <= 1)) {
            throw new InvalidParameterException(
                    "alpha must be in (0, 1] for detector '" + name + "', got: " + alpha);
        }
        if (!(threshold > 0)) {
            throw new InvalidParameterException(
                    "threshold must be > 0 for detector '" + name + "', got: " + threshold);
        }
        if (windowSize < 1) {
            throw new InvalidParameterException(
                    "windowSize must be >= 1 for detector '" + name + "', got: " + windowSize);
        }

        this.alpha = alpha;
        this.threshold = threshold;
        this.windowSize = windowSize;
        this.history = historyMode.newHistory(windowSize);
    }

    // ---------------------------------------------------------------
    // Scoring
    // ---------------------------------------------------------------

    /**
     * Feed one observation and return whether it is anomalous.
     *
     * @param value the next observation; must be finite
     * @return {@code true} if the observation is flagged
     * @throws InvalidInputException if {@code value} is NaN or infinite
     */
    public boolean update(double value) {
        return score(value).isAnomalous();
    }

    /**
     * Feed one observation and return the full scoring diagnostics.
     *
     * @param value the next observation; must be finite
     * @return the result for this observation
     * @throws InvalidInputException if {@code value} is NaN or infinite, or
     *                               its residual overflows the double range
     */
    public DetectionResult score(double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidInputException(value);
        }

        long index = history.size();

        if (!seeded) {
            ema = value;
            mad = 0.0;
            seeded = true;
            history.append(0.0);
            return new DetectionResult(index, value, value, 0.0, 0.0, 0.0, false);
        }

        double updatedEma = alpha * value + (1 - alpha) * ema;
        double baseline = scoringMode == ScoringMode.PRE_UPDATE ? ema : updatedEma;
        double residual = value - baseline;
        if (!Double.isFinite(residual)) {
            throw new InvalidInputException(value,
                    "Residual of observation " + value + " against baseline " + baseline
                            + " overflows the double range");
        }

        ema = updatedEma;
        history.append(residual);
        mad = history.dispersion();

        double modifiedZScore = mad == 0.0
                ? 0.0
                : RobustStatistics.MAD_NORMAL_CONSISTENCY * residual / mad;
        boolean anomalous = Math.abs(modifiedZScore) > threshold;

        if (anomalous) {
            LOG.debug("Detector [{}] flagged #{}: value={} baseline={} mad={} z={}",
                    name, index, value, baseline, mad, modifiedZScore);
        }
        return new DetectionResult(index, value, baseline, residual, mad, modifiedZScore, anomalous);
    }

    /**
     * Score a reading and build an {@link Alert} when it is anomalous.
     *
     * <p>
     * Readings without a value are skipped and leave the state untouched.
     * </p>
     *
     * @param reading the incoming reading; must not be {@code null}
     * @return an alert if the reading is flagged, empty otherwise
     * @throws InvalidInputException if the reading's value is NaN or infinite
     */
    public Optional<Alert> evaluate(Reading reading) {
        Objects.requireNonNull(reading, "Reading must not be null");

        Double value = reading.getValue();
        if (value == null) {
            LOG.trace("Detector [{}]: reading without value on stream '{}' – skipping",
                    name, reading.getStreamId());
            return Optional.empty();
        }

        DetectionResult result = score(value);
        if (!result.isAnomalous()) {
            return Optional.empty();
        }

        return Optional.of(Alert.builder()
                .detectorName(name)
                .streamId(reading.getStreamId())
                .timestamp(reading.effectiveTime())
                .value(result.getValue())
                .baseline(result.getBaseline())
                .residual(result.getResidual())
                .mad(result.getMad())
                .modifiedZScore(result.getModifiedZScore())
                .details(String.format(Locale.ROOT,
                        "Anomalous reading: value=%.4f (baseline=%.4f, mad=%.4f, z=%.2f, threshold=%.2f)",
                        result.getValue(), result.getBaseline(), result.getMad(),
                        result.getModifiedZScore(), threshold))
                .build());
    }

    // ---------------------------------------------------------------
    // State inspection
    // ---------------------------------------------------------------

    /** @return the current baseline, empty before the first observation */
    public OptionalDouble getEma() {
        return seeded ? OptionalDouble.of(ema) : OptionalDouble.empty();
    }

    /** @return the dispersion computed by the last observation, {@code 0} initially */
    public double getMad() {
        return mad;
    }

    /** @return number of accepted observations */
    public long getObservationCount() {
        return history.size();
    }

    /**
     * Residuals currently retained, oldest first. In
     * {@link HistoryMode#UNBOUNDED} mode this is every residual; in
     * {@link HistoryMode#BOUNDED} mode at most {@code windowSize} of them.
     *
     * @return a fresh copy of the retained residuals
     */
    public double[] getResidualHistory() {
        return history.retained();
    }

    public String getName() {
        return name;
    }

    public double getAlpha() {
        return alpha;
    }

    public double getThreshold() {
        return threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public ScoringMode getScoringMode() {
        return scoringMode;
    }

    public HistoryMode getHistoryMode() {
        return historyMode;
    }

    @Override
    public String toString() {
        return "StreamAnomalyDetector{" +
                "name='" + name + '\'' +
                ", alpha=" + alpha +
                ", threshold=" + threshold +
                ", windowSize=" + windowSize +
                ", scoringMode=" + scoringMode +
                ", historyMode=" + historyMode +
                ", observations=" + history.size() +
                '}';
    }
}
