package com.pulseguard.core.config;

import com.pulseguard.core.detection.HistoryMode;
import com.pulseguard.core.detection.ScoringMode;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Parameters of a {@link com.pulseguard.core.detection.StreamAnomalyDetector}.
 *
 * <p>
 * Populated by SnakeYAML from the {@code detector} section of the
 * configuration file, or programmatically. Call {@link #validate()} after
 * construction / deserialization; it reports every problem at once.
 * </p>
 *
 * @since 1.0.0
 */
public class DetectorSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final String DEFAULT_NAME = "ema-mad";
    public static final double DEFAULT_ALPHA = 0.1;
    public static final double DEFAULT_THRESHOLD = 3.5;
    public static final int DEFAULT_WINDOW_SIZE = 30;

    /** Name used in alerts and log lines. */
    private String name = DEFAULT_NAME;

    /** EMA smoothing factor in (0, 1]. */
    private double alpha = DEFAULT_ALPHA;

    /** Modified z-score cutoff, strictly positive. */
    private double threshold = DEFAULT_THRESHOLD;

    /** Number of trailing residuals used for the MAD. */
    private int windowSize = DEFAULT_WINDOW_SIZE;

    /** "self_inclusive" or "pre_update". */
    private String scoringMode = "self_inclusive";

    /** "unbounded" or "bounded". */
    private String historyMode = "unbounded";

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every field.
     *
     * @throws IllegalStateException listing all problems if any field is
     *                               invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();

        if (name == null || name.isBlank()) {
            errors.add("Detector 'name' is required");
        }
        if (!(alpha > 0 && alpha <= 1)) {
            errors.add("Detector 'alpha' must be in (0, 1], got: " + alpha);
        }
        if (!(threshold > 0)) {
            errors.add("Detector 'threshold' must be > 0, got: " + threshold);
        }
        if (windowSize < 1) {
            errors.add("Detector 'windowSize' must be >= 1, got: " + windowSize);
        }
        try {
            ScoringMode.parse(scoringMode);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }
        try {
            HistoryMode.parse(historyMode);
        } catch (IllegalArgumentException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid DetectorSettings: " + String.join("; ", errors));
        }
    }

    /**
     * @return the parsed scoring mode
     * @throws IllegalArgumentException if the configured value is unknown
     */
    public ScoringMode resolveScoringMode() {
        return ScoringMode.parse(scoringMode);
    }

    /**
     * @return the parsed history mode
     * @throws IllegalArgumentException if the configured value is unknown
     */
    public HistoryMode resolveHistoryMode() {
        return HistoryMode.parse(historyMode);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public double getAlpha() {
        return alpha;
    }

    public void setAlpha(double alpha) {
        this.alpha = alpha;
    }

    public double getThreshold() {
        return threshold;
    }

    public void setThreshold(double threshold) {
        this.threshold = threshold;
    }

    public int getWindowSize() {
        return windowSize;
    }

    public void setWindowSize(int windowSize) {
        this.windowSize = windowSize;
    }

    public String getScoringMode() {
        return scoringMode;
    }

    /**
     * Set the scoring mode, normalised to lowercase.
     *
     * @param scoringMode scoring mode string
     */
    public void setScoringMode(String scoringMode) {
        this.scoringMode = scoringMode != null ? scoringMode.toLowerCase(Locale.ROOT) : null;
    }

    public String getHistoryMode() {
        return historyMode;
    }

    public void setHistoryMode(String historyMode) {
        this.historyMode = historyMode != null ? historyMode.toLowerCase(Locale.ROOT) : null;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof DetectorSettings that))
            return false;
        return Double.compare(alpha, that.alpha) == 0
                && Double.compare(threshold, that.threshold) == 0
                && windowSize == that.windowSize
                && Objects.equals(name, that.name)
                && Objects.equals(scoringMode, that.scoringMode)
                && Objects.equals(historyMode, that.historyMode);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, alpha, threshold, windowSize, scoringMode, historyMode);
    }

    @Override
    public String toString() {
        return "DetectorSettings{" +
                "name='" + name + '\'' +
                ", alpha=" + alpha +
                ", threshold=" + threshold +
                ", windowSize=" + windowSize +
                ", scoringMode='" + scoringMode + '\'' +
                ", historyMode='" + historyMode + '\'' +
                '}';
    }
}
