package com.pulseguard.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Alert emitted when a reading is flagged as anomalous.
 *
 * <p>
 * Carries the detector diagnostics for the flagged observation so consumers
 * can judge the severity without replaying the stream. Serialized to JSON and
 * published to the configured Kafka alerts topic.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code detectorName} and {@code timestamp} are
 * required; omitting either throws a {@link NullPointerException} at build
 * time.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Name of the detector profile that raised the alert. */
    private String detectorName;

    /** Stream the anomalous reading belongs to. */
    private String streamId;

    /** Time of the anomalous reading. */
    private Instant timestamp;

    private double value;

    /** EMA the residual was measured against. */
    private double baseline;

    private double residual;

    /** Median absolute deviation of the residual window. */
    private double mad;

    private double modifiedZScore;

    /** Human-readable description of what was detected. */
    private String details;

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.detectorName = Objects.requireNonNull(builder.detectorName, "detectorName must not be null");
        this.streamId = builder.streamId;
        this.timestamp = Objects.requireNonNull(builder.timestamp, "timestamp must not be null");
        this.value = builder.value;
        this.baseline = builder.baseline;
        this.residual = builder.residual;
        this.mad = builder.mad;
        this.modifiedZScore = builder.modifiedZScore;
        this.details = builder.details;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String detectorName;
        private String streamId;
        private Instant timestamp;
        private double value;
        private double baseline;
        private double residual;
        private double mad;
        private double modifiedZScore;
        private String details;

        public Builder detectorName(String detectorName) {
            this.detectorName = detectorName;
            return this;
        }

        public Builder streamId(String streamId) {
            this.streamId = streamId;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder value(double value) {
            this.value = value;
            return this;
        }

        public Builder baseline(double baseline) {
            this.baseline = baseline;
            return this;
        }

        public Builder residual(double residual) {
            this.residual = residual;
            return this;
        }

        public Builder mad(double mad) {
            this.mad = mad;
            return this;
        }

        public Builder modifiedZScore(double modifiedZScore) {
            this.modifiedZScore = modifiedZScore;
            return this;
        }

        public Builder details(String details) {
            this.details = details;
            return this;
        }

        /**
         * @return a new {@link Alert}
         * @throws NullPointerException if {@code detectorName} or
         *                              {@code timestamp} is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getDetectorName() {
        return detectorName;
    }

    public void setDetectorName(String detectorName) {
        this.detectorName = detectorName;
    }

    public String getStreamId() {
        return streamId;
    }

    public void setStreamId(String streamId) {
        this.streamId = streamId;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public double getValue() {
        return value;
    }

    public void setValue(double value) {
        this.value = value;
    }

    public double getBaseline() {
        return baseline;
    }

    public void setBaseline(double baseline) {
        this.baseline = baseline;
    }

    public double getResidual() {
        return residual;
    }

    public void setResidual(double residual) {
        this.residual = residual;
    }

    public double getMad() {
        return mad;
    }

    public void setMad(double mad) {
        this.mad = mad;
    }

    public double getModifiedZScore() {
        return modifiedZScore;
    }

    public void setModifiedZScore(double modifiedZScore) {
        this.modifiedZScore = modifiedZScore;
    }

    public String getDetails() {
        return details;
    }

    public void setDetails(String details) {
        this.details = details;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(detectorName, alert.detectorName)
                && Objects.equals(streamId, alert.streamId)
                && Objects.equals(timestamp, alert.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(detectorName, streamId, timestamp);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "detectorName='" + detectorName + '\'' +
                ", streamId='" + streamId + '\'' +
                ", timestamp=" + timestamp +
                ", value=" + value +
                ", modifiedZScore=" + modifiedZScore +
                '}';
    }
}
