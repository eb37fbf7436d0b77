package com.pulseguard.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * A single observation of one numeric stream.
 *
 * <p>
 * Readings arrive as JSON from Kafka, for example
 * {@code {"streamId":"sensor-7","value":12.3,"timestamp":"2024-01-01T00:00:00Z"}}.
 * Unknown properties are ignored.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * This class is <strong>not</strong> thread-safe. A single instance must
 * only be accessed by one thread at a time, which is guaranteed by Flink's
 * single-threaded operator model.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class Reading implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Identifier of the stream the value belongs to; used as the key. */
    private String streamId;

    /** Observed value; {@code null} when absent from the source record. */
    private Double value;

    /** Producer-side timestamp, if the source record carries one. */
    private Instant timestamp;

    /** Ingestion timestamp (set by the deserializer). */
    private Instant ingestionTime;

    /** No-arg constructor required by Jackson. */
    public Reading() {
    }

    public Reading(String streamId, double value, Instant timestamp) {
        this.streamId = streamId;
        this.value = value;
        this.timestamp = timestamp;
    }

    /**
     * Best available time for this reading: the producer timestamp, then the
     * ingestion time, then {@link Instant#now()}.
     *
     * @return effective timestamp, never {@code null}
     */
    public Instant effectiveTime() {
        if (timestamp != null) {
            return timestamp;
        }
        return ingestionTime != null ? ingestionTime : Instant.now();
    }

    public String getStreamId() {
        return streamId;
    }

    public void setStreamId(String streamId) {
        this.streamId = streamId;
    }

    public Double getValue() {
        return value;
    }

    public void setValue(Double value) {
        this.value = value;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public void setTimestamp(Instant timestamp) {
        this.timestamp = timestamp;
    }

    public Instant getIngestionTime() {
        return ingestionTime;
    }

    public void setIngestionTime(Instant ingestionTime) {
        this.ingestionTime = ingestionTime;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Reading that))
            return false;
        return Objects.equals(streamId, that.streamId)
                && Objects.equals(value, that.value)
                && Objects.equals(timestamp, that.timestamp);
    }

    @Override
    public int hashCode() {
        return Objects.hash(streamId, value, timestamp);
    }

    @Override
    public String toString() {
        return "Reading{" +
                "streamId='" + streamId + '\'' +
                ", value=" + value +
                ", timestamp=" + timestamp +
                '}';
    }
}
