package com.pulseguard.flink;

import com.pulseguard.core.config.DetectorSettings;
import com.pulseguard.core.detection.InvalidInputException;
import com.pulseguard.core.detection.StreamAnomalyDetector;
import com.pulseguard.core.model.Alert;
import com.pulseguard.core.model.Reading;
import org.apache.flink.api.common.state.ValueState;
import org.apache.flink.api.common.state.ValueStateDescriptor;
import org.apache.flink.configuration.Configuration;
import org.apache.flink.streaming.api.functions.KeyedProcessFunction;
import org.apache.flink.util.Collector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Keyed process function that runs one {@link StreamAnomalyDetector} per
 * stream.
 *
 * <p>
 * Each key ({@code streamId}) gets its own detector through Flink managed
 * keyed state, so streams never share EMA or residual history. The detector
 * is created lazily from the configured {@link DetectorSettings} on the first
 * reading of a stream.
 * </p>
 *
 * <h3>Rejected readings</h3>
 * <p>
 * A non-finite value is logged, counted in {@code readings_rejected_total}
 * and skipped. The detector state is left as it was.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyProcessFunction
        extends KeyedProcessFunction<String, Reading, Alert> {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(AnomalyProcessFunction.class);

    private final DetectorSettings settings;

    private transient ValueState<StreamAnomalyDetector> detectorState;

    private transient PulseGuardMetrics metrics;

    /**
     * @param settings detector parameters applied to every stream
     * @throws NullPointerException  if {@code settings} is {@code null}
     * @throws IllegalStateException if {@code settings} are invalid
     */
    public AnomalyProcessFunction(DetectorSettings settings) {
        Objects.requireNonNull(settings, "Detector settings must not be null");
        settings.validate();
        this.settings = settings;
    }

    // ---------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------

    @Override
    public void open(Configuration parameters) {
        ValueStateDescriptor<StreamAnomalyDetector> descriptor =
                new ValueStateDescriptor<>("stream-detector", StreamAnomalyDetector.class);
        detectorState = getRuntimeContext().getState(descriptor);

        metrics = new PulseGuardMetrics(getRuntimeContext().getMetricGroup());
        LOG.info("AnomalyProcessFunction opened with settings {}", settings);
    }

    @Override
    public void close() {
        LOG.info("AnomalyProcessFunction closing");
    }

    // ---------------------------------------------------------------
    // Processing
    // ---------------------------------------------------------------

    @Override
    public void processElement(Reading reading,
            KeyedProcessFunction<String, Reading, Alert>.Context ctx,
            Collector<Alert> out) throws Exception {
        long startNanos = System.nanoTime();
        String streamId = ctx.getCurrentKey();

        if (reading.getValue() == null) {
            LOG.debug("Reading without value on stream '{}' – skipping", streamId);
            return;
        }

        StreamAnomalyDetector detector = detectorState.value();
        if (detector == null) {
            detector = new StreamAnomalyDetector(settings);
            LOG.debug("Created detector for stream '{}'", streamId);
        }

        try {
            Optional<Alert> alert = detector.evaluate(reading);
            metrics.incrementReadingsProcessed();
            if (alert.isPresent()) {
                Alert a = alert.get();
                a.setStreamId(streamId);
                out.collect(a);
                metrics.incrementAnomaliesDetected();
                LOG.info("Anomaly on stream '{}': value={} z={}",
                        streamId, a.getValue(), a.getModifiedZScore());
            }
        } catch (InvalidInputException e) {
            metrics.incrementReadingsRejected();
            LOG.warn("Rejected reading on stream '{}' (value={}): {}",
                    streamId, e.getRejectedValue(), e.getMessage());
        }

        detectorState.update(detector);

        long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
        metrics.recordLatency(durationMs);
    }

    PulseGuardMetrics getMetrics() {
        return metrics;
    }
}
