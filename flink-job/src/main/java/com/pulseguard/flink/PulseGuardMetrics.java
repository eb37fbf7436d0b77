package com.pulseguard.flink;

import org.apache.flink.metrics.Counter;
import org.apache.flink.metrics.Histogram;
import org.apache.flink.metrics.MetricGroup;
import org.apache.flink.runtime.metrics.DescriptiveStatisticsHistogram;

/**
 * Custom Flink metric definitions for PulseGuard.
 * <p>
 * Flink exposes these via its configured metric reporters. Reporters are set
 * up in {@code flink-conf.yaml} at cluster level; the job only defines the
 * metrics.
 * </p>
 *
 * <h3>Exposed Metrics</h3>
 * <ul>
 *   <li>{@code readings_processed_total} – readings scored by a detector</li>
 *   <li>{@code readings_rejected_total} – readings refused as non-finite</li>
 *   <li>{@code anomalies_detected_total} – alerts emitted</li>
 *   <li>{@code processing_latency_ms} – histogram of per-reading latency</li>
 * </ul>
 */
public class PulseGuardMetrics {

    private static final int LATENCY_WINDOW = 350;

    private final Counter readingsProcessed;
    private final Counter readingsRejected;
    private final Counter anomaliesDetected;
    private final Histogram processingLatency;

    public PulseGuardMetrics(MetricGroup metricGroup) {
        MetricGroup group = metricGroup.addGroup("pulseguard");

        this.readingsProcessed = group.counter("readings_processed_total");
        this.readingsRejected = group.counter("readings_rejected_total");
        this.anomaliesDetected = group.counter("anomalies_detected_total");
        this.processingLatency = group
                .histogram("processing_latency_ms", new DescriptiveStatisticsHistogram(LATENCY_WINDOW));
    }

    public void incrementReadingsProcessed() {
        readingsProcessed.inc();
    }

    public void incrementReadingsRejected() {
        readingsRejected.inc();
    }

    public void incrementAnomaliesDetected() {
        anomaliesDetected.inc();
    }

    public void recordLatency(long milliseconds) {
        processingLatency.update(milliseconds);
    }

    public long getReadingsProcessed() {
        return readingsProcessed.getCount();
    }

    public long getReadingsRejected() {
        return readingsRejected.getCount();
    }

    public long getAnomaliesDetected() {
        return anomaliesDetected.getCount();
    }
}
