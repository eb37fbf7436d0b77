package com.pulseguard.core.simulation;

import com.pulseguard.core.config.SimulationSettings;

import java.util.Iterator;
import java.util.Objects;
import java.util.Random;

/**
 * Endless synthetic signal with randomly injected, labeled anomalies.
 *
 * <p>
 * Sample {@code t} is {@code 10 sin(0.01 t) + sin(0.1 t) + N(0, noiseStdDev)}.
 * With probability {@code anomalyProbability} an offset drawn uniformly from
 * [-20, 20) is added; offsets smaller than 5 in magnitude are pushed out to
 * ±5 so every injected anomaly is visible above the noise.
 * </p>
 *
 * <p>
 * The source is driven by a seeded {@link Random}, so two sources built from
 * the same settings produce the same sequence.
 * </p>
 *
 * @since 1.0.0
 */
public class SyntheticSignalSource implements Iterator<LabeledSample> {

    static final double SEASONAL_AMPLITUDE = 10.0;
    static final double SEASONAL_FREQUENCY = 0.01;
    static final double REGULAR_FREQUENCY = 0.1;
    static final double MAX_ANOMALY_MAGNITUDE = 20.0;
    static final double MIN_ANOMALY_MAGNITUDE = 5.0;

    private final Random random;
    private final double anomalyProbability;
    private final double noiseStdDev;

    private long t;

    /**
     * @param settings simulation settings; must not be {@code null}
     * @throws IllegalStateException if the settings are invalid
     */
    public SyntheticSignalSource(SimulationSettings settings) {
        Objects.requireNonNull(settings, "SimulationSettings must not be null");
        settings.validate();
        this.random = new Random(settings.getSeed());
        this.anomalyProbability = settings.getAnomalyProbability();
        this.noiseStdDev = settings.getNoiseStdDev();
    }

    /** Always {@code true}: the signal never ends. */
    @Override
    public boolean hasNext() {
        return true;
    }

    @Override
    public LabeledSample next() {
        double seasonal = SEASONAL_AMPLITUDE * Math.sin(SEASONAL_FREQUENCY * t);
        double regular = Math.sin(REGULAR_FREQUENCY * t);
        double noise = random.nextGaussian() * noiseStdDev;
        double value = seasonal + regular + noise;

        boolean anomalous = random.nextDouble() < anomalyProbability;
        if (anomalous) {
            value += anomalyMagnitude();
        }

        return new LabeledSample(t++, value, anomalous);
    }

    private double anomalyMagnitude() {
        double magnitude = (random.nextDouble() * 2 - 1) * MAX_ANOMALY_MAGNITUDE;
        if (Math.abs(magnitude) < MIN_ANOMALY_MAGNITUDE) {
            magnitude = magnitude < 0 ? -MIN_ANOMALY_MAGNITUDE : MIN_ANOMALY_MAGNITUDE;
        }
        return magnitude;
    }
}
