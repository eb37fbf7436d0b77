package com.pulseguard.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of the synthetic signal used by the simulation runner.
 *
 * @since 1.0.0
 */
public class SimulationSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private long seed = 42L;
    private int steps = 2_000;
    private double anomalyProbability = 0.02;
    private double noiseStdDev = 0.5;

    /**
     * @throws IllegalStateException listing all problems if any field is
     *                               invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (steps < 1) {
            errors.add("Simulation 'steps' must be >= 1, got: " + steps);
        }
        if (!(anomalyProbability >= 0 && anomalyProbability <= 1)) {
            errors.add("Simulation 'anomalyProbability' must be in [0, 1], got: " + anomalyProbability);
        }
        if (!(noiseStdDev >= 0)) {
            errors.add("Simulation 'noiseStdDev' must be >= 0, got: " + noiseStdDev);
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid SimulationSettings: " + String.join("; ", errors));
        }
    }

    public long getSeed() {
        return seed;
    }

    public void setSeed(long seed) {
        this.seed = seed;
    }

    public int getSteps() {
        return steps;
    }

    public void setSteps(int steps) {
        this.steps = steps;
    }

    public double getAnomalyProbability() {
        return anomalyProbability;
    }

    public void setAnomalyProbability(double anomalyProbability) {
        this.anomalyProbability = anomalyProbability;
    }

    public double getNoiseStdDev() {
        return noiseStdDev;
    }

    public void setNoiseStdDev(double noiseStdDev) {
        this.noiseStdDev = noiseStdDev;
    }

    @Override
    public String toString() {
        return "SimulationSettings{" +
                "seed=" + seed +
                ", steps=" + steps +
                ", anomalyProbability=" + anomalyProbability +
                ", noiseStdDev=" + noiseStdDev +
                '}';
    }
}
