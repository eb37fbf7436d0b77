package com.pulseguard.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Top-level POJO for the PulseGuard YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * detector:
 *   alpha: 0.1
 *   threshold: 3.5
 *   windowSize: 30
 * simulation:
 *   seed: 42
 *   steps: 2000
 * </pre>
 *
 * <p>
 * Both sections are optional; absent sections take their defaults.
 * </p>
 *
 * @since 1.0.0
 */
public class PulseGuardConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    private DetectorSettings detector = new DetectorSettings();
    private SimulationSettings simulation = new SimulationSettings();

    public DetectorSettings getDetector() {
        return detector;
    }

    /**
     * Set the detector section (used by SnakeYAML during deserialization).
     *
     * @param detector the detector settings; {@code null} restores defaults
     */
    public void setDetector(DetectorSettings detector) {
        this.detector = detector != null ? detector : new DetectorSettings();
    }

    public SimulationSettings getSimulation() {
        return simulation;
    }

    public void setSimulation(SimulationSettings simulation) {
        this.simulation = simulation != null ? simulation : new SimulationSettings();
    }

    /**
     * Validate both sections, collecting all errors.
     *
     * @throws IllegalStateException if one or more sections are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            detector.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        try {
            simulation.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "PulseGuard configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    @Override
    public String toString() {
        return "PulseGuardConfig{detector=" + detector + ", simulation=" + simulation + '}';
    }
}
