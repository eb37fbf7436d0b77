package com.pulseguard.core.detection;

import java.util.Locale;

/**
 * Retention strategy for the residual history of a detector.
 *
 * <p>
 * Both strategies yield identical dispersion estimates; they differ only in
 * how much memory a long-lived stream consumes.
 * </p>
 *
 * @since 1.0.0
 */
public enum HistoryMode {

    /** Keep every residual ever observed. Default. */
    UNBOUNDED {
        @Override
        ResidualHistory newHistory(int windowSize) {
            return new UnboundedResidualHistory(windowSize);
        }
    },

    /** Keep only the trailing window in a fixed-capacity ring buffer. */
    BOUNDED {
        @Override
        ResidualHistory newHistory(int windowSize) {
            return new RingBufferResidualHistory(windowSize);
        }
    };

    abstract ResidualHistory newHistory(int windowSize);

    /**
     * Parse a configuration string such as {@code bounded}.
     *
     * @param value configuration value; must not be {@code null}
     * @return the matching mode
     * @throws IllegalArgumentException if no mode matches
     */
    public static HistoryMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("History mode must not be null");
        }
        String normalised = value.trim().toUpperCase(Locale.ROOT);
        for (HistoryMode mode : values()) {
            if (mode.name().equals(normalised)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown history mode: '" + value
                + "'. Supported: unbounded, bounded");
    }
}
