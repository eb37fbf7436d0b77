package com.pulseguard.core.detection;

import java.util.Locale;

/**
 * Which baseline the residual of an observation is measured against.
 *
 * @since 1.0.0
 */
public enum ScoringMode {

    /**
     * The EMA is updated with the observation first and the residual is taken
     * against the updated value. Default.
     */
    SELF_INCLUSIVE,

    /**
     * The residual is taken against the EMA as it stood before the
     * observation arrived; the EMA is updated afterwards.
     */
    PRE_UPDATE;

    /**
     * Parse a configuration string such as {@code self_inclusive} or
     * {@code PRE-UPDATE}.
     *
     * @param value configuration value; must not be {@code null}
     * @return the matching mode
     * @throws IllegalArgumentException if no mode matches
     */
    public static ScoringMode parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Scoring mode must not be null");
        }
        String normalised = value.trim().replace('-', '_').toUpperCase(Locale.ROOT);
        for (ScoringMode mode : values()) {
            if (mode.name().equals(normalised)) {
                return mode;
            }
        }
        throw new IllegalArgumentException("Unknown scoring mode: '" + value
                + "'. Supported: self_inclusive, pre_update");
    }
}
