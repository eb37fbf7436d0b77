package com.pulseguard.core.detection;

/**
 * Thrown when a detector is constructed with an out-of-range parameter
 * (smoothing factor, z-score threshold or window size).
 *
 * @since 1.0.0
 */
public class InvalidParameterException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public InvalidParameterException(String message) {
        super(message);
    }
}
