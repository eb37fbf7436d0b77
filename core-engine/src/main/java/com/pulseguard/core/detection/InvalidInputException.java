package com.pulseguard.core.detection;

/**
 * Thrown when a non-finite observation ({@code NaN} or infinity) is offered
 * to a detector, or when a finite observation lies so far from the baseline
 * that its residual is not representable. The detector state is left exactly as it was before the call.
 *
 * @since 1.0.0
 */
public class InvalidInputException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final double rejectedValue;

    public InvalidInputException(double rejectedValue) {
        super("Observation must be a finite number, got: " + rejectedValue);
        this.rejectedValue = rejectedValue;
    }

    public InvalidInputException(double rejectedValue, String message) {
        super(message);
        this.rejectedValue = rejectedValue;
    }

    public double getRejectedValue() {
        return rejectedValue;
    }
}
