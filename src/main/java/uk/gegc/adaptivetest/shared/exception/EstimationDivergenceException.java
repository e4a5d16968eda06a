package uk.gegc.adaptivetest.shared.exception;

/**
 * Raised if ability estimation ever produces a non-finite value.
 * Theta is clamped on every iteration, so this should not surface in practice.
 */
public class EstimationDivergenceException extends RuntimeException {

    public EstimationDivergenceException(String message) {
        super(message);
    }
}
