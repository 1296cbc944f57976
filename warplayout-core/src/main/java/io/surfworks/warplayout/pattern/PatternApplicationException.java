package io.surfworks.warplayout.pattern;

/**
 * Thrown when a set of rewrite patterns fails to reach a fixpoint.
 */
public class PatternApplicationException extends RuntimeException {

    private final int iterations;

    public PatternApplicationException(String message, int iterations) {
        super(message);
        this.iterations = iterations;
    }

    /**
     * Returns the number of sweeps performed before giving up.
     */
    public int getIterations() {
        return iterations;
    }
}
