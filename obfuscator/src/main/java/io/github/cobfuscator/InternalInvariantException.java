package io.github.cobfuscator;

/**
 * Raised when a pass observes a state that valid input can never produce. Always a bug.
 */
public class InternalInvariantException extends CompilationException {

    private static final long serialVersionUID = -8460253018417355613L;

    public InternalInvariantException(String message) {
        super("internal invariant violated: " + message, null);
    }
}
