package br.edu.ifba.cadgraph.utils;

/**
 * A store operation did not succeed within its retry policy, either because
 * every attempt failed transiently or because a failure was permanent.
 */
public class RetryExhaustedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String operation;
    private final int attempts;
    private final boolean transientFailure;

    public RetryExhaustedException(String operation, int attempts, boolean transientFailure, Throwable cause) {
        super((transientFailure ? "Retries exhausted for " : "Permanent failure in ")
            + operation + " after " + attempts + " attempt(s)"
            + (cause != null ? ": " + cause.getMessage() : ""), cause);
        this.operation = operation;
        this.attempts = attempts;
        this.transientFailure = transientFailure;
    }

    public String getOperation() {
        return operation;
    }

    public int getAttempts() {
        return attempts;
    }

    /**
     * @return true when the last failure was transient (the attempt budget ran out)
     */
    public boolean isTransientFailure() {
        return transientFailure;
    }
}
