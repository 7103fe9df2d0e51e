package br.edu.ifba.cadgraph.load;

import br.edu.ifba.cadgraph.core.GraphBatch;
import br.edu.ifba.cadgraph.utils.RetryExhaustedException;

/**
 * Thrown when a batch could not be committed within the retry budget.
 */
public class BatchLoadFailedException extends Exception {

    private static final long serialVersionUID = 1L;

    private final transient GraphBatch batch;
    private final int attempts;
    private final boolean transientFailure;

    public BatchLoadFailedException(GraphBatch batch, RetryExhaustedException cause) {
        super(String.format("Batch %d (%d records) failed after %d attempt(s)",
            batch.sequence(), batch.size(), cause.getAttempts()), cause.getCause());
        this.batch = batch;
        this.attempts = cause.getAttempts();
        this.transientFailure = cause.isTransientFailure();
    }

    public GraphBatch getBatch() {
        return batch;
    }

    public int getAttempts() {
        return attempts;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }

    /**
     * Summary of the lost batch for the run report.
     */
    public BatchFailure toFailure() {
        Throwable cause = getCause();
        String message = cause == null ? getMessage()
            : cause.getClass().getSimpleName() + ": " + cause.getMessage();
        return new BatchFailure(
            batch.sequence(),
            attempts,
            transientFailure,
            message,
            batch.nodes().stream().map(node -> new FailedEntity(node.label(), node.stableId())).toList(),
            batch.relationships().size());
    }
}
