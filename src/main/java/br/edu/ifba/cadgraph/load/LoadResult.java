package br.edu.ifba.cadgraph.load;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.cadgraph.storage.CommitStats;

/**
 * Result of loading one batch. Exactly one of a committed outcome or a failure.
 */
public record LoadResult(long sequence, CommitStats stats, @Nullable BatchFailure failure) {

    public static LoadResult committed(long sequence, CommitStats stats) {
        return new LoadResult(sequence, stats, null);
    }

    public static LoadResult failed(BatchFailure failure) {
        return new LoadResult(failure.sequence(), CommitStats.EMPTY, failure);
    }

    public int created() {
        return stats.created();
    }

    public int merged() {
        return stats.merged();
    }

    public boolean failed() {
        return failure != null;
    }
}
