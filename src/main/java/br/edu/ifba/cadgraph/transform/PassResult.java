package br.edu.ifba.cadgraph.transform;

import java.time.Duration;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.cadgraph.storage.CommitStats;

/**
 * Outcome of one derivation pass.
 *
 * @param pass pass name
 * @param derivedRelationships relationships computed
 * @param committedBatches batches written
 * @param stats summed commit counters
 * @param error failure message, null when the pass completed
 * @param elapsed wall time of the pass
 */
public record PassResult(
    String pass,
    int derivedRelationships,
    int committedBatches,
    CommitStats stats,
    @Nullable String error,
    Duration elapsed
) {

    public boolean succeeded() {
        return error == null;
    }
}
