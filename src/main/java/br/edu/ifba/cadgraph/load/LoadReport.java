package br.edu.ifba.cadgraph.load;

import java.util.List;

import br.edu.ifba.cadgraph.storage.CommitStats;

/**
 * Totals over every batch a loader handled.
 *
 * @param committedBatches batches committed
 * @param totals summed commit counters
 * @param failures abandoned batches in sequence order
 */
public record LoadReport(int committedBatches, CommitStats totals, List<BatchFailure> failures) {

    public LoadReport {
        failures = List.copyOf(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
