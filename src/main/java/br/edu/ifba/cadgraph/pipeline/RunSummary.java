package br.edu.ifba.cadgraph.pipeline;

import java.time.Duration;
import java.util.List;

import org.jetbrains.annotations.Nullable;

import br.edu.ifba.cadgraph.extract.SkippedEntity;
import br.edu.ifba.cadgraph.load.BatchFailure;
import br.edu.ifba.cadgraph.storage.CommitStats;
import br.edu.ifba.cadgraph.transform.TransformReport;

/**
 * Report of one pipeline run.
 *
 * @param documentId the document partition written
 * @param status overall outcome
 * @param extractedEntities entities converted during traversal
 * @param loaded commit counters of the extraction batches
 * @param failedBatches abandoned extraction batches
 * @param skippedEntities entities left out during traversal
 * @param transform derivation pass results
 * @param abortReason host error that stopped the traversal, null unless PARTIAL
 * @param elapsed wall time of the run
 */
public record RunSummary(
    String documentId,
    RunStatus status,
    long extractedEntities,
    CommitStats loaded,
    List<BatchFailure> failedBatches,
    List<SkippedEntity> skippedEntities,
    TransformReport transform,
    @Nullable String abortReason,
    Duration elapsed
) {

    public RunSummary {
        failedBatches = List.copyOf(failedBatches);
        skippedEntities = List.copyOf(skippedEntities);
    }

    public int nodesCreated() {
        return loaded.nodesCreated();
    }

    public int nodesMerged() {
        return loaded.nodesMerged();
    }

    public int relationshipsCreated() {
        return loaded.relationshipsCreated();
    }

    public int relationshipsMerged() {
        return loaded.relationshipsMerged();
    }
}
