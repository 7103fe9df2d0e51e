package br.edu.ifba.cadgraph.transform;

import java.util.List;

/**
 * Per-pass results of one transformer run; empty when the transformer is disabled.
 */
public record TransformReport(List<PassResult> passes) {

    public static final TransformReport SKIPPED = new TransformReport(List.of());

    public TransformReport {
        passes = List.copyOf(passes);
    }

    public boolean hasFailures() {
        return passes.stream().anyMatch(pass -> !pass.succeeded());
    }

    public int derivedRelationships() {
        return passes.stream().mapToInt(PassResult::derivedRelationships).sum();
    }
}
