package br.edu.ifba.cadgraph.pipeline;

/**
 * Overall outcome of a pipeline run.
 */
public enum RunStatus {
    /** Every batch committed and every derivation pass succeeded. */
    COMPLETED,
    /** The traversal finished, but batches were abandoned or a pass failed. */
    COMPLETED_WITH_FAILURES,
    /** The host went away during traversal; the graph holds what was extracted before. */
    PARTIAL
}
