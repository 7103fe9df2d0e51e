package br.edu.ifba.cadgraph.transform;

/**
 * Transformer switches.
 *
 * @param enabled run derivation passes after loading
 * @param batchSize derived relationships per committed batch
 * @param parallel run passes concurrently
 */
public record TransformSettings(boolean enabled, int batchSize, boolean parallel) {

    public static final TransformSettings DEFAULT = new TransformSettings(true, 500, true);

    public TransformSettings {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be at least 1, got " + batchSize);
        }
    }
}
