package br.edu.ifba.cadgraph.load;

import java.util.List;

/**
 * A batch whose commit was abandoned.
 *
 * @param sequence batch sequence number
 * @param attempts commit attempts made
 * @param transientFailure whether the last failure was classified transient
 * @param cause message of the last failure
 * @param entities nodes the batch carried
 * @param relationshipCount relationships the batch carried
 */
public record BatchFailure(
    long sequence,
    int attempts,
    boolean transientFailure,
    String cause,
    List<FailedEntity> entities,
    int relationshipCount
) {

    public BatchFailure {
        entities = List.copyOf(entities);
    }
}
