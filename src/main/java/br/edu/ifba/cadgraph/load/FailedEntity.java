package br.edu.ifba.cadgraph.load;

/**
 * Node carried by a batch that could not be committed.
 */
public record FailedEntity(String label, String stableId) {
}
