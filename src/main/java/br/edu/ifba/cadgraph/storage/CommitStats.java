package br.edu.ifba.cadgraph.storage;

/**
 * Outcome counters of one committed upsert transaction.
 *
 * @param nodesCreated nodes that did not exist, or existed only as placeholders
 * @param nodesMerged nodes that already existed and were updated
 * @param relationshipsCreated relationships that did not exist
 * @param relationshipsMerged relationships that already existed and were updated
 */
public record CommitStats(int nodesCreated, int nodesMerged, int relationshipsCreated, int relationshipsMerged) {

    public static final CommitStats EMPTY = new CommitStats(0, 0, 0, 0);

    public CommitStats plus(CommitStats other) {
        return new CommitStats(
            nodesCreated + other.nodesCreated,
            nodesMerged + other.nodesMerged,
            relationshipsCreated + other.relationshipsCreated,
            relationshipsMerged + other.relationshipsMerged);
    }

    public int created() {
        return nodesCreated + relationshipsCreated;
    }

    public int merged() {
        return nodesMerged + relationshipsMerged;
    }
}
