package br.edu.ifba.cadgraph.storage;

/**
 * The graph store cannot be reached at all. This is the one failure a pipeline
 * run does not recover from.
 */
public class GraphStoreUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private final String endpoint;

    public GraphStoreUnavailableException(String endpoint, Throwable cause) {
        super("Graph store unavailable at " + endpoint
            + (cause != null && cause.getMessage() != null ? ": " + cause.getMessage() : ""), cause);
        this.endpoint = endpoint;
    }

    public String getEndpoint() {
        return endpoint;
    }
}
