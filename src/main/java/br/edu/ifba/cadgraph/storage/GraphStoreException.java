package br.edu.ifba.cadgraph.storage;

/**
 * Thrown when a graph store operation fails.
 *
 * <p>Wraps the backend error (SQLException, Neo4j driver exception) and keeps
 * the operation and document for diagnostics. Whether the failure is worth a
 * retry is decided on the cause chain by
 * {@link br.edu.ifba.cadgraph.utils.TransientStoreFailurePredicate}.</p>
 */
public class GraphStoreException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    private static final int MAX_DETAIL_LENGTH = 200;

    private final String operation;
    private final String documentId;

    /**
     * Creates a new GraphStoreException.
     *
     * @param operation the store operation that failed, e.g. {@code upsertBatch}
     * @param documentId the document context (may be null)
     * @param detail additional detail, such as the failing query (may be null)
     * @param cause the underlying exception
     */
    public GraphStoreException(String operation, String documentId, String detail, Throwable cause) {
        super(buildMessage(operation, documentId, detail, cause), cause);
        this.operation = operation;
        this.documentId = documentId;
    }

    public GraphStoreException(String operation, String documentId, Throwable cause) {
        this(operation, documentId, null, cause);
    }

    private static String buildMessage(String operation, String documentId, String detail, Throwable cause) {
        StringBuilder message = new StringBuilder()
            .append("Graph store operation '").append(operation).append("' failed");
        if (documentId != null) {
            message.append(" for document '").append(documentId).append('\'');
        }
        if (cause != null && cause.getMessage() != null) {
            message.append(": ").append(cause.getMessage());
        }
        if (detail != null && !detail.isEmpty()) {
            String displayDetail = detail.length() > MAX_DETAIL_LENGTH
                ? detail.substring(0, MAX_DETAIL_LENGTH) + "..."
                : detail;
            message.append(". Detail: ").append(displayDetail);
        }
        return message.toString();
    }

    public String getOperation() {
        return operation;
    }

    public String getDocumentId() {
        return documentId;
    }
}
