package br.edu.ifba.cadgraph.core;

/**
 * The host could not supply a persistent token for an entity, so no stable id
 * can be assigned. Callers skip the entity and carry on.
 */
public class IdentityUnavailableException extends Exception {

    private static final long serialVersionUID = 1L;

    private final String objectType;

    public IdentityUnavailableException(String objectType, String reason) {
        super(reason + " (" + objectType + ")");
        this.objectType = objectType;
    }

    public IdentityUnavailableException(String objectType, String reason, Throwable cause) {
        super(reason + " (" + objectType + ")", cause);
        this.objectType = objectType;
    }

    public String getObjectType() {
        return objectType;
    }
}
