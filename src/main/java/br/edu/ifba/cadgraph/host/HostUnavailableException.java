package br.edu.ifba.cadgraph.host;

/**
 * Thrown by host accessors when the CAD document is no longer accessible,
 * typically because the user closed it during an extraction run.
 */
public class HostUnavailableException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public HostUnavailableException(String message) {
        super(message);
    }

    public HostUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
