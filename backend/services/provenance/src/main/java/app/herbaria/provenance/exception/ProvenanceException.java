package app.herbaria.provenance.exception;

/**
 * Base type for errors raised by the provenance engine.
 */
public class ProvenanceException extends RuntimeException {

    public ProvenanceException(String message) {
        super(message);
    }

    public ProvenanceException(String message, Throwable cause) {
        super(message, cause);
    }
}
