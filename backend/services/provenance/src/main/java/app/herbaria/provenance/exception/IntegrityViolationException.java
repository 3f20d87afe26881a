package app.herbaria.provenance.exception;

/**
 * Rejection at the storage boundary. Callers treat it as "already handled".
 */
public class IntegrityViolationException extends ProvenanceException {

    public IntegrityViolationException(String message) {
        super(message);
    }

    public IntegrityViolationException(String message, Throwable cause) {
        super(message, cause);
    }
}
