package app.herbaria.provenance.exception;

import java.util.UUID;

/**
 * Attempt to move an attempt that is unknown or already terminal.
 */
public class AttemptStateException extends IntegrityViolationException {

    private final UUID attemptId;

    public AttemptStateException(UUID attemptId, String message) {
        super(message + " attempt=" + attemptId);
        this.attemptId = attemptId;
    }

    public UUID getAttemptId() {
        return attemptId;
    }
}
