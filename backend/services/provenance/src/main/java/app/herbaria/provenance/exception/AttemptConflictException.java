package app.herbaria.provenance.exception;

import java.util.UUID;

/**
 * Losing side of a race to register the canonical completed attempt for a dedup key.
 */
public class AttemptConflictException extends IntegrityViolationException {

    private final String specimenIdentity;
    private final String paramsHash;
    private final UUID canonicalAttemptId;

    public AttemptConflictException(String specimenIdentity,
                                    String paramsHash,
                                    UUID canonicalAttemptId,
                                    Throwable cause) {
        super("Completed attempt already exists specimen=" + specimenIdentity
                + " paramsHash=" + paramsHash
                + " canonicalAttempt=" + canonicalAttemptId, cause);
        this.specimenIdentity = specimenIdentity;
        this.paramsHash = paramsHash;
        this.canonicalAttemptId = canonicalAttemptId;
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public String getParamsHash() {
        return paramsHash;
    }

    public UUID getCanonicalAttemptId() {
        return canonicalAttemptId;
    }
}
