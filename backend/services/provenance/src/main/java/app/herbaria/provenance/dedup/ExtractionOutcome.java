package app.herbaria.provenance.dedup;

import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.type.AttemptStatus;

import java.util.UUID;

/**
 * What a guarded extraction did.
 *
 * <ul>
 *   <li>{@code extracted}: a completed attempt was registered as canonical (or forced)</li>
 *   <li>{@code failed}: a failed attempt was registered</li>
 *   <li>{@code skipped}: a completed attempt already existed, nothing was called or written</li>
 *   <li>{@code duplicate}: another worker won the race; this result was kept as a discarded failed attempt</li>
 * </ul>
 */
public record ExtractionOutcome(
        Kind kind,
        String specimenIdentity,
        String paramsHash,
        ExtractionAttempt attempt,
        UUID existingAttemptId
) {
    public enum Kind {
        extracted,
        failed,
        skipped,
        duplicate
    }

    public static ExtractionOutcome of(ExtractionAttempt attempt) {
        Kind kind = attempt.status() == AttemptStatus.complete
                ? Kind.extracted
                : Kind.failed;
        return new ExtractionOutcome(kind, attempt.specimenIdentity(), attempt.paramsHash(), attempt, null);
    }

    public static ExtractionOutcome skipped(String specimenIdentity, String paramsHash, UUID existingAttemptId) {
        return new ExtractionOutcome(Kind.skipped, specimenIdentity, paramsHash, null, existingAttemptId);
    }

    public static ExtractionOutcome duplicate(ExtractionAttempt discarded, UUID canonicalAttemptId) {
        return new ExtractionOutcome(Kind.duplicate, discarded.specimenIdentity(), discarded.paramsHash(),
                discarded, canonicalAttemptId);
    }

    public boolean wroteAttempt() {
        return attempt != null;
    }
}
