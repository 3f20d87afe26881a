package app.herbaria.provenance.domain.model;

import java.util.Optional;

/**
 * Answer to "should this (specimen, params) pair be extracted": the flag plus the attempt
 * that drove the decision, if any.
 */
public record ExtractionDecision(
        boolean extract,
        AttemptRef existing
) {
    public static ExtractionDecision proceed() {
        return new ExtractionDecision(true, null);
    }

    public static ExtractionDecision proceed(AttemptRef previous) {
        return new ExtractionDecision(true, previous);
    }

    public static ExtractionDecision skip(AttemptRef completed) {
        return new ExtractionDecision(false, completed);
    }

    public Optional<AttemptRef> existingAttempt() {
        return Optional.ofNullable(existing);
    }
}
