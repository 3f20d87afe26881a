package app.herbaria.provenance.domain.model;

import java.time.Instant;
import java.util.UUID;

public record CandidateValue(
        String value,
        double confidence,
        UUID attemptId,
        String provider,
        Instant observedAt
) {
}
