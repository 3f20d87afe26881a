package app.herbaria.provenance.domain.model;

import java.time.Instant;

public record SpecimenSummary(
        String identity,
        Instant firstSeenAt,
        String catalogNumber,
        int attemptCount,
        int flagCount,
        String reviewStatus
) {
}
