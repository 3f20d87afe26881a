package app.herbaria.provenance.domain.model;

import java.time.Instant;
import java.util.UUID;

public record ReviewDecisionRef(
        UUID decisionId,
        String status,
        String reviewer,
        Instant decidedAt
) {
}
