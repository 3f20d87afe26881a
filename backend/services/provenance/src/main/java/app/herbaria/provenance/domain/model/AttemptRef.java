package app.herbaria.provenance.domain.model;

import app.herbaria.provenance.domain.type.AttemptStatus;

import java.time.Instant;
import java.util.UUID;

public record AttemptRef(
        UUID attemptId,
        AttemptStatus status,
        Instant createdAt
) {
}
