package app.herbaria.provenance.domain.model;

import java.time.Instant;

public record Specimen(
        String identity,
        Instant firstSeenAt
) {
}
