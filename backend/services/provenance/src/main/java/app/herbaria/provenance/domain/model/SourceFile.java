package app.herbaria.provenance.domain.model;

import java.time.Instant;
import java.util.UUID;

public record SourceFile(
        UUID sourceId,
        String specimenIdentity,
        String ref,
        String format,
        Long sizeBytes,
        String role,
        String cameraFilename,
        String expectedCatalogNumber,
        Instant registeredAt
) {
}
