package app.herbaria.provenance.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Links a derived (preprocessed) image back to the specimen whose original it came from.
 */
public record Transformation(
        String derivedHash,
        String specimenIdentity,
        String derivedFrom,
        String operation,
        JsonNode params,
        String tool,
        String toolVersion,
        String storedAt,
        Instant createdAt
) {
}
