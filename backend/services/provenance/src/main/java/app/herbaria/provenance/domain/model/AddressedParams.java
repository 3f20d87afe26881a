package app.herbaria.provenance.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

public record AddressedParams(
        String paramsHash,
        JsonNode canonical,
        String provider,
        String model
) {
}
