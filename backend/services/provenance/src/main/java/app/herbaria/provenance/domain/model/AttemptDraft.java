package app.herbaria.provenance.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

public record AttemptDraft(
        String specimenIdentity,
        String paramsHash,
        JsonNode params,
        String provider,
        String model,
        String imageHash,
        String runId,
        boolean forced
) {
    public AttemptDraft {
        if (specimenIdentity == null || specimenIdentity.isBlank()) {
            throw new IllegalArgumentException("specimenIdentity is required");
        }
        if (paramsHash == null || paramsHash.isBlank()) {
            throw new IllegalArgumentException("paramsHash is required");
        }
        if (provider == null || provider.isBlank()) {
            throw new IllegalArgumentException("provider is required");
        }
    }

    public static AttemptDraft of(String specimenIdentity, AddressedParams params, boolean forced) {
        return new AttemptDraft(specimenIdentity, params.paramsHash(), params.canonical(),
                params.provider(), params.model(), null, null, forced);
    }

    public AttemptDraft withImage(String imageHash, String runId) {
        return new AttemptDraft(specimenIdentity, paramsHash, params, provider, model, imageHash, runId, forced);
    }
}
