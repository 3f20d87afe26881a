package app.herbaria.provenance.dedup;

import app.herbaria.provenance.domain.model.ExtractionParams;

public record ExtractionRequest(
        String specimenIdentity,
        ImageRef image,
        ExtractionParams params,
        boolean force,
        String runId
) {
    public ExtractionRequest {
        if (specimenIdentity == null || specimenIdentity.isBlank()) {
            throw new IllegalArgumentException("specimenIdentity is required");
        }
        if (params == null) {
            throw new IllegalArgumentException("params are required");
        }
        if (image == null) {
            image = new ImageRef(specimenIdentity, null);
        }
    }

    public static ExtractionRequest of(String specimenIdentity, ExtractionParams params) {
        return new ExtractionRequest(specimenIdentity, null, params, false, null);
    }

    public ExtractionRequest forced() {
        return new ExtractionRequest(specimenIdentity, image, params, true, runId);
    }
}
