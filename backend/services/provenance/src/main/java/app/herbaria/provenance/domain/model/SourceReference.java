package app.herbaria.provenance.domain.model;

public record SourceReference(
        String ref,
        String format,
        Long sizeBytes,
        String role,
        String cameraFilename,
        String expectedCatalogNumber
) {
    public SourceReference {
        if (ref == null || ref.isBlank()) {
            throw new IllegalArgumentException("source ref is required");
        }
    }

    public static SourceReference of(String ref) {
        return new SourceReference(ref, null, null, null, null, null);
    }
}
