package app.herbaria.provenance.dedup;

/**
 * The image an engine is asked to read: its content hash plus where the engine can fetch it.
 * The hash may be a derived (preprocessed) image of the specimen.
 */
public record ImageRef(
        String imageHash,
        String location
) {
}
