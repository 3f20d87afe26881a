package app.herbaria.provenance.service;

import app.herbaria.provenance.addressing.ContentAddressor;
import app.herbaria.provenance.dedup.AttemptDeduplicator;
import app.herbaria.provenance.dedup.EngineResponse;
import app.herbaria.provenance.dedup.ExtractionEngine;
import app.herbaria.provenance.dedup.ExtractionOutcome;
import app.herbaria.provenance.dedup.ExtractionRequest;
import app.herbaria.provenance.domain.model.SourceReference;
import app.herbaria.provenance.domain.model.Transformation;
import app.herbaria.provenance.index.SpecimenIndex;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Optional;

/**
 * Entry point for extraction workers: address, guard, register, then derive.
 */
@Service
public class ExtractionService {

    private static final Logger log = LoggerFactory.getLogger(ExtractionService.class);

    private final ContentAddressor addressor;
    private final SpecimenIndex index;
    private final AttemptDeduplicator deduplicator;
    private final SpecimenRecordService recordService;

    public ExtractionService(ContentAddressor addressor,
                             SpecimenIndex index,
                             AttemptDeduplicator deduplicator,
                             SpecimenRecordService recordService) {
        this.addressor = addressor;
        this.index = index;
        this.deduplicator = deduplicator;
        this.recordService = recordService;
    }

    /**
     * Registers an original image and returns its specimen identity. Re-ingesting the same
     * bytes from another file only adds a source edge.
     */
    public String ingest(byte[] imageBytes, SourceReference source) {
        String identity = addressor.identify(imageBytes);
        index.registerSpecimen(identity, source);
        return identity;
    }

    /**
     * Links a preprocessed image to its specimen and returns the derived image's hash.
     */
    public String registerDerivative(String specimenIdentity,
                                     String derivedFrom,
                                     byte[] derivedBytes,
                                     String operation,
                                     JsonNode params,
                                     String tool,
                                     String toolVersion,
                                     String storedAt) {
        String derivedHash = addressor.identify(derivedBytes);
        index.registerTransformation(new Transformation(
                derivedHash,
                specimenIdentity,
                derivedFrom == null ? specimenIdentity : derivedFrom,
                operation,
                params,
                tool,
                toolVersion,
                storedAt,
                null
        ));
        return derivedHash;
    }

    public Optional<String> resolveSpecimen(String imageHash) {
        return index.resolveSpecimen(imageHash);
    }

    public ExtractionOutcome extract(ExtractionRequest request, ExtractionEngine engine) {
        ExtractionOutcome outcome = deduplicator.extract(request, engine);
        refresh(outcome);
        return outcome;
    }

    public ExtractionOutcome record(ExtractionRequest request, EngineResponse response) {
        ExtractionOutcome outcome = deduplicator.record(request, response);
        refresh(outcome);
        return outcome;
    }

    private void refresh(ExtractionOutcome outcome) {
        if (!outcome.wroteAttempt()) {
            return;
        }
        try {
            recordService.recompute(outcome.specimenIdentity());
        } catch (RuntimeException ex) {
            // the attempt is stored; the recompute sweeper picks the specimen up
            log.warn("Recompute after attempt failed specimen={} errorType={} message={}",
                    outcome.specimenIdentity(), ex.getClass().getSimpleName(), safeMessage(ex));
        }
    }

    private static String safeMessage(Exception ex) {
        String message = ex.getMessage();
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}
