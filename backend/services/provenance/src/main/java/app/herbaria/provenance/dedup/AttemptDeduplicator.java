package app.herbaria.provenance.dedup;

import app.herbaria.provenance.addressing.ContentAddressor;
import app.herbaria.provenance.domain.model.AddressedParams;
import app.herbaria.provenance.domain.model.AttemptDraft;
import app.herbaria.provenance.domain.model.AttemptRef;
import app.herbaria.provenance.domain.model.AttemptResult;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.ExtractionDecision;
import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.exception.AttemptConflictException;
import app.herbaria.provenance.exception.ConfigurationException;
import app.herbaria.provenance.exception.TransientEngineException;
import app.herbaria.provenance.index.SpecimenIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Pairs the "already extracted?" check with attempt registration so callers never act on a
 * stale answer.
 *
 * <p>The check is advisory; the store's uniqueness constraint on completed attempts is what
 * makes the pair atomic across worker processes. A worker that loses the race keeps its result
 * as a failed attempt marked as discarded and does not retry.
 *
 * <p>Parameter sets carry provider, model and prompt version, so upgrading any of them yields
 * a new dedup key. Re-extracting under an unchanged key needs the force flag.
 */
@Component
public class AttemptDeduplicator {

    private static final Logger log = LoggerFactory.getLogger(AttemptDeduplicator.class);

    private final SpecimenIndex index;
    private final ContentAddressor addressor;
    private final FieldSchema schema;

    public AttemptDeduplicator(SpecimenIndex index, ContentAddressor addressor, FieldSchema schema) {
        this.index = index;
        this.addressor = addressor;
        this.schema = schema;
    }

    public ExtractionDecision check(ExtractionRequest request) {
        AddressedParams addressed = addressor.address(request.params());
        return index.shouldExtract(request.specimenIdentity(), addressed.paramsHash(), request.force());
    }

    /**
     * Runs the engine for the request unless a completed attempt already exists for its dedup key.
     */
    public ExtractionOutcome extract(ExtractionRequest request, ExtractionEngine engine) {
        AddressedParams addressed = addressor.address(request.params());
        if (!engine.provider().equals(addressed.provider())) {
            throw new ConfigurationException("Engine " + engine.provider()
                    + " cannot run parameters for provider " + addressed.provider());
        }

        String identity = request.specimenIdentity();
        ExtractionDecision decision = index.shouldExtract(identity, addressed.paramsHash(), request.force());
        if (!decision.extract()) {
            UUID existing = decision.existingAttempt().map(AttemptRef::attemptId).orElse(null);
            log.debug("Extraction skipped specimen={} paramsHash={} existingAttempt={}",
                    identity, addressed.paramsHash(), existing);
            return ExtractionOutcome.skipped(identity, addressed.paramsHash(), existing);
        }

        AttemptDraft draft = AttemptDraft.of(identity, addressed, request.force())
                .withImage(request.image().imageHash(), request.runId());
        ExtractionAttempt pending = index.openAttempt(draft);

        AttemptResult result;
        ConfigurationException configError = null;
        try {
            result = toResult(engine.extract(request.image(), request.params()));
        } catch (TransientEngineException ex) {
            log.warn("Extraction failed specimen={} provider={} errorType={} message={}",
                    identity, engine.provider(), ex.getClass().getSimpleName(), safeMessage(ex));
            result = AttemptResult.failed(List.of(errorText(ex)));
        } catch (ConfigurationException ex) {
            log.warn("Extraction misconfigured specimen={} provider={} message={}",
                    identity, engine.provider(), safeMessage(ex));
            result = AttemptResult.failed(List.of(errorText(ex)));
            configError = ex;
        } catch (RuntimeException ex) {
            log.warn("Extraction failed specimen={} provider={} errorType={} message={}",
                    identity, engine.provider(), ex.getClass().getSimpleName(), safeMessage(ex));
            result = AttemptResult.failed(List.of("malformed provider response: " + errorText(ex)));
        }

        ExtractionOutcome outcome = complete(pending, result);
        if (configError != null) {
            throw configError;
        }
        return outcome;
    }

    /**
     * Registers a result produced elsewhere (an imported batch run, say) under the same guard.
     */
    public ExtractionOutcome record(ExtractionRequest request, EngineResponse response) {
        AddressedParams addressed = addressor.address(request.params());
        String identity = request.specimenIdentity();
        ExtractionDecision decision = index.shouldExtract(identity, addressed.paramsHash(), request.force());
        if (!decision.extract()) {
            UUID existing = decision.existingAttempt().map(AttemptRef::attemptId).orElse(null);
            log.debug("Result not recorded, already extracted specimen={} paramsHash={} existingAttempt={}",
                    identity, addressed.paramsHash(), existing);
            return ExtractionOutcome.skipped(identity, addressed.paramsHash(), existing);
        }

        AttemptDraft draft = AttemptDraft.of(identity, addressed, request.force())
                .withImage(request.image().imageHash(), request.runId());
        AttemptResult result = toResult(response);
        try {
            return ExtractionOutcome.of(index.recordAttempt(draft, result));
        } catch (AttemptConflictException ex) {
            ExtractionAttempt discarded = index.recordAttempt(draft, discard(result, ex.getCanonicalAttemptId()));
            return ExtractionOutcome.duplicate(discarded, ex.getCanonicalAttemptId());
        }
    }

    AttemptResult toResult(EngineResponse response) {
        if (response == null) {
            return AttemptResult.failed(List.of("malformed provider response: empty"));
        }
        FieldSchema.Split split = schema.split(response.fields());
        List<String> errors = new ArrayList<>(response.errors());
        errors.addAll(split.warnings());
        if (!split.hasValues()) {
            if (errors.isEmpty()) {
                errors.add("no field values returned");
            }
            return new AttemptResult(AttemptStatus.failed, split.known(), split.extras(), errors);
        }
        return AttemptResult.completed(split.known(), split.extras(), errors);
    }

    private ExtractionOutcome complete(ExtractionAttempt pending, AttemptResult result) {
        try {
            return ExtractionOutcome.of(index.completeAttempt(pending.attemptId(), result));
        } catch (AttemptConflictException ex) {
            ExtractionAttempt discarded = index.completeAttempt(pending.attemptId(),
                    discard(result, ex.getCanonicalAttemptId()));
            log.info("Duplicate result discarded attempt={} specimen={} canonicalAttempt={}",
                    pending.attemptId(), pending.specimenIdentity(), ex.getCanonicalAttemptId());
            return ExtractionOutcome.duplicate(discarded, ex.getCanonicalAttemptId());
        }
    }

    private static AttemptResult discard(AttemptResult result, UUID canonicalAttemptId) {
        List<String> errors = new ArrayList<>(result.errors());
        errors.add("discarded: duplicate of canonical attempt " + canonicalAttemptId);
        return new AttemptResult(AttemptStatus.failed, result.fields(), result.extras(), errors);
    }

    private static String errorText(Exception ex) {
        String message = safeMessage(ex);
        return message.isEmpty() ? ex.getClass().getSimpleName() : message;
    }

    private static String safeMessage(Exception ex) {
        if (ex == null) {
            return "";
        }
        String message = ex.getMessage();
        if (message == null) {
            return "";
        }
        String trimmed = message.replaceAll("[\\r\\n]+", " ").trim();
        int max = 200;
        return trimmed.length() <= max ? trimmed : trimmed.substring(0, max) + "...";
    }
}
