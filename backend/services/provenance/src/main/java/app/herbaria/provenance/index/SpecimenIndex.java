package app.herbaria.provenance.index;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.AttemptDraft;
import app.herbaria.provenance.domain.model.AttemptResult;
import app.herbaria.provenance.domain.model.DuplicateGroup;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.ExtractionDecision;
import app.herbaria.provenance.domain.model.IndexStats;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.model.ReviewDecisionRef;
import app.herbaria.provenance.domain.model.SourceFile;
import app.herbaria.provenance.domain.model.SourceReference;
import app.herbaria.provenance.domain.model.Specimen;
import app.herbaria.provenance.domain.model.SpecimenFilter;
import app.herbaria.provenance.domain.model.SpecimenSummary;
import app.herbaria.provenance.domain.model.Transformation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Persistent store of specimens, their sources, transformations and extraction attempts.
 *
 * <p>Attempts are append-only. The only write with mutual-exclusion semantics is registering
 * a completed attempt: at most one non-forced completed attempt may exist per
 * (specimen identity, params hash), enforced by the store itself so it holds across processes.
 * A losing writer gets {@link app.herbaria.provenance.exception.AttemptConflictException}.
 */
public interface SpecimenIndex {

    /**
     * Creates the specimen if unseen and attaches the source edge if new.
     *
     * @return true when the specimen did not exist before
     */
    boolean registerSpecimen(String identity, SourceReference source);

    /**
     * @return true when the derived image was not linked before
     */
    boolean registerTransformation(Transformation transformation);

    Optional<String> resolveSpecimen(String imageHash);

    Optional<Specimen> findSpecimen(String identity);

    ExtractionDecision shouldExtract(String identity, String paramsHash, boolean force);

    /**
     * Appends a terminal attempt in one step.
     */
    ExtractionAttempt recordAttempt(AttemptDraft draft, AttemptResult result);

    ExtractionAttempt openAttempt(AttemptDraft draft);

    /**
     * Moves a pending attempt to its terminal state. Terminal attempts are never edited.
     */
    ExtractionAttempt completeAttempt(UUID attemptId, AttemptResult result);

    List<ExtractionAttempt> findAttempts(String identity);

    List<String> queryByCatalogNumber(String catalogNumber);

    List<DuplicateGroup> listDuplicates();

    /**
     * Stores the derived snapshot unless a snapshot computed from more attempts is already there.
     */
    boolean saveAggregation(AggregatedRecord record);

    Optional<AggregatedRecord> findAggregation(String identity);

    List<QualityFlag> replaceFlags(String identity, List<QualityFlag> flags);

    List<QualityFlag> findFlags(String identity);

    List<SourceFile> findSourceFiles(String identity);

    List<Transformation> findTransformations(String identity);

    Optional<ReviewDecisionRef> findLatestReviewDecision(String identity);

    Page<SpecimenSummary> listSpecimens(SpecimenFilter filter, Pageable pageable);

    List<String> listIdentitiesAfter(String afterIdentity, SpecimenFilter filter, int limit);

    /**
     * Specimens with more terminal attempts than their stored snapshot was computed from.
     */
    List<String> findStaleSpecimens(int limit);

    IndexStats stats();
}
