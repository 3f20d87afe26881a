package app.herbaria.provenance.index;

import app.herbaria.provenance.aggregate.ValueNormalizer;
import app.herbaria.provenance.domain.entity.ExtractionAttemptEntity;
import app.herbaria.provenance.domain.entity.ImageTransformationEntity;
import app.herbaria.provenance.domain.entity.QualityFlagEntity;
import app.herbaria.provenance.domain.entity.ReviewDecisionEntity;
import app.herbaria.provenance.domain.entity.SourceFileEntity;
import app.herbaria.provenance.domain.entity.SpecimenAggregationEntity;
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
import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.exception.AttemptConflictException;
import app.herbaria.provenance.exception.AttemptStateException;
import app.herbaria.provenance.exception.IntegrityViolationException;
import app.herbaria.provenance.repository.ExtractionAttemptRepository;
import app.herbaria.provenance.repository.ImageTransformationRepository;
import app.herbaria.provenance.repository.QualityFlagRepository;
import app.herbaria.provenance.repository.ReviewDecisionRepository;
import app.herbaria.provenance.repository.SourceFileRepository;
import app.herbaria.provenance.repository.SpecimenAggregationRepository;
import app.herbaria.provenance.repository.SpecimenListingRepository;
import app.herbaria.provenance.repository.SpecimenRepository;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.Timestamp;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * {@link SpecimenIndex} over Postgres.
 *
 * <p>Writes that may collide with other workers run in their own transaction, so a rejected
 * insert never poisons a caller's surrounding transaction. Reads go through Spring Data.
 */
@Repository
public class PostgresSpecimenIndex implements SpecimenIndex {

    private static final Logger log = LoggerFactory.getLogger(PostgresSpecimenIndex.class);

    private static final String RECORD_LEVEL_FIELD = "record";

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate writeTx;
    private final AttemptJsonCodec codec;
    private final SpecimenRepository specimenRepository;
    private final SourceFileRepository sourceFileRepository;
    private final ImageTransformationRepository transformationRepository;
    private final ExtractionAttemptRepository attemptRepository;
    private final SpecimenAggregationRepository aggregationRepository;
    private final QualityFlagRepository flagRepository;
    private final ReviewDecisionRepository reviewDecisionRepository;
    private final SpecimenListingRepository listingRepository;

    public PostgresSpecimenIndex(JdbcTemplate jdbcTemplate,
                                 PlatformTransactionManager txManager,
                                 ObjectMapper objectMapper,
                                 SpecimenRepository specimenRepository,
                                 SourceFileRepository sourceFileRepository,
                                 ImageTransformationRepository transformationRepository,
                                 ExtractionAttemptRepository attemptRepository,
                                 SpecimenAggregationRepository aggregationRepository,
                                 QualityFlagRepository flagRepository,
                                 ReviewDecisionRepository reviewDecisionRepository,
                                 SpecimenListingRepository listingRepository) {
        this.jdbcTemplate = jdbcTemplate;
        this.writeTx = new TransactionTemplate(txManager);
        this.writeTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
        this.codec = new AttemptJsonCodec(objectMapper);
        this.specimenRepository = specimenRepository;
        this.sourceFileRepository = sourceFileRepository;
        this.transformationRepository = transformationRepository;
        this.attemptRepository = attemptRepository;
        this.aggregationRepository = aggregationRepository;
        this.flagRepository = flagRepository;
        this.reviewDecisionRepository = reviewDecisionRepository;
        this.listingRepository = listingRepository;
    }

    @Override
    public boolean registerSpecimen(String identity, SourceReference source) {
        requireIdentity(identity);
        Instant now = now();
        Boolean created = writeTx.execute(status -> {
            int inserted = jdbcTemplate.update(
                    """
                    insert into app_provenance.specimens (specimen_identity, first_seen_at)
                    values (?, ?)
                    on conflict (specimen_identity) do nothing
                    """,
                    identity,
                    Timestamp.from(now)
            );
            if (source != null) {
                jdbcTemplate.update(
                        """
                        insert into app_provenance.source_files (
                            source_id, specimen_identity, source_ref, format, size_bytes, role,
                            camera_filename, expected_catalog_number, registered_at
                        )
                        values (?, ?, ?, ?, ?, ?, ?, ?, ?)
                        on conflict (specimen_identity, source_ref) do nothing
                        """,
                        UUID.randomUUID(),
                        identity,
                        source.ref(),
                        source.format(),
                        source.sizeBytes(),
                        source.role(),
                        source.cameraFilename(),
                        source.expectedCatalogNumber(),
                        Timestamp.from(now)
                );
            }
            return inserted > 0;
        });
        boolean isNew = Boolean.TRUE.equals(created);
        if (isNew) {
            log.info("Specimen registered specimen={} source={}", identity, source == null ? null : source.ref());
        }
        return isNew;
    }

    @Override
    public boolean registerTransformation(Transformation transformation) {
        requireIdentity(transformation.specimenIdentity());
        if (transformation.derivedHash() == null || transformation.derivedHash().isBlank()) {
            throw new IllegalArgumentException("derivedHash is required");
        }
        if (transformation.derivedHash().equals(transformation.specimenIdentity())) {
            throw new IntegrityViolationException("Derived image cannot be its own specimen original hash="
                    + transformation.derivedHash());
        }
        Instant createdAt = transformation.createdAt() != null ? transformation.createdAt() : now();
        int inserted;
        try {
            inserted = writeTx.execute(status -> jdbcTemplate.update(
                    """
                    insert into app_provenance.image_transformations (
                        derived_hash, specimen_identity, derived_from, operation, params_json,
                        tool, tool_version, stored_at, created_at
                    )
                    values (?, ?, ?, ?, cast(? as jsonb), ?, ?, ?, ?)
                    on conflict (derived_hash) do nothing
                    """,
                    transformation.derivedHash(),
                    transformation.specimenIdentity(),
                    transformation.derivedFrom() != null ? transformation.derivedFrom() : transformation.specimenIdentity(),
                    transformation.operation(),
                    transformation.params() == null ? null : codec.toJsonText(transformation.params()),
                    transformation.tool(),
                    transformation.toolVersion(),
                    transformation.storedAt(),
                    Timestamp.from(createdAt)
            ));
        } catch (DataIntegrityViolationException ex) {
            throw new IntegrityViolationException("Transformation references an unknown specimen specimen="
                    + transformation.specimenIdentity(), ex);
        }
        if (inserted > 0) {
            return true;
        }
        String linked = transformationRepository.findById(transformation.derivedHash())
                .map(ImageTransformationEntity::getSpecimenIdentity)
                .orElse(null);
        if (linked != null && !linked.equals(transformation.specimenIdentity())) {
            throw new IntegrityViolationException("Derived image already linked to another specimen hash="
                    + transformation.derivedHash() + " specimen=" + linked);
        }
        return false;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<String> resolveSpecimen(String imageHash) {
        if (imageHash == null || imageHash.isBlank()) {
            return Optional.empty();
        }
        if (specimenRepository.existsById(imageHash)) {
            return Optional.of(imageHash);
        }
        return transformationRepository.findById(imageHash).map(ImageTransformationEntity::getSpecimenIdentity);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<Specimen> findSpecimen(String identity) {
        return specimenRepository.findById(identity)
                .map(entity -> new Specimen(entity.getSpecimenIdentity(), entity.getFirstSeenAt()));
    }

    @Override
    @Transactional(readOnly = true)
    public ExtractionDecision shouldExtract(String identity, String paramsHash, boolean force) {
        Optional<ExtractionAttemptEntity> completed = findCompleted(identity, paramsHash);
        if (force) {
            return completed.map(entity -> ExtractionDecision.proceed(codec.toModel(entity).toRef()))
                    .orElseGet(ExtractionDecision::proceed);
        }
        if (completed.isPresent()) {
            return ExtractionDecision.skip(codec.toModel(completed.get()).toRef());
        }
        return attemptRepository
                .findFirstBySpecimenIdentityAndParamsHashAndStatusOrderByCreatedAtDesc(identity, paramsHash, AttemptStatus.failed)
                .map(entity -> ExtractionDecision.proceed(codec.toModel(entity).toRef()))
                .orElseGet(ExtractionDecision::proceed);
    }

    @Override
    public ExtractionAttempt recordAttempt(AttemptDraft draft, AttemptResult result) {
        UUID attemptId = UUID.randomUUID();
        Instant now = now();
        try {
            writeTx.executeWithoutResult(status -> jdbcTemplate.update(
                    """
                    insert into app_provenance.extraction_attempts (
                        attempt_id, specimen_identity, provider, model, params_hash, params_json,
                        image_hash, run_id, forced, status, fields_json, extras_json, errors_json,
                        created_at, completed_at
                    )
                    values (?, ?, ?, ?, ?, cast(? as jsonb), ?, ?, ?,
                            cast(? as app_provenance.attempt_status),
                            cast(? as jsonb), cast(? as jsonb), cast(? as jsonb), ?, ?)
                    """,
                    attemptId,
                    draft.specimenIdentity(),
                    draft.provider(),
                    draft.model(),
                    draft.paramsHash(),
                    paramsText(draft),
                    draft.imageHash(),
                    draft.runId(),
                    draft.forced(),
                    result.status().name(),
                    codec.toJsonText(codec.writeFields(result.fields())),
                    codec.toJsonText(codec.writeFields(result.extras())),
                    codec.toJsonText(codec.writeErrors(result.errors())),
                    Timestamp.from(now),
                    Timestamp.from(now)
            ));
        } catch (DuplicateKeyException ex) {
            throw conflict(draft.specimenIdentity(), draft.paramsHash(), ex);
        } catch (DataIntegrityViolationException ex) {
            throw new IntegrityViolationException("Attempt references an unknown specimen specimen="
                    + draft.specimenIdentity(), ex);
        }
        log.info("Attempt recorded attempt={} specimen={} provider={} status={}",
                attemptId, draft.specimenIdentity(), draft.provider(), result.status());
        return toAttempt(attemptId, draft, result, now, now);
    }

    @Override
    public ExtractionAttempt openAttempt(AttemptDraft draft) {
        UUID attemptId = UUID.randomUUID();
        Instant now = now();
        try {
            writeTx.executeWithoutResult(status -> jdbcTemplate.update(
                    """
                    insert into app_provenance.extraction_attempts (
                        attempt_id, specimen_identity, provider, model, params_hash, params_json,
                        image_hash, run_id, forced, status, created_at
                    )
                    values (?, ?, ?, ?, ?, cast(? as jsonb), ?, ?, ?, 'pending', ?)
                    """,
                    attemptId,
                    draft.specimenIdentity(),
                    draft.provider(),
                    draft.model(),
                    draft.paramsHash(),
                    paramsText(draft),
                    draft.imageHash(),
                    draft.runId(),
                    draft.forced(),
                    Timestamp.from(now)
            ));
        } catch (DataIntegrityViolationException ex) {
            throw new IntegrityViolationException("Attempt references an unknown specimen specimen="
                    + draft.specimenIdentity(), ex);
        }
        return new ExtractionAttempt(attemptId, draft.specimenIdentity(), draft.provider(), draft.model(),
                draft.paramsHash(), draft.imageHash(), draft.runId(), draft.forced(), AttemptStatus.pending,
                null, null, null, now, null);
    }

    @Override
    public ExtractionAttempt completeAttempt(UUID attemptId, AttemptResult result) {
        Instant now = now();
        int updated;
        try {
            updated = writeTx.execute(status -> jdbcTemplate.update(
                    """
                    update app_provenance.extraction_attempts
                    set status = cast(? as app_provenance.attempt_status),
                        fields_json = cast(? as jsonb),
                        extras_json = cast(? as jsonb),
                        errors_json = cast(? as jsonb),
                        completed_at = ?
                    where attempt_id = ?
                      and status = 'pending'
                    """,
                    result.status().name(),
                    codec.toJsonText(codec.writeFields(result.fields())),
                    codec.toJsonText(codec.writeFields(result.extras())),
                    codec.toJsonText(codec.writeErrors(result.errors())),
                    Timestamp.from(now),
                    attemptId
            ));
        } catch (DuplicateKeyException ex) {
            ExtractionAttemptEntity pending = attemptRepository.findById(attemptId)
                    .orElseThrow(() -> new AttemptStateException(attemptId, "Attempt not found"));
            throw conflict(pending.getSpecimenIdentity(), pending.getParamsHash(), ex);
        }
        if (updated == 0) {
            boolean exists = attemptRepository.existsById(attemptId);
            throw new AttemptStateException(attemptId, exists ? "Attempt is already terminal" : "Attempt not found");
        }
        ExtractionAttempt attempt = attemptRepository.findById(attemptId)
                .map(codec::toModel)
                .orElseThrow(() -> new AttemptStateException(attemptId, "Attempt not found"));
        log.info("Attempt completed attempt={} specimen={} provider={} status={}",
                attemptId, attempt.specimenIdentity(), attempt.provider(), attempt.status());
        return attempt;
    }

    @Override
    @Transactional(readOnly = true)
    public List<ExtractionAttempt> findAttempts(String identity) {
        return attemptRepository.findBySpecimenIdentityOrderByCreatedAtAscAttemptIdAsc(identity).stream()
                .map(codec::toModel)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<String> queryByCatalogNumber(String catalogNumber) {
        String key = ValueNormalizer.normalize(catalogNumber);
        if (key == null) {
            return List.of();
        }
        return aggregationRepository.findByCatalogNumberKeyOrderBySpecimenIdentityAsc(key).stream()
                .map(SpecimenAggregationEntity::getSpecimenIdentity)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<DuplicateGroup> listDuplicates() {
        return aggregationRepository.findDuplicateGroups().stream()
                .map(row -> new DuplicateGroup(
                        row.getCatalogNumber(),
                        Arrays.asList(row.getSpecimenIdentities().split(","))
                ))
                .toList();
    }

    @Override
    public boolean saveAggregation(AggregatedRecord record) {
        String catalogNumber = record.value(DwcTerm.catalogNumber).orElse(null);
        Integer saved = writeTx.execute(status -> jdbcTemplate.update(
                """
                insert into app_provenance.specimen_aggregations (
                    specimen_identity, record_json, catalog_number, catalog_number_key, attempt_count, computed_at
                )
                values (?, cast(? as jsonb), ?, ?, ?, ?)
                on conflict (specimen_identity) do update
                set record_json = excluded.record_json,
                    catalog_number = excluded.catalog_number,
                    catalog_number_key = excluded.catalog_number_key,
                    attempt_count = excluded.attempt_count,
                    computed_at = excluded.computed_at
                where app_provenance.specimen_aggregations.attempt_count <= excluded.attempt_count
                """,
                record.specimenIdentity(),
                codec.toJsonText(codec.writeRecord(record)),
                catalogNumber,
                ValueNormalizer.normalize(catalogNumber),
                record.attemptCount(),
                Timestamp.from(now())
        ));
        boolean stored = saved != null && saved > 0;
        if (!stored) {
            log.debug("Stale aggregation skipped specimen={} attemptCount={}",
                    record.specimenIdentity(), record.attemptCount());
        }
        return stored;
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<AggregatedRecord> findAggregation(String identity) {
        return aggregationRepository.findById(identity).map(entity -> codec.readRecord(entity.getRecordJson()));
    }

    @Override
    public List<QualityFlag> replaceFlags(String identity, List<QualityFlag> flags) {
        Map<String, QualityFlag> wanted = new LinkedHashMap<>();
        for (QualityFlag flag : flags) {
            wanted.putIfAbsent(flagKey(flag.kind().name(), fieldOf(flag)), flag);
        }
        Instant now = now();
        writeTx.executeWithoutResult(status -> {
            List<UUID> stale = new ArrayList<>();
            for (QualityFlagEntity existing : flagRepository.findBySpecimenIdentityOrderByKindAscFieldAsc(identity)) {
                if (!wanted.containsKey(flagKey(existing.getKind().name(), existing.getField()))) {
                    stale.add(existing.getFlagId());
                }
            }
            for (UUID flagId : stale) {
                jdbcTemplate.update("delete from app_provenance.quality_flags where flag_id = ?", flagId);
            }
            for (QualityFlag flag : wanted.values()) {
                jdbcTemplate.update(
                        """
                        insert into app_provenance.quality_flags (
                            flag_id, specimen_identity, kind, field, severity, detail, created_at, updated_at
                        )
                        values (?, ?, cast(? as app_provenance.flag_kind), ?,
                                cast(? as app_provenance.flag_severity), ?, ?, ?)
                        on conflict (specimen_identity, kind, field) do update
                        set severity = excluded.severity,
                            detail = excluded.detail,
                            updated_at = excluded.updated_at
                        """,
                        UUID.randomUUID(),
                        identity,
                        flag.kind().name(),
                        fieldOf(flag),
                        flag.severity().name(),
                        flag.detail() == null ? "" : flag.detail(),
                        Timestamp.from(now),
                        Timestamp.from(now)
                );
            }
        });
        return findFlags(identity);
    }

    @Override
    @Transactional(readOnly = true)
    public List<QualityFlag> findFlags(String identity) {
        return flagRepository.findBySpecimenIdentityOrderByKindAscFieldAsc(identity).stream()
                .map(entity -> new QualityFlag(
                        entity.getSpecimenIdentity(),
                        entity.getKind(),
                        entity.getField(),
                        entity.getSeverity(),
                        entity.getDetail(),
                        entity.getCreatedAt()
                ))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<SourceFile> findSourceFiles(String identity) {
        return sourceFileRepository.findBySpecimenIdentityOrderByRegisteredAtAscSourceRefAsc(identity).stream()
                .map(PostgresSpecimenIndex::toSourceFile)
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public List<Transformation> findTransformations(String identity) {
        return transformationRepository.findBySpecimenIdentityOrderByCreatedAtAscDerivedHashAsc(identity).stream()
                .map(entity -> new Transformation(
                        entity.getDerivedHash(),
                        entity.getSpecimenIdentity(),
                        entity.getDerivedFrom(),
                        entity.getOperation(),
                        entity.getParamsJson(),
                        entity.getTool(),
                        entity.getToolVersion(),
                        entity.getStoredAt(),
                        entity.getCreatedAt()
                ))
                .toList();
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<ReviewDecisionRef> findLatestReviewDecision(String identity) {
        return reviewDecisionRepository.findFirstBySpecimenIdentityOrderByDecidedAtDesc(identity)
                .map(PostgresSpecimenIndex::toReviewRef);
    }

    @Override
    public Page<SpecimenSummary> listSpecimens(SpecimenFilter filter, Pageable pageable) {
        return listingRepository.findSummaries(filter, pageable);
    }

    @Override
    public List<String> listIdentitiesAfter(String afterIdentity, SpecimenFilter filter, int limit) {
        return listingRepository.findIdentitiesAfter(afterIdentity, filter, limit);
    }

    @Override
    public List<String> findStaleSpecimens(int limit) {
        return listingRepository.findStaleIdentities(limit);
    }

    @Override
    @Transactional(readOnly = true)
    public IndexStats stats() {
        return new IndexStats(
                specimenRepository.count(),
                sourceFileRepository.count(),
                transformationRepository.count(),
                attemptRepository.countByStatus(AttemptStatus.pending),
                attemptRepository.countByStatus(AttemptStatus.complete),
                attemptRepository.countByStatus(AttemptStatus.failed),
                flagRepository.countFlaggedSpecimens(),
                reviewDecisionRepository.count()
        );
    }

    private Optional<ExtractionAttemptEntity> findCompleted(String identity, String paramsHash) {
        Optional<ExtractionAttemptEntity> canonical = attemptRepository
                .findFirstBySpecimenIdentityAndParamsHashAndStatusAndForcedFalseOrderByCreatedAtAsc(
                        identity, paramsHash, AttemptStatus.complete);
        if (canonical.isPresent()) {
            return canonical;
        }
        return attemptRepository.findFirstBySpecimenIdentityAndParamsHashAndStatusOrderByCreatedAtDesc(
                identity, paramsHash, AttemptStatus.complete);
    }

    private AttemptConflictException conflict(String identity, String paramsHash, DataIntegrityViolationException ex) {
        UUID canonicalId = attemptRepository
                .findFirstBySpecimenIdentityAndParamsHashAndStatusAndForcedFalseOrderByCreatedAtAsc(
                        identity, paramsHash, AttemptStatus.complete)
                .map(ExtractionAttemptEntity::getAttemptId)
                .orElse(null);
        log.info("Duplicate completed attempt rejected specimen={} paramsHash={} canonicalAttempt={}",
                identity, paramsHash, canonicalId);
        return new AttemptConflictException(identity, paramsHash, canonicalId, ex);
    }

    private String paramsText(AttemptDraft draft) {
        return draft.params() == null ? "{}" : codec.toJsonText(draft.params());
    }

    private ExtractionAttempt toAttempt(UUID attemptId,
                                        AttemptDraft draft,
                                        AttemptResult result,
                                        Instant createdAt,
                                        Instant completedAt) {
        return new ExtractionAttempt(attemptId, draft.specimenIdentity(), draft.provider(), draft.model(),
                draft.paramsHash(), draft.imageHash(), draft.runId(), draft.forced(), result.status(),
                result.fields(), result.extras(), result.errors(), createdAt, completedAt);
    }

    private static SourceFile toSourceFile(SourceFileEntity entity) {
        return new SourceFile(
                entity.getSourceId(),
                entity.getSpecimenIdentity(),
                entity.getSourceRef(),
                entity.getFormat(),
                entity.getSizeBytes(),
                entity.getRole(),
                entity.getCameraFilename(),
                entity.getExpectedCatalogNumber(),
                entity.getRegisteredAt()
        );
    }

    private static ReviewDecisionRef toReviewRef(ReviewDecisionEntity entity) {
        return new ReviewDecisionRef(
                entity.getDecisionId(),
                entity.getStatus(),
                entity.getReviewer(),
                entity.getDecidedAt()
        );
    }

    private static String fieldOf(QualityFlag flag) {
        return (flag.field() == null || flag.field().isBlank()) ? RECORD_LEVEL_FIELD : flag.field();
    }

    private static String flagKey(String kind, String field) {
        return kind + "|" + field;
    }

    private static void requireIdentity(String identity) {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("specimen identity is required");
        }
    }

    private static Instant now() {
        return Instant.now().truncatedTo(ChronoUnit.MICROS);
    }
}
