package app.herbaria.provenance.service;

import app.herbaria.provenance.aggregate.CandidateAggregator;
import app.herbaria.provenance.aggregate.ValueNormalizer;
import app.herbaria.provenance.audit.AuditContext;
import app.herbaria.provenance.audit.IndexAuditContext;
import app.herbaria.provenance.audit.QualityAuditor;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.DuplicateGroup;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.model.SpecimenFilter;
import app.herbaria.provenance.domain.model.SpecimenSummary;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.index.SpecimenIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.web.server.ResponseStatusException;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Derives a specimen's record and flags from its attempts, and serves them to readers.
 *
 * <p>Recompute is append-then-derive: it never patches a previous result. Concurrent recomputes
 * of one specimen are harmless; the snapshot store keeps whichever saw more attempts.
 */
@Service
public class SpecimenRecordService {

    private static final Logger log = LoggerFactory.getLogger(SpecimenRecordService.class);

    private static final int MAX_PAGE_SIZE = 200;

    private final SpecimenIndex index;
    private final CandidateAggregator aggregator;
    private final QualityAuditor auditor;
    private final AuditContext auditContext;

    public SpecimenRecordService(SpecimenIndex index, CandidateAggregator aggregator, QualityAuditor auditor) {
        this.index = index;
        this.aggregator = aggregator;
        this.auditor = auditor;
        this.auditContext = new IndexAuditContext(index);
    }

    /**
     * Recomputes the record and flags of one specimen, then re-audits specimens that share
     * its old or new catalog number so duplicate flags appear and clear on both sides.
     */
    public SpecimenRecordView recompute(String identity) {
        List<ExtractionAttempt> attempts = index.findAttempts(identity);
        AggregatedRecord record = aggregator.aggregate(identity, attempts);

        String previousCatalog = index.findAggregation(identity)
                .flatMap(r -> r.value(DwcTerm.catalogNumber))
                .orElse(null);
        if (!index.saveAggregation(record)) {
            return currentView(identity);
        }

        List<QualityFlag> flags = index.replaceFlags(identity, auditor.audit(record, auditContext));
        log.info("Specimen recomputed specimen={} attempts={} fields={} conflicts={} flags={}",
                identity, record.attemptCount(), record.fields().size(), record.conflicts().size(), flags.size());

        Set<String> keys = new LinkedHashSet<>();
        keys.add(ValueNormalizer.normalize(previousCatalog));
        keys.add(ValueNormalizer.normalize(record.value(DwcTerm.catalogNumber).orElse(null)));
        keys.remove(null);
        Set<String> peers = new LinkedHashSet<>();
        for (String key : keys) {
            peers.addAll(index.queryByCatalogNumber(key));
        }
        peers.remove(identity);
        for (String peer : peers) {
            reaudit(peer);
        }
        flags = settleDuplicateFlag(record, flags);

        return new SpecimenRecordView(record, flags, index.findLatestReviewDecision(identity).orElse(null));
    }

    public SpecimenRecordView getAggregatedRecord(String identity) {
        if (index.findSpecimen(identity).isEmpty()) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND, "Specimen not found: " + identity);
        }
        AggregatedRecord record = aggregator.aggregate(identity, index.findAttempts(identity));
        return new SpecimenRecordView(
                record,
                index.findFlags(identity),
                index.findLatestReviewDecision(identity).orElse(null)
        );
    }

    public Page<SpecimenSummary> listSpecimens(SpecimenFilter filter, int page, int limit) {
        if (page < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "page must be >= 1");
        }
        if (limit < 1 || limit > MAX_PAGE_SIZE) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "limit must be between 1 and " + MAX_PAGE_SIZE);
        }
        return index.listSpecimens(filter == null ? SpecimenFilter.all() : filter, PageRequest.of(page - 1, limit));
    }

    public List<DuplicateGroup> listDuplicates() {
        return index.listDuplicates();
    }

    private void reaudit(String identity) {
        index.findAggregation(identity).ifPresent(snapshot -> {
            List<QualityFlag> flags = index.replaceFlags(identity, auditor.audit(snapshot, auditContext));
            log.debug("Peer re-audited specimen={} flags={}", identity, flags.size());
        });
    }

    // The audit above read the catalog holders before this write; a peer saved in between may have
    // written our duplicate flag and then lost it to our replaceFlags. Re-read the holders once.
    private List<QualityFlag> settleDuplicateFlag(AggregatedRecord record, List<QualityFlag> flags) {
        if (!auditor.runs(FlagKind.duplicate_catalog_number)) {
            return flags;
        }
        String identity = record.specimenIdentity();
        boolean shared = record.value(DwcTerm.catalogNumber)
                .filter(v -> !v.isBlank())
                .map(v -> index.queryByCatalogNumber(v).stream().anyMatch(other -> !other.equals(identity)))
                .orElse(false);
        boolean flagged = flags.stream().anyMatch(f -> f.kind() == FlagKind.duplicate_catalog_number);
        if (shared == flagged) {
            return flags;
        }
        List<QualityFlag> settled = index.replaceFlags(identity, auditor.audit(record, auditContext));
        log.info("Duplicate flag settled specimen={} shared={} flags={}", identity, shared, settled.size());
        return settled;
    }

    private SpecimenRecordView currentView(String identity) {
        AggregatedRecord stored = index.findAggregation(identity).orElse(null);
        log.debug("Newer snapshot already stored specimen={} attemptCount={}",
                identity, stored == null ? null : stored.attemptCount());
        return new SpecimenRecordView(
                Objects.requireNonNullElseGet(stored, () -> aggregator.aggregate(identity, index.findAttempts(identity))),
                index.findFlags(identity),
                index.findLatestReviewDecision(identity).orElse(null)
        );
    }
}
