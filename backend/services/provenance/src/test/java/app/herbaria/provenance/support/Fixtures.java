package app.herbaria.provenance.support;

import app.herbaria.provenance.aggregate.CandidateAggregator;
import app.herbaria.provenance.aggregate.ConfidencePolicyRegistry;
import app.herbaria.provenance.aggregate.MaxConfidencePolicy;
import app.herbaria.provenance.aggregate.NoisyOrConfidencePolicy;
import app.herbaria.provenance.audit.CatalogNumberMismatchRule;
import app.herbaria.provenance.audit.DuplicateCatalogNumberRule;
import app.herbaria.provenance.audit.FieldConflictRule;
import app.herbaria.provenance.audit.ImplausibleDateRule;
import app.herbaria.provenance.audit.MalformedCatalogNumberRule;
import app.herbaria.provenance.audit.MissingCoreFieldRule;
import app.herbaria.provenance.audit.QualityAuditor;
import app.herbaria.provenance.config.AggregationProps;
import app.herbaria.provenance.config.QualityProps;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.FieldValue;
import app.herbaria.provenance.domain.model.Specimen;
import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.domain.type.DwcTerm;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class Fixtures {

    public static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private Fixtures() {
    }

    public static CandidateAggregator aggregator() {
        return new CandidateAggregator(AggregationProps.defaults(), new ConfidencePolicyRegistry(List.of(
                new NoisyOrConfidencePolicy(),
                new MaxConfidencePolicy()
        )));
    }

    public static QualityAuditor auditor() {
        QualityProps props = QualityProps.defaults();
        return new QualityAuditor(List.of(
                new CatalogNumberMismatchRule(),
                new DuplicateCatalogNumberRule(),
                new FieldConflictRule(),
                new ImplausibleDateRule(props),
                new MalformedCatalogNumberRule(props),
                new MissingCoreFieldRule(props)
        ), props);
    }

    public static Specimen specimen(String identity) {
        return new Specimen(identity, T0);
    }

    public static ExtractionAttempt completed(String identity, String provider, int minutes,
                                              Map<DwcTerm, FieldValue> fields) {
        Instant createdAt = T0.plusSeconds(minutes * 60L);
        return new ExtractionAttempt(
                UUID.nameUUIDFromBytes((identity + provider + minutes).getBytes(StandardCharsets.UTF_8)),
                identity,
                provider,
                provider + "-model",
                "params-" + provider,
                null,
                null,
                false,
                AttemptStatus.complete,
                fields,
                null,
                null,
                createdAt,
                createdAt.plusSeconds(5)
        );
    }

    public static ExtractionAttempt failed(String identity, String provider, int minutes, String error) {
        Instant createdAt = T0.plusSeconds(minutes * 60L);
        return new ExtractionAttempt(
                UUID.nameUUIDFromBytes((identity + provider + minutes + "f").getBytes(StandardCharsets.UTF_8)),
                identity,
                provider,
                provider + "-model",
                "params-" + provider,
                null,
                null,
                false,
                AttemptStatus.failed,
                null,
                null,
                List.of(error),
                createdAt,
                createdAt.plusSeconds(5)
        );
    }
}
