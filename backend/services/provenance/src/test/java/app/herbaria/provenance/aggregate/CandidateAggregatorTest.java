package app.herbaria.provenance.aggregate;

import app.herbaria.provenance.config.AggregationProps;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.CandidateValue;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.FieldConflict;
import app.herbaria.provenance.domain.model.FieldSelection;
import app.herbaria.provenance.domain.model.FieldValue;
import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.domain.type.DwcTerm;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class CandidateAggregatorTest {

    private static final String SPECIMEN = "a3f1c0de";
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");

    private final CandidateAggregator aggregator = aggregator(AggregationProps.defaults());

    @Test
    void aggregate_agreeingAttemptsBoostConfidence() {
        List<ExtractionAttempt> attempts = List.of(
                completed("gpt", 0, Map.of(DwcTerm.scientificName, new FieldValue("Bouteloua gracilis", 0.9))),
                completed("tesseract", 1, Map.of(DwcTerm.scientificName, new FieldValue("Bouteloua gracilis", 0.7)))
        );

        AggregatedRecord record = aggregator.aggregate(SPECIMEN, attempts);

        FieldSelection name = record.fields().get(DwcTerm.scientificName);
        assertThat(name.value()).isEqualTo("Bouteloua gracilis");
        assertThat(name.confidence()).isGreaterThan(0.9).isCloseTo(0.97, within(1e-9));
        assertThat(name.supportingAttempts()).isEqualTo(2);
        assertThat(record.conflicts()).isEmpty();
    }

    @Test
    void aggregate_agreementIgnoresCaseAndWhitespaceButKeepsStoredValue() {
        List<ExtractionAttempt> attempts = List.of(
                completed("tesseract", 0, Map.of(DwcTerm.family, new FieldValue("  POACEAE ", 0.6))),
                completed("gpt", 1, Map.of(DwcTerm.family, new FieldValue("Poaceae", 0.8)))
        );

        AggregatedRecord record = aggregator.aggregate(SPECIMEN, attempts);

        assertThat(record.conflicts()).isEmpty();
        assertThat(record.value(DwcTerm.family)).contains("Poaceae");
    }

    @Test
    void aggregate_disagreementKeepsHighestConfidenceAndRecordsConflict() {
        ExtractionAttempt first = completed("tesseract", 0, Map.of(DwcTerm.catalogNumber, new FieldValue("019121", 0.8)));
        ExtractionAttempt second = completed("gpt", 1, Map.of(DwcTerm.catalogNumber, new FieldValue("O19121", 0.75)));

        AggregatedRecord record = aggregator.aggregate(SPECIMEN, List.of(first, second));

        FieldSelection catalog = record.fields().get(DwcTerm.catalogNumber);
        assertThat(catalog.value()).isEqualTo("019121");
        assertThat(catalog.confidence()).isEqualTo(0.8);
        assertThat(catalog.sourceAttemptId()).isEqualTo(first.attemptId());

        FieldConflict conflict = record.conflicts().get(DwcTerm.catalogNumber);
        assertThat(record.conflicts()).hasSize(1);
        assertThat(conflict.candidates()).extracting(CandidateValue::value).containsExactly("019121", "O19121");
        assertThat(conflict.distinctValues()).isEqualTo(2);
    }

    @Test
    void aggregate_confidenceTieBrokenByProviderPrecedence() {
        CandidateAggregator ranked = aggregator(new AggregationProps(null, List.of("apple-vision", "tesseract"), null));
        List<ExtractionAttempt> attempts = List.of(
                completed("tesseract", 0, Map.of(DwcTerm.recordedBy, new FieldValue("L. Benson", 0.6))),
                completed("apple-vision", 1, Map.of(DwcTerm.recordedBy, new FieldValue("L. Bensen", 0.6)))
        );

        AggregatedRecord record = ranked.aggregate(SPECIMEN, attempts);

        assertThat(record.value(DwcTerm.recordedBy)).contains("L. Bensen");
        assertThat(record.fields().get(DwcTerm.recordedBy).provider()).isEqualTo("apple-vision");
    }

    @Test
    void aggregate_confidenceAndPrecedenceTieBrokenByNewest() {
        List<ExtractionAttempt> attempts = List.of(
                completed("gpt", 0, Map.of(DwcTerm.locality, new FieldValue("Pima County", 0.5))),
                completed("gpt", 5, Map.of(DwcTerm.locality, new FieldValue("Pinal County", 0.5)))
        );

        AggregatedRecord record = aggregator.aggregate(SPECIMEN, attempts);

        assertThat(record.value(DwcTerm.locality)).contains("Pinal County");
    }

    @Test
    void aggregate_failedAttemptsContributeNoCandidates() {
        ExtractionAttempt failed = attempt("gpt", 0, AttemptStatus.failed,
                Map.of(DwcTerm.catalogNumber, new FieldValue("999999", 0.99)));
        ExtractionAttempt ok = completed("tesseract", 1, Map.of(DwcTerm.catalogNumber, new FieldValue("1073", 0.4)));

        AggregatedRecord record = aggregator.aggregate(SPECIMEN, List.of(failed, ok));

        assertThat(record.value(DwcTerm.catalogNumber)).contains("1073");
        assertThat(record.conflicts()).isEmpty();
        assertThat(record.sourceAttemptIds()).containsExactly(ok.attemptId());
        assertThat(record.attemptCount()).isEqualTo(2);
    }

    @Test
    void aggregate_pendingAttemptsAreNeitherCandidatesNorCounted() {
        ExtractionAttempt pending = attempt("gpt", 0, AttemptStatus.pending, Map.of());

        AggregatedRecord record = aggregator.aggregate(SPECIMEN, List.of(pending));

        assertThat(record.fields()).isEmpty();
        assertThat(record.attemptCount()).isZero();
        assertThat(record.confidence()).isZero();
    }

    @Test
    void aggregate_blankValuesAreAbsent() {
        AggregatedRecord record = aggregator.aggregate(SPECIMEN, List.of(
                completed("gpt", 0, Map.of(DwcTerm.habitat, new FieldValue("   ", 0.9)))
        ));

        assertThat(record.fields()).doesNotContainKey(DwcTerm.habitat);
    }

    @Test
    void aggregate_recordConfidenceIsMeanOfFieldConfidences() {
        AggregatedRecord record = aggregator.aggregate(SPECIMEN, List.of(
                completed("gpt", 0, Map.of(
                        DwcTerm.scientificName, new FieldValue("Bouteloua gracilis", 0.9),
                        DwcTerm.country, new FieldValue("USA", 0.5)
                ))
        ));

        assertThat(record.confidence()).isCloseTo(0.7, within(1e-9));
    }

    @Test
    void aggregate_restrictsOutputToTargetFields() {
        CandidateAggregator narrow = aggregator(new AggregationProps(List.of("catalogNumber"), null, null));

        AggregatedRecord record = narrow.aggregate(SPECIMEN, List.of(
                completed("gpt", 0, Map.of(
                        DwcTerm.catalogNumber, new FieldValue("1073", 0.9),
                        DwcTerm.country, new FieldValue("USA", 0.5)
                ))
        ));

        assertThat(record.fields().keySet()).containsExactly(DwcTerm.catalogNumber);
    }

    @Test
    void aggregate_isDeterministicRegardlessOfInputOrder() throws Exception {
        List<ExtractionAttempt> attempts = new ArrayList<>(List.of(
                completed("tesseract", 0, Map.of(DwcTerm.catalogNumber, new FieldValue("019121", 0.8),
                        DwcTerm.scientificName, new FieldValue("Bouteloua gracilis", 0.6))),
                completed("gpt", 1, Map.of(DwcTerm.catalogNumber, new FieldValue("O19121", 0.75),
                        DwcTerm.scientificName, new FieldValue("bouteloua gracilis", 0.9))),
                completed("apple-vision", 2, Map.of(DwcTerm.catalogNumber, new FieldValue("019121", 0.8))),
                attempt("gpt", 3, AttemptStatus.failed, Map.of())
        ));
        ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule());

        byte[] first = mapper.writeValueAsBytes(aggregator.aggregate(SPECIMEN, attempts));
        Collections.reverse(attempts);
        byte[] second = mapper.writeValueAsBytes(aggregator.aggregate(SPECIMEN, attempts));

        assertThat(second).isEqualTo(first);
    }

    @Test
    void aggregate_maxPolicyDoesNotBoost() {
        CandidateAggregator max = aggregator(new AggregationProps(null, null, "max"));

        AggregatedRecord record = max.aggregate(SPECIMEN, List.of(
                completed("gpt", 0, Map.of(DwcTerm.scientificName, new FieldValue("Bouteloua gracilis", 0.9))),
                completed("tesseract", 1, Map.of(DwcTerm.scientificName, new FieldValue("Bouteloua gracilis", 0.7)))
        ));

        assertThat(record.fields().get(DwcTerm.scientificName).confidence()).isEqualTo(0.9);
        assertThat(record.confidencePolicy()).isEqualTo("max");
    }

    private static CandidateAggregator aggregator(AggregationProps props) {
        return new CandidateAggregator(props, new ConfidencePolicyRegistry(List.of(
                new NoisyOrConfidencePolicy(),
                new MaxConfidencePolicy()
        )));
    }

    private static ExtractionAttempt completed(String provider, int minutes, Map<DwcTerm, FieldValue> fields) {
        return attempt(provider, minutes, AttemptStatus.complete, fields);
    }

    private static ExtractionAttempt attempt(String provider,
                                             int minutes,
                                             AttemptStatus status,
                                             Map<DwcTerm, FieldValue> fields) {
        Instant createdAt = T0.plusSeconds(minutes * 60L);
        return new ExtractionAttempt(
                UUID.nameUUIDFromBytes((provider + minutes).getBytes()),
                SPECIMEN,
                provider,
                provider + "-model",
                "params-" + provider,
                SPECIMEN,
                null,
                false,
                status,
                fields,
                null,
                null,
                createdAt,
                status.isTerminal() ? createdAt : null
        );
    }
}
