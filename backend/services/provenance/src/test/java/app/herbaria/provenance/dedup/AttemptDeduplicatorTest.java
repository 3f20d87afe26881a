package app.herbaria.provenance.dedup;

import app.herbaria.provenance.addressing.ContentAddressor;
import app.herbaria.provenance.config.SchemaProps;
import app.herbaria.provenance.domain.model.AttemptDraft;
import app.herbaria.provenance.domain.model.AttemptRef;
import app.herbaria.provenance.domain.model.AttemptResult;
import app.herbaria.provenance.domain.model.ExtractionAttempt;
import app.herbaria.provenance.domain.model.ExtractionDecision;
import app.herbaria.provenance.domain.model.ExtractionParams;
import app.herbaria.provenance.domain.model.FieldValue;
import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.exception.AttemptConflictException;
import app.herbaria.provenance.exception.ConfigurationException;
import app.herbaria.provenance.exception.TransientEngineException;
import app.herbaria.provenance.index.SpecimenIndex;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class AttemptDeduplicatorTest {

    private static final String SPECIMEN = "a3f1c2d4e5b60718293a4b5c6d7e8f90a1b2c3d4e5f60718293a4b5c6d7e8f90";
    private static final Instant T0 = Instant.parse("2024-03-01T10:00:00Z");
    private static final ExtractionParams PARAMS = ExtractionParams.of("gpt", "gpt-4o-2024-08-06", "v3");

    private final Map<UUID, AttemptDraft> drafts = new HashMap<>();

    private SpecimenIndex index;
    private ContentAddressor addressor;
    private AttemptDeduplicator deduplicator;
    private String paramsHash;

    @BeforeEach
    void setUp() {
        index = mock(SpecimenIndex.class);
        addressor = new ContentAddressor(new ObjectMapper());
        deduplicator = new AttemptDeduplicator(index, addressor, new FieldSchema(SchemaProps.defaults()));
        paramsHash = addressor.address(PARAMS).paramsHash();
        when(index.openAttempt(any())).thenAnswer(inv -> pending(inv.getArgument(0)));
        when(index.completeAttempt(any(), any())).thenAnswer(inv ->
                terminal(inv.getArgument(0), inv.getArgument(1)));
    }

    @Test
    void extract_runsEngineAndCompletesAttemptWhenNothingExtractedYet() {
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        StubEngine engine = StubEngine.returning(new EngineResponse(Map.of(
                "catalogNumber", new FieldValue("ASU-1073", 0.9),
                "scientificName", new FieldValue("Bouteloua gracilis", 0.8)
        ), List.of()));

        ExtractionOutcome outcome = deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine);

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.extracted);
        assertThat(outcome.attempt().fields()).containsKeys(DwcTerm.catalogNumber, DwcTerm.scientificName);
        assertThat(engine.calls.get()).isEqualTo(1);

        ArgumentCaptor<AttemptDraft> draft = ArgumentCaptor.forClass(AttemptDraft.class);
        verify(index).openAttempt(draft.capture());
        assertThat(draft.getValue().paramsHash()).isEqualTo(paramsHash);
        assertThat(draft.getValue().provider()).isEqualTo("gpt");
        assertThat(draft.getValue().imageHash()).isEqualTo(SPECIMEN);
        assertThat(draft.getValue().forced()).isFalse();
    }

    @Test
    void extract_skipsWithoutCallingEngineWhenCompletedAttemptExists() {
        UUID existing = UUID.randomUUID();
        when(index.shouldExtract(SPECIMEN, paramsHash, false))
                .thenReturn(ExtractionDecision.skip(new AttemptRef(existing, AttemptStatus.complete, T0)));
        StubEngine engine = StubEngine.returning(new EngineResponse(Map.of(), List.of()));

        ExtractionOutcome outcome = deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine);

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.skipped);
        assertThat(outcome.existingAttemptId()).isEqualTo(existing);
        assertThat(outcome.wroteAttempt()).isFalse();
        assertThat(engine.calls.get()).isZero();
        verify(index, never()).openAttempt(any());
    }

    @Test
    void extract_forcedRequestMarksDraftAsForced() {
        UUID existing = UUID.randomUUID();
        when(index.shouldExtract(SPECIMEN, paramsHash, true))
                .thenReturn(ExtractionDecision.proceed(new AttemptRef(existing, AttemptStatus.complete, T0)));
        StubEngine engine = StubEngine.returning(new EngineResponse(Map.of(
                "catalogNumber", new FieldValue("ASU-1073", 0.9)
        ), List.of()));

        ExtractionOutcome outcome = deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS).forced(), engine);

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.extracted);
        assertThat(outcome.attempt().forced()).isTrue();
    }

    @Test
    void extract_recordsTransientEngineErrorAsFailedAttempt() {
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        StubEngine engine = StubEngine.throwing(new TransientEngineException("gpt", "rate limited"));

        ExtractionOutcome outcome = deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine);

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.failed);
        assertThat(outcome.attempt().status()).isEqualTo(AttemptStatus.failed);
        assertThat(outcome.attempt().errors()).hasSize(1);
        assertThat(outcome.attempt().errors().get(0)).contains("rate limited");
    }

    @Test
    void extract_recordsUnexpectedEngineErrorAsMalformedResponse() {
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        StubEngine engine = StubEngine.throwing(new IllegalStateException("unexpected token"));

        ExtractionOutcome outcome = deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine);

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.failed);
        assertThat(outcome.attempt().errors()).containsExactly("malformed provider response: unexpected token");
    }

    @Test
    void extract_closesAttemptThenRethrowsConfigurationError() {
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        StubEngine engine = StubEngine.throwing(new ConfigurationException("missing API key"));

        assertThatThrownBy(() -> deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine))
                .isInstanceOf(ConfigurationException.class)
                .hasMessage("missing API key");

        ArgumentCaptor<AttemptResult> result = ArgumentCaptor.forClass(AttemptResult.class);
        verify(index).completeAttempt(any(), result.capture());
        assertThat(result.getValue().status()).isEqualTo(AttemptStatus.failed);
        assertThat(result.getValue().errors()).containsExactly("missing API key");
    }

    @Test
    void extract_emptyResponseIsFailedAttempt() {
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        StubEngine engine = StubEngine.returning(new EngineResponse(Map.of(
                "catalogNumber", new FieldValue("  ", 0.2)
        ), List.of()));

        ExtractionOutcome outcome = deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine);

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.failed);
        assertThat(outcome.attempt().errors()).containsExactly("no field values returned");
    }

    @Test
    void extract_keepsLosingResultAsDiscardedAttempt() {
        UUID canonical = UUID.randomUUID();
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        doThrow(new AttemptConflictException(SPECIMEN, paramsHash, canonical, null))
                .doAnswer(inv -> terminal(inv.getArgument(0), inv.getArgument(1)))
                .when(index).completeAttempt(any(), any());
        StubEngine engine = StubEngine.returning(new EngineResponse(Map.of(
                "catalogNumber", new FieldValue("ASU-1073", 0.9)
        ), List.of()));

        ExtractionOutcome outcome = deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine);

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.duplicate);
        assertThat(outcome.existingAttemptId()).isEqualTo(canonical);
        assertThat(outcome.attempt().status()).isEqualTo(AttemptStatus.failed);
        assertThat(outcome.attempt().fields()).containsKey(DwcTerm.catalogNumber);
        assertThat(outcome.attempt().errors())
                .containsExactly("discarded: duplicate of canonical attempt " + canonical);
        verify(index, times(2)).completeAttempt(any(), any());
    }

    @Test
    void extract_rejectsEngineForAnotherProvider() {
        StubEngine engine = new StubEngine("tesseract", new EngineResponse(Map.of(), List.of()), null);

        assertThatThrownBy(() -> deduplicator.extract(ExtractionRequest.of(SPECIMEN, PARAMS), engine))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("tesseract");
        verify(index, never()).shouldExtract(anyString(), anyString(), anyBoolean());
    }

    @Test
    void record_storesImportedResultWithoutEngine() {
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        when(index.recordAttempt(any(), any())).thenAnswer(inv -> {
            AttemptDraft draft = inv.getArgument(0);
            return terminal(UUID.randomUUID(), inv.getArgument(1), draft);
        });

        ExtractionOutcome outcome = deduplicator.record(ExtractionRequest.of(SPECIMEN, PARAMS),
                new EngineResponse(Map.of("recordedBy", new FieldValue("L. Benson", 0.7)), List.of()));

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.extracted);
        verify(index, never()).openAttempt(any());
    }

    @Test
    void record_conflictStoresDiscardedCopy() {
        UUID canonical = UUID.randomUUID();
        when(index.shouldExtract(SPECIMEN, paramsHash, false)).thenReturn(ExtractionDecision.proceed());
        when(index.recordAttempt(any(), any()))
                .thenThrow(new AttemptConflictException(SPECIMEN, paramsHash, canonical, null))
                .thenAnswer(inv -> {
                    AttemptDraft draft = inv.getArgument(0);
                    return terminal(UUID.randomUUID(), inv.getArgument(1), draft);
                });

        ExtractionOutcome outcome = deduplicator.record(ExtractionRequest.of(SPECIMEN, PARAMS),
                new EngineResponse(Map.of("recordedBy", new FieldValue("L. Benson", 0.7)), List.of()));

        assertThat(outcome.kind()).isEqualTo(ExtractionOutcome.Kind.duplicate);
        assertThat(outcome.existingAttemptId()).isEqualTo(canonical);
        assertThat(outcome.attempt().status()).isEqualTo(AttemptStatus.failed);
    }

    @Test
    void check_consultsIndexWithDerivedKey() {
        when(index.shouldExtract(eq(SPECIMEN), eq(paramsHash), eq(false))).thenReturn(ExtractionDecision.proceed());

        assertThat(deduplicator.check(ExtractionRequest.of(SPECIMEN, PARAMS)).extract()).isTrue();
    }

    private ExtractionAttempt pending(AttemptDraft draft) {
        UUID id = UUID.randomUUID();
        drafts.put(id, draft);
        return new ExtractionAttempt(id, draft.specimenIdentity(), draft.provider(), draft.model(),
                draft.paramsHash(), draft.imageHash(), draft.runId(), draft.forced(), AttemptStatus.pending,
                null, null, null, T0, null);
    }

    private ExtractionAttempt terminal(UUID attemptId, AttemptResult result) {
        return terminal(attemptId, result, drafts.get(attemptId));
    }

    private static ExtractionAttempt terminal(UUID attemptId, AttemptResult result, AttemptDraft draft) {
        return new ExtractionAttempt(attemptId, draft.specimenIdentity(), draft.provider(), draft.model(),
                draft.paramsHash(), draft.imageHash(), draft.runId(), draft.forced(), result.status(),
                result.fields(), result.extras(), result.errors(), T0, T0.plusSeconds(5));
    }

    private static final class StubEngine implements ExtractionEngine {
        private final String provider;
        private final EngineResponse response;
        private final RuntimeException failure;
        private final AtomicInteger calls = new AtomicInteger();

        private StubEngine(String provider, EngineResponse response, RuntimeException failure) {
            this.provider = provider;
            this.response = response;
            this.failure = failure;
        }

        static StubEngine returning(EngineResponse response) {
            return new StubEngine("gpt", response, null);
        }

        static StubEngine throwing(RuntimeException failure) {
            return new StubEngine("gpt", null, failure);
        }

        @Override
        public String provider() {
            return provider;
        }

        @Override
        public EngineResponse extract(ImageRef image, ExtractionParams params) {
            calls.incrementAndGet();
            if (failure != null) {
                throw failure;
            }
            return response;
        }
    }
}
