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
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Fuses a specimen's attempts into one best-candidate record.
 *
 * <p>Always a full recomputation over the attempt set: the same attempts give the same record,
 * whatever order they are passed in. Only completed attempts contribute candidates; failed
 * attempts are counted but their partial payloads are ignored.
 */
@Component
public class CandidateAggregator {

    private final Set<DwcTerm> targetFields;
    private final Map<String, Integer> precedence;
    private final ConfidencePolicy policy;

    public CandidateAggregator(AggregationProps props, ConfidencePolicyRegistry policies) {
        this.targetFields = props.resolvedTargetFields();
        Map<String, Integer> ranks = new LinkedHashMap<>();
        List<String> order = props.providerPrecedence();
        for (int i = 0; i < order.size(); i++) {
            ranks.putIfAbsent(order.get(i), i);
        }
        this.precedence = Map.copyOf(ranks);
        this.policy = policies.require(props.confidencePolicy());
    }

    public String policyId() {
        return policy.id();
    }

    public AggregatedRecord aggregate(String specimenIdentity, List<ExtractionAttempt> attempts) {
        List<ExtractionAttempt> ordered = attempts.stream()
                .filter(a -> specimenIdentity.equals(a.specimenIdentity()))
                .sorted(Comparator.comparing(ExtractionAttempt::createdAt, Comparator.nullsFirst(Comparator.naturalOrder()))
                        .thenComparing(ExtractionAttempt::attemptId))
                .toList();

        int terminal = 0;
        List<ExtractionAttempt> completed = new ArrayList<>();
        for (ExtractionAttempt attempt : ordered) {
            if (attempt.status() != null && attempt.status().isTerminal()) {
                terminal++;
            }
            if (attempt.status() == AttemptStatus.complete) {
                completed.add(attempt);
            }
        }

        Map<DwcTerm, FieldSelection> fields = new EnumMap<>(DwcTerm.class);
        Map<DwcTerm, FieldConflict> conflicts = new EnumMap<>(DwcTerm.class);

        for (DwcTerm term : DwcTerm.values()) {
            if (!targetFields.contains(term)) {
                continue;
            }
            List<CandidateValue> candidates = collect(term, completed);
            if (candidates.isEmpty()) {
                continue;
            }
            candidates.sort(candidateOrder());
            CandidateValue best = candidates.get(0);
            String bestKey = ValueNormalizer.normalize(best.value());

            List<Double> agreeing = new ArrayList<>();
            boolean disagree = false;
            for (CandidateValue candidate : candidates) {
                if (bestKey.equals(ValueNormalizer.normalize(candidate.value()))) {
                    agreeing.add(candidate.confidence());
                } else {
                    disagree = true;
                }
            }

            if (disagree) {
                fields.put(term, new FieldSelection(best.value(), best.confidence(), best.attemptId(),
                        best.provider(), agreeing.size()));
                conflicts.put(term, new FieldConflict(candidates));
            } else {
                double combined = agreeing.size() == 1 ? best.confidence() : policy.combine(agreeing);
                fields.put(term, new FieldSelection(best.value(), combined, best.attemptId(),
                        best.provider(), agreeing.size()));
            }
        }

        double confidence = fields.values().stream()
                .mapToDouble(FieldSelection::confidence)
                .average()
                .orElse(0.0);
        List<UUID> sources = completed.stream().map(ExtractionAttempt::attemptId).toList();

        return new AggregatedRecord(specimenIdentity, fields, confidence, conflicts, sources, terminal, policy.id());
    }

    private List<CandidateValue> collect(DwcTerm term, List<ExtractionAttempt> completed) {
        List<CandidateValue> out = new ArrayList<>();
        for (ExtractionAttempt attempt : completed) {
            FieldValue value = attempt.fields().get(term);
            if (value == null || !value.isPresent()) {
                continue;
            }
            out.add(new CandidateValue(value.value(), value.confidence(), attempt.attemptId(),
                    attempt.provider(), attempt.createdAt()));
        }
        return out;
    }

    // confidence desc, configured provider precedence, newest first, then attempt id
    private Comparator<CandidateValue> candidateOrder() {
        return Comparator.comparingDouble(CandidateValue::confidence).reversed()
                .thenComparingInt(this::rank)
                .thenComparing(CandidateValue::observedAt, Comparator.nullsLast(Comparator.reverseOrder()))
                .thenComparing(CandidateValue::attemptId);
    }

    private int rank(CandidateValue candidate) {
        return precedence.getOrDefault(candidate.provider(), precedence.size());
    }
}
