package app.herbaria.provenance.domain.model;

import java.util.List;

public record FieldConflict(
        List<CandidateValue> candidates
) {
    public FieldConflict {
        candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public int distinctValues() {
        return (int) candidates.stream().map(CandidateValue::value).distinct().count();
    }
}
