package app.herbaria.provenance.service;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.model.ReviewDecisionRef;

import java.util.List;

public record SpecimenRecordView(
        AggregatedRecord record,
        List<QualityFlag> flags,
        ReviewDecisionRef review
) {
    public SpecimenRecordView {
        flags = flags == null ? List.of() : List.copyOf(flags);
    }
}
