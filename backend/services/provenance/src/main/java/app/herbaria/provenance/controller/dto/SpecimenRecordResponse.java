package app.herbaria.provenance.controller.dto;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.ReviewDecisionRef;
import app.herbaria.provenance.service.SpecimenRecordView;

import java.util.List;

public record SpecimenRecordResponse(
        String identity,
        AggregatedRecord record,
        List<FlagResponse> flags,
        ReviewDecisionRef review
) {
    public static SpecimenRecordResponse from(SpecimenRecordView view) {
        return new SpecimenRecordResponse(
                view.record().specimenIdentity(),
                view.record(),
                view.flags().stream().map(FlagResponse::from).toList(),
                view.review()
        );
    }
}
