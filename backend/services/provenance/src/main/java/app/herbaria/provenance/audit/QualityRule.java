package app.herbaria.provenance.audit;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.FlagKind;

import java.util.List;

public interface QualityRule {

    FlagKind kind();

    List<QualityFlag> evaluate(AggregatedRecord record, AuditContext context);
}
