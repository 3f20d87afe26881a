package app.herbaria.provenance.audit;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.CandidateValue;
import app.herbaria.provenance.domain.model.FieldConflict;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.stream.Collectors;

@Component
public class FieldConflictRule implements QualityRule {

    @Override
    public FlagKind kind() {
        return FlagKind.field_conflict;
    }

    @Override
    public List<QualityFlag> evaluate(AggregatedRecord record, AuditContext context) {
        List<QualityFlag> flags = new ArrayList<>();
        for (Map.Entry<DwcTerm, FieldConflict> entry : record.conflicts().entrySet()) {
            FieldConflict conflict = entry.getValue();
            String values = conflict.candidates().stream()
                    .map(CandidateValue::value)
                    .distinct()
                    .map(v -> "'" + v + "'")
                    .collect(Collectors.joining(", "));
            String chosen = record.value(entry.getKey()).orElse("");
            String detail = String.format(Locale.ROOT,
                    "%d candidates disagree on %s: %s; provisional '%s'",
                    conflict.candidates().size(), entry.getKey().name(), values, chosen);
            flags.add(QualityFlag.of(record.specimenIdentity(), kind(), entry.getKey().name(),
                    FlagSeverity.medium, detail));
        }
        return flags;
    }
}
