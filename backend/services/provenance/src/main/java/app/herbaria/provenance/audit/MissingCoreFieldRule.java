package app.herbaria.provenance.audit;

import app.herbaria.provenance.config.QualityProps;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import app.herbaria.provenance.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class MissingCoreFieldRule implements QualityRule {

    private final List<DwcTerm> coreFields;

    public MissingCoreFieldRule(QualityProps props) {
        List<DwcTerm> terms = new ArrayList<>();
        for (String name : props.coreFields()) {
            terms.add(DwcTerm.fromName(name)
                    .orElseThrow(() -> new ConfigurationException("Unknown core field: " + name)));
        }
        this.coreFields = List.copyOf(terms);
    }

    @Override
    public FlagKind kind() {
        return FlagKind.missing_core_field;
    }

    @Override
    public List<QualityFlag> evaluate(AggregatedRecord record, AuditContext context) {
        List<QualityFlag> flags = new ArrayList<>();
        for (DwcTerm term : coreFields) {
            if (record.value(term).filter(v -> !v.isBlank()).isEmpty()) {
                flags.add(QualityFlag.of(record.specimenIdentity(), kind(), term.name(), FlagSeverity.high,
                        "Core field " + term.name() + " has no candidate value"));
            }
        }
        return flags;
    }
}
