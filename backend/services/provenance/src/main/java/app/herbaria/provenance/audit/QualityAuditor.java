package app.herbaria.provenance.audit;

import app.herbaria.provenance.config.QualityProps;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.FlagKind;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Runs the enabled rule set over an aggregated record. Flags are advisory: the auditor
 * never rewrites or drops data.
 */
@Component
public class QualityAuditor {

    private static final Comparator<QualityFlag> FLAG_ORDER = Comparator
            .comparing((QualityFlag f) -> f.kind().name())
            .thenComparing(QualityFlag::field, Comparator.nullsFirst(Comparator.naturalOrder()));

    private final List<QualityRule> rules;

    public QualityAuditor(List<QualityRule> rules, QualityProps props) {
        this.rules = rules.stream()
                .filter(rule -> props.isEnabled(rule.kind()))
                .sorted(Comparator.comparing(rule -> rule.kind().ordinal()))
                .toList();
    }

    public boolean runs(FlagKind kind) {
        return rules.stream().anyMatch(rule -> rule.kind() == kind);
    }

    public List<QualityFlag> audit(AggregatedRecord record, AuditContext context) {
        List<QualityFlag> flags = new ArrayList<>();
        for (QualityRule rule : rules) {
            flags.addAll(rule.evaluate(record, context));
        }
        flags.sort(FLAG_ORDER);
        return List.copyOf(flags);
    }
}
