package app.herbaria.provenance.audit;

import app.herbaria.provenance.config.QualityProps;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import app.herbaria.provenance.exception.ConfigurationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

@Component
public class MalformedCatalogNumberRule implements QualityRule {

    private final Pattern pattern;

    public MalformedCatalogNumberRule(QualityProps props) {
        try {
            this.pattern = Pattern.compile(props.catalogNumberPattern());
        } catch (PatternSyntaxException e) {
            throw new ConfigurationException("Invalid catalog number pattern: " + props.catalogNumberPattern(), e);
        }
    }

    @Override
    public FlagKind kind() {
        return FlagKind.malformed_catalog_number;
    }

    @Override
    public List<QualityFlag> evaluate(AggregatedRecord record, AuditContext context) {
        Optional<String> value = record.value(DwcTerm.catalogNumber).map(String::trim).filter(v -> !v.isEmpty());
        if (value.isEmpty() || pattern.matcher(value.get()).matches()) {
            return List.of();
        }
        return List.of(QualityFlag.of(record.specimenIdentity(), kind(), DwcTerm.catalogNumber.name(),
                FlagSeverity.medium,
                "Catalog number '" + value.get() + "' does not match " + pattern.pattern()));
    }
}
