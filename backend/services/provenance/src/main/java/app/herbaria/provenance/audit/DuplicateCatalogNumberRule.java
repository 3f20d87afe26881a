package app.herbaria.provenance.audit;

import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;

@Component
public class DuplicateCatalogNumberRule implements QualityRule {

    private static final int MAX_LISTED = 10;

    @Override
    public FlagKind kind() {
        return FlagKind.duplicate_catalog_number;
    }

    @Override
    public List<QualityFlag> evaluate(AggregatedRecord record, AuditContext context) {
        Optional<String> value = record.value(DwcTerm.catalogNumber).filter(v -> !v.isBlank());
        if (value.isEmpty()) {
            return List.of();
        }
        List<String> others = context.specimensWithCatalogNumber(value.get()).stream()
                .filter(identity -> !identity.equals(record.specimenIdentity()))
                .sorted()
                .toList();
        if (others.isEmpty()) {
            return List.of();
        }
        String listed = String.join(", ", others.subList(0, Math.min(others.size(), MAX_LISTED)));
        if (others.size() > MAX_LISTED) {
            listed += ", ... (" + others.size() + " total)";
        }
        return List.of(QualityFlag.of(record.specimenIdentity(), kind(), DwcTerm.catalogNumber.name(),
                FlagSeverity.high,
                "Catalog number '" + value.get() + "' also on: " + listed));
    }
}
