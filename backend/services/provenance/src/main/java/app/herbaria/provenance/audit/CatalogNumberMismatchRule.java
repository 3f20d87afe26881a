package app.herbaria.provenance.audit;

import app.herbaria.provenance.aggregate.ValueNormalizer;
import app.herbaria.provenance.domain.model.AggregatedRecord;
import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.model.SourceFile;
import app.herbaria.provenance.domain.type.DwcTerm;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Objects;

/**
 * Compares the extracted catalog number with the one expected by the capture workflow
 * (for example a barcode scanned at photography time).
 */
@Component
public class CatalogNumberMismatchRule implements QualityRule {

    @Override
    public FlagKind kind() {
        return FlagKind.catalog_number_mismatch;
    }

    @Override
    public List<QualityFlag> evaluate(AggregatedRecord record, AuditContext context) {
        List<String> expected = context.sourceFiles(record.specimenIdentity()).stream()
                .map(SourceFile::expectedCatalogNumber)
                .filter(Objects::nonNull)
                .filter(v -> !v.isBlank())
                .distinct()
                .toList();
        if (expected.isEmpty()) {
            return List.of();
        }
        String actual = record.value(DwcTerm.catalogNumber).orElse(null);
        if (actual != null && expected.stream().anyMatch(e -> ValueNormalizer.sameValue(e, actual))) {
            return List.of();
        }
        String detail = actual == null
                ? "Expected catalog number " + String.join(" or ", expected) + " but none was extracted"
                : "Expected catalog number " + String.join(" or ", expected) + " but extracted '" + actual + "'";
        return List.of(QualityFlag.of(record.specimenIdentity(), kind(), DwcTerm.catalogNumber.name(),
                FlagSeverity.medium, detail));
    }
}
