package app.herbaria.provenance.config;

import app.herbaria.provenance.domain.type.FlagKind;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Set;

@Validated
@ConfigurationProperties(prefix = "app.provenance.quality")
public record QualityProps(
        List<String> coreFields,
        String catalogNumberPattern,
        List<String> dateFields,
        @Min(0) @Max(9999) Integer minYear,
        @Min(0) @Max(9999) Integer maxYear,
        Set<FlagKind> disabledRules
) {
    public static final String DEFAULT_CATALOG_PATTERN = "^[A-Za-z]{0,10}[- ]?\\d{1,10}$";

    public QualityProps {
        coreFields = coreFields == null ? List.of("scientificName", "catalogNumber") : List.copyOf(coreFields);
        catalogNumberPattern = (catalogNumberPattern == null || catalogNumberPattern.isBlank())
                ? DEFAULT_CATALOG_PATTERN
                : catalogNumberPattern;
        dateFields = dateFields == null ? List.of("eventDate", "dateIdentified") : List.copyOf(dateFields);
        minYear = minYear == null ? 1700 : minYear;
        disabledRules = disabledRules == null ? Set.of() : Set.copyOf(disabledRules);
    }

    public static QualityProps defaults() {
        return new QualityProps(null, null, null, null, null, null);
    }

    public int resolvedMaxYear() {
        return maxYear != null ? maxYear : LocalDate.now(ZoneOffset.UTC).getYear();
    }

    public boolean isEnabled(FlagKind kind) {
        return !disabledRules.contains(kind);
    }
}
