package app.herbaria.provenance.config;

import app.herbaria.provenance.domain.type.DwcTerm;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

@ConfigurationProperties(prefix = "app.provenance.aggregation")
public record AggregationProps(
        List<String> targetFields,
        List<String> providerPrecedence,
        String confidencePolicy
) {
    public static final String DEFAULT_POLICY = "noisy-or";

    public AggregationProps {
        targetFields = targetFields == null ? List.of() : List.copyOf(targetFields);
        providerPrecedence = providerPrecedence == null ? List.of() : List.copyOf(providerPrecedence);
        confidencePolicy = (confidencePolicy == null || confidencePolicy.isBlank())
                ? DEFAULT_POLICY
                : confidencePolicy.trim().toLowerCase(Locale.ROOT);
    }

    public static AggregationProps defaults() {
        return new AggregationProps(null, null, null);
    }

    /**
     * Terms the aggregator emits. An empty list means the whole schema.
     */
    public Set<DwcTerm> resolvedTargetFields() {
        if (targetFields.isEmpty()) {
            return EnumSet.allOf(DwcTerm.class);
        }
        EnumSet<DwcTerm> terms = EnumSet.noneOf(DwcTerm.class);
        for (String name : targetFields) {
            terms.add(DwcTerm.fromName(name)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown target field: " + name)));
        }
        return terms;
    }
}
