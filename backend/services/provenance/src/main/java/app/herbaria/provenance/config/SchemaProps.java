package app.herbaria.provenance.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

/**
 * Registry of provider terms accepted into the extras bucket without a warning.
 */
@ConfigurationProperties(prefix = "app.provenance.schema")
public record SchemaProps(
        List<String> extraTerms
) {
    public SchemaProps {
        extraTerms = extraTerms == null
                ? List.of("scientificName_verbatim", "verbatimLabel", "datasetName", "eventDateUncertaintyInDays")
                : List.copyOf(extraTerms);
    }

    public static SchemaProps defaults() {
        return new SchemaProps(null);
    }
}
