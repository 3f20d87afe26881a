package app.herbaria.provenance.domain.type;

import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Darwin Core terms the engine knows how to aggregate. Provider output keyed by
 * any other name lands in the attempt's extras bucket.
 */
public enum DwcTerm {
    catalogNumber,
    otherCatalogNumbers,
    institutionCode,
    collectionCode,
    basisOfRecord,
    recordedBy,
    recordNumber,
    eventDate,
    verbatimEventDate,
    country,
    stateProvince,
    county,
    municipality,
    locality,
    verbatimLocality,
    decimalLatitude,
    decimalLongitude,
    habitat,
    scientificName,
    scientificNameAuthorship,
    taxonRank,
    family,
    genus,
    specificEpithet,
    infraspecificEpithet,
    identifiedBy,
    dateIdentified,
    occurrenceRemarks;

    private static final Map<String, DwcTerm> BY_NAME = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(DwcTerm::name, Function.identity()));

    public static Optional<DwcTerm> fromName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String local = name.trim();
        int slash = local.lastIndexOf('/');
        if (slash >= 0) {
            local = local.substring(slash + 1);
        }
        int colon = local.indexOf(':');
        if (colon >= 0) {
            local = local.substring(colon + 1);
        }
        return Optional.ofNullable(BY_NAME.get(local));
    }
}
