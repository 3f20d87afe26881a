package app.herbaria.provenance.domain.type;

public enum FlagKind {
    field_conflict,
    duplicate_catalog_number,
    missing_core_field,
    implausible_date,
    malformed_catalog_number,
    catalog_number_mismatch
}
