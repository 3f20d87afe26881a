package app.herbaria.provenance.domain.model;

import app.herbaria.provenance.domain.type.FlagKind;

public record SpecimenFilter(
        FlagKind flagKind,
        String reviewStatus,
        String catalogNumber
) {
    public static SpecimenFilter all() {
        return new SpecimenFilter(null, null, null);
    }

    public static SpecimenFilter reviewStatus(String status) {
        return new SpecimenFilter(null, status, null);
    }
}
