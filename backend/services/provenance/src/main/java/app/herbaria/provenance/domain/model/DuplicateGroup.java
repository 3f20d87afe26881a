package app.herbaria.provenance.domain.model;

import java.util.List;

public record DuplicateGroup(
        String catalogNumber,
        List<String> specimenIdentities
) {
    public DuplicateGroup {
        specimenIdentities = specimenIdentities == null ? List.of() : List.copyOf(specimenIdentities);
    }
}
