package app.herbaria.provenance.domain.model;

import app.herbaria.provenance.domain.type.DwcTerm;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Best-candidate field set for one specimen, derived from its full attempt set.
 *
 * <p>{@code attemptCount} is the number of terminal attempts the record was computed from;
 * stored snapshots only move forward in it.
 */
public record AggregatedRecord(
        String specimenIdentity,
        Map<DwcTerm, FieldSelection> fields,
        double confidence,
        Map<DwcTerm, FieldConflict> conflicts,
        List<UUID> sourceAttemptIds,
        int attemptCount,
        String confidencePolicy
) {
    public AggregatedRecord {
        EnumMap<DwcTerm, FieldSelection> fieldCopy = new EnumMap<>(DwcTerm.class);
        if (fields != null) {
            fieldCopy.putAll(fields);
        }
        fields = Collections.unmodifiableMap(fieldCopy);
        EnumMap<DwcTerm, FieldConflict> conflictCopy = new EnumMap<>(DwcTerm.class);
        if (conflicts != null) {
            conflictCopy.putAll(conflicts);
        }
        conflicts = Collections.unmodifiableMap(conflictCopy);
        sourceAttemptIds = sourceAttemptIds == null ? List.of() : List.copyOf(sourceAttemptIds);
    }

    public static AggregatedRecord empty(String specimenIdentity, int attemptCount, String confidencePolicy) {
        return new AggregatedRecord(specimenIdentity, null, 0.0, null, null, attemptCount, confidencePolicy);
    }

    public Optional<String> value(DwcTerm term) {
        FieldSelection selection = fields.get(term);
        return selection == null ? Optional.empty() : Optional.ofNullable(selection.value());
    }
}
