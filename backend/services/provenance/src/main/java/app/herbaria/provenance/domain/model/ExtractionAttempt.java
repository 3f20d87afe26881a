package app.herbaria.provenance.domain.model;

import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.domain.type.DwcTerm;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public record ExtractionAttempt(
        UUID attemptId,
        String specimenIdentity,
        String provider,
        String model,
        String paramsHash,
        String imageHash,
        String runId,
        boolean forced,
        AttemptStatus status,
        Map<DwcTerm, FieldValue> fields,
        Map<String, FieldValue> extras,
        List<String> errors,
        Instant createdAt,
        Instant completedAt
) {
    public ExtractionAttempt {
        EnumMap<DwcTerm, FieldValue> copy = new EnumMap<>(DwcTerm.class);
        if (fields != null) {
            copy.putAll(fields);
        }
        fields = Collections.unmodifiableMap(copy);
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public AttemptRef toRef() {
        return new AttemptRef(attemptId, status, createdAt);
    }
}
