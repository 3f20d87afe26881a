package app.herbaria.provenance.domain.model;

import app.herbaria.provenance.domain.type.AttemptStatus;
import app.herbaria.provenance.domain.type.DwcTerm;

import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Terminal outcome of one extraction run, as handed to the index.
 */
public record AttemptResult(
        AttemptStatus status,
        Map<DwcTerm, FieldValue> fields,
        Map<String, FieldValue> extras,
        List<String> errors
) {
    public AttemptResult {
        if (status == null || !status.isTerminal()) {
            throw new IllegalArgumentException("attempt result must be terminal, got " + status);
        }
        EnumMap<DwcTerm, FieldValue> copy = new EnumMap<>(DwcTerm.class);
        if (fields != null) {
            copy.putAll(fields);
        }
        fields = Collections.unmodifiableMap(copy);
        extras = extras == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(extras));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }

    public static AttemptResult completed(Map<DwcTerm, FieldValue> fields) {
        return new AttemptResult(AttemptStatus.complete, fields, null, null);
    }

    public static AttemptResult completed(Map<DwcTerm, FieldValue> fields,
                                          Map<String, FieldValue> extras,
                                          List<String> errors) {
        return new AttemptResult(AttemptStatus.complete, fields, extras, errors);
    }

    public static AttemptResult failed(List<String> errors) {
        return new AttemptResult(AttemptStatus.failed, null, null, errors);
    }

    public static AttemptResult failed(List<String> errors, Map<DwcTerm, FieldValue> partialFields) {
        return new AttemptResult(AttemptStatus.failed, partialFields, null, errors);
    }
}
