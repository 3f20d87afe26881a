package app.herbaria.provenance.dedup;

import app.herbaria.provenance.domain.model.FieldValue;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Raw provider output, keyed by whatever term names the provider used.
 */
public record EngineResponse(
        Map<String, FieldValue> fields,
        List<String> errors
) {
    public EngineResponse {
        fields = fields == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(fields));
        errors = errors == null ? List.of() : List.copyOf(errors);
    }
}
