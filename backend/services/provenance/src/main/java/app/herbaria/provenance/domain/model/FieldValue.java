package app.herbaria.provenance.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

public record FieldValue(
        String value,
        double confidence
) {
    public FieldValue {
        if (Double.isNaN(confidence) || confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("confidence must be within [0,1], got " + confidence);
        }
    }

    @JsonIgnore
    public boolean isPresent() {
        return value != null && !value.isBlank();
    }
}
