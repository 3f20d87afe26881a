package app.herbaria.provenance.domain.model;

import java.util.UUID;

public record FieldSelection(
        String value,
        double confidence,
        UUID sourceAttemptId,
        String provider,
        int supportingAttempts
) {
}
