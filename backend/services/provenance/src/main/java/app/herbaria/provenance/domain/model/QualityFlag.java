package app.herbaria.provenance.domain.model;

import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;

import java.time.Instant;

/**
 * Advisory annotation for human triage. {@code createdAt} is null until the index stores it.
 */
public record QualityFlag(
        String specimenIdentity,
        FlagKind kind,
        String field,
        FlagSeverity severity,
        String detail,
        Instant createdAt
) {
    public static QualityFlag of(String specimenIdentity,
                                 FlagKind kind,
                                 String field,
                                 FlagSeverity severity,
                                 String detail) {
        return new QualityFlag(specimenIdentity, kind, field, severity, detail, null);
    }
}
