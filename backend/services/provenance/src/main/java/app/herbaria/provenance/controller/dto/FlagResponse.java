package app.herbaria.provenance.controller.dto;

import app.herbaria.provenance.domain.model.QualityFlag;
import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;

import java.time.Instant;

public record FlagResponse(
        FlagKind kind,
        String field,
        FlagSeverity severity,
        String detail,
        Instant createdAt
) {
    public static FlagResponse from(QualityFlag flag) {
        return new FlagResponse(flag.kind(), flag.field(), flag.severity(), flag.detail(), flag.createdAt());
    }
}
