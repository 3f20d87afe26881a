package app.herbaria.provenance.domain.entity;

import app.herbaria.provenance.domain.type.FlagKind;
import app.herbaria.provenance.domain.type.FlagSeverity;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "quality_flags", schema = "app_provenance")
public class QualityFlagEntity {

    @Id
    @Column(name = "flag_id", nullable = false)
    private UUID flagId;

    @Column(name = "specimen_identity", nullable = false, length = 64)
    private String specimenIdentity;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "kind", columnDefinition = "flag_kind", nullable = false)
    private FlagKind kind;

    @Column(name = "field", nullable = false)
    private String field;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "severity", columnDefinition = "flag_severity", nullable = false)
    private FlagSeverity severity;

    @Column(name = "detail", nullable = false)
    private String detail;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    protected QualityFlagEntity() {
    }

    public UUID getFlagId() {
        return flagId;
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public FlagKind getKind() {
        return kind;
    }

    public String getField() {
        return field;
    }

    public FlagSeverity getSeverity() {
        return severity;
    }

    public String getDetail() {
        return detail;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }
}
