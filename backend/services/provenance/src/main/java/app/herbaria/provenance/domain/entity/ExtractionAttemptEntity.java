package app.herbaria.provenance.domain.entity;

import app.herbaria.provenance.domain.type.AttemptStatus;
import com.fasterxml.jackson.databind.JsonNode;
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
@Table(name = "extraction_attempts", schema = "app_provenance")
public class ExtractionAttemptEntity {

    @Id
    @Column(name = "attempt_id", nullable = false)
    private UUID attemptId;

    @Column(name = "specimen_identity", nullable = false, length = 64, updatable = false)
    private String specimenIdentity;

    @Column(name = "provider", nullable = false, updatable = false)
    private String provider;

    @Column(name = "model", updatable = false)
    private String model;

    @Column(name = "params_hash", nullable = false, length = 64, updatable = false)
    private String paramsHash;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "params_json", columnDefinition = "jsonb", nullable = false, updatable = false)
    private JsonNode paramsJson;

    @Column(name = "image_hash", length = 64, updatable = false)
    private String imageHash;

    @Column(name = "run_id", updatable = false)
    private String runId;

    @Column(name = "forced", nullable = false, updatable = false)
    private boolean forced;

    @Enumerated(EnumType.STRING)
    @JdbcTypeCode(SqlTypes.NAMED_ENUM)
    @Column(name = "status", columnDefinition = "attempt_status", nullable = false)
    private AttemptStatus status;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "fields_json", columnDefinition = "jsonb")
    private JsonNode fieldsJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "extras_json", columnDefinition = "jsonb")
    private JsonNode extrasJson;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "errors_json", columnDefinition = "jsonb")
    private JsonNode errorsJson;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "completed_at")
    private Instant completedAt;

    protected ExtractionAttemptEntity() {
    }

    public UUID getAttemptId() {
        return attemptId;
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public String getProvider() {
        return provider;
    }

    public String getModel() {
        return model;
    }

    public String getParamsHash() {
        return paramsHash;
    }

    public JsonNode getParamsJson() {
        return paramsJson;
    }

    public String getImageHash() {
        return imageHash;
    }

    public String getRunId() {
        return runId;
    }

    public boolean isForced() {
        return forced;
    }

    public AttemptStatus getStatus() {
        return status;
    }

    public JsonNode getFieldsJson() {
        return fieldsJson;
    }

    public JsonNode getExtrasJson() {
        return extrasJson;
    }

    public JsonNode getErrorsJson() {
        return errorsJson;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getCompletedAt() {
        return completedAt;
    }
}
