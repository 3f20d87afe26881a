package app.herbaria.provenance.domain.entity;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;

@Entity
@Immutable
@Table(name = "image_transformations", schema = "app_provenance")
public class ImageTransformationEntity {

    @Id
    @Column(name = "derived_hash", nullable = false, length = 64)
    private String derivedHash;

    @Column(name = "specimen_identity", nullable = false, length = 64)
    private String specimenIdentity;

    @Column(name = "derived_from", nullable = false, length = 64)
    private String derivedFrom;

    @Column(name = "operation", nullable = false)
    private String operation;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "params_json", columnDefinition = "jsonb")
    private JsonNode paramsJson;

    @Column(name = "tool")
    private String tool;

    @Column(name = "tool_version")
    private String toolVersion;

    @Column(name = "stored_at")
    private String storedAt;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected ImageTransformationEntity() {
    }

    public String getDerivedHash() {
        return derivedHash;
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public String getDerivedFrom() {
        return derivedFrom;
    }

    public String getOperation() {
        return operation;
    }

    public JsonNode getParamsJson() {
        return paramsJson;
    }

    public String getTool() {
        return tool;
    }

    public String getToolVersion() {
        return toolVersion;
    }

    public String getStoredAt() {
        return storedAt;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
