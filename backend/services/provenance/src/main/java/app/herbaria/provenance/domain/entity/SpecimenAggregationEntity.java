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
@Table(name = "specimen_aggregations", schema = "app_provenance")
public class SpecimenAggregationEntity {

    @Id
    @Column(name = "specimen_identity", nullable = false, length = 64)
    private String specimenIdentity;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "record_json", columnDefinition = "jsonb", nullable = false)
    private JsonNode recordJson;

    @Column(name = "catalog_number")
    private String catalogNumber;

    @Column(name = "catalog_number_key")
    private String catalogNumberKey;

    @Column(name = "attempt_count", nullable = false)
    private Integer attemptCount;

    @Column(name = "computed_at", nullable = false)
    private Instant computedAt;

    protected SpecimenAggregationEntity() {
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public JsonNode getRecordJson() {
        return recordJson;
    }

    public String getCatalogNumber() {
        return catalogNumber;
    }

    public String getCatalogNumberKey() {
        return catalogNumberKey;
    }

    public Integer getAttemptCount() {
        return attemptCount;
    }

    public Instant getComputedAt() {
        return computedAt;
    }
}
