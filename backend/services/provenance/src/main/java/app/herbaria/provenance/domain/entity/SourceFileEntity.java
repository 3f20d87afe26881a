package app.herbaria.provenance.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

@Entity
@Immutable
@Table(name = "source_files", schema = "app_provenance")
public class SourceFileEntity {

    @Id
    @Column(name = "source_id", nullable = false)
    private UUID sourceId;

    @Column(name = "specimen_identity", nullable = false, length = 64)
    private String specimenIdentity;

    @Column(name = "source_ref", nullable = false)
    private String sourceRef;

    @Column(name = "format")
    private String format;

    @Column(name = "size_bytes")
    private Long sizeBytes;

    @Column(name = "role")
    private String role;

    @Column(name = "camera_filename")
    private String cameraFilename;

    @Column(name = "expected_catalog_number")
    private String expectedCatalogNumber;

    @Column(name = "registered_at", nullable = false, updatable = false)
    private Instant registeredAt;

    protected SourceFileEntity() {
    }

    public UUID getSourceId() {
        return sourceId;
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public String getSourceRef() {
        return sourceRef;
    }

    public String getFormat() {
        return format;
    }

    public Long getSizeBytes() {
        return sizeBytes;
    }

    public String getRole() {
        return role;
    }

    public String getCameraFilename() {
        return cameraFilename;
    }

    public String getExpectedCatalogNumber() {
        return expectedCatalogNumber;
    }

    public Instant getRegisteredAt() {
        return registeredAt;
    }
}
