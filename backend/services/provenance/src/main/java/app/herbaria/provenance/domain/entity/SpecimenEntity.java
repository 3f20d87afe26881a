package app.herbaria.provenance.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;

@Entity
@Immutable
@Table(name = "specimens", schema = "app_provenance")
public class SpecimenEntity {

    @Id
    @Column(name = "specimen_identity", nullable = false, length = 64)
    private String specimenIdentity;

    @Column(name = "first_seen_at", nullable = false, updatable = false)
    private Instant firstSeenAt;

    protected SpecimenEntity() {
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public Instant getFirstSeenAt() {
        return firstSeenAt;
    }
}
