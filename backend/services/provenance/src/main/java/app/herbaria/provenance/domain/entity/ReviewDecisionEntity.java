package app.herbaria.provenance.domain.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.Immutable;

import java.time.Instant;
import java.util.UUID;

/**
 * Written by the review tool. Mapped read-only here.
 */
@Entity
@Immutable
@Table(name = "review_decisions", schema = "app_provenance")
public class ReviewDecisionEntity {

    @Id
    @Column(name = "decision_id", nullable = false)
    private UUID decisionId;

    @Column(name = "specimen_identity", nullable = false, length = 64)
    private String specimenIdentity;

    @Column(name = "status", nullable = false)
    private String status;

    @Column(name = "reviewer")
    private String reviewer;

    @Column(name = "notes")
    private String notes;

    @Column(name = "decided_at", nullable = false)
    private Instant decidedAt;

    protected ReviewDecisionEntity() {
    }

    public UUID getDecisionId() {
        return decisionId;
    }

    public String getSpecimenIdentity() {
        return specimenIdentity;
    }

    public String getStatus() {
        return status;
    }

    public String getReviewer() {
        return reviewer;
    }

    public String getNotes() {
        return notes;
    }

    public Instant getDecidedAt() {
        return decidedAt;
    }
}
