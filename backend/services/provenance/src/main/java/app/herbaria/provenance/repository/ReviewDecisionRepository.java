package app.herbaria.provenance.repository;

import app.herbaria.provenance.domain.entity.ReviewDecisionEntity;
import org.springframework.data.repository.Repository;

import java.util.Optional;
import java.util.UUID;

public interface ReviewDecisionRepository extends Repository<ReviewDecisionEntity, UUID> {
    Optional<ReviewDecisionEntity> findFirstBySpecimenIdentityOrderByDecidedAtDesc(String specimenIdentity);

    long count();
}
