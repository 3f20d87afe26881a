package app.herbaria.provenance.repository;

import app.herbaria.provenance.domain.entity.ExtractionAttemptEntity;
import app.herbaria.provenance.domain.type.AttemptStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface ExtractionAttemptRepository extends JpaRepository<ExtractionAttemptEntity, UUID> {
    List<ExtractionAttemptEntity> findBySpecimenIdentityOrderByCreatedAtAscAttemptIdAsc(String specimenIdentity);

    Optional<ExtractionAttemptEntity> findFirstBySpecimenIdentityAndParamsHashAndStatusAndForcedFalseOrderByCreatedAtAsc(
            String specimenIdentity,
            String paramsHash,
            AttemptStatus status
    );

    Optional<ExtractionAttemptEntity> findFirstBySpecimenIdentityAndParamsHashAndStatusOrderByCreatedAtDesc(
            String specimenIdentity,
            String paramsHash,
            AttemptStatus status
    );

    long countByStatus(AttemptStatus status);
}
