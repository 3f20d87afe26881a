package app.herbaria.provenance.repository;

import app.herbaria.provenance.domain.entity.SourceFileEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface SourceFileRepository extends JpaRepository<SourceFileEntity, UUID> {
    List<SourceFileEntity> findBySpecimenIdentityOrderByRegisteredAtAscSourceRefAsc(String specimenIdentity);
}
