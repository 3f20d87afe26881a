package app.herbaria.provenance.repository;

import app.herbaria.provenance.domain.entity.ImageTransformationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ImageTransformationRepository extends JpaRepository<ImageTransformationEntity, String> {
    List<ImageTransformationEntity> findBySpecimenIdentityOrderByCreatedAtAscDerivedHashAsc(String specimenIdentity);
}
