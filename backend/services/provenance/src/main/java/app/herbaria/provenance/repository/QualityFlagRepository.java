package app.herbaria.provenance.repository;

import app.herbaria.provenance.domain.entity.QualityFlagEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

@Repository
public interface QualityFlagRepository extends JpaRepository<QualityFlagEntity, UUID> {
    List<QualityFlagEntity> findBySpecimenIdentityOrderByKindAscFieldAsc(String specimenIdentity);

    @Query("select count(distinct f.specimenIdentity) from QualityFlagEntity f")
    long countFlaggedSpecimens();
}
