package app.herbaria.provenance.repository;

import app.herbaria.provenance.domain.entity.SpecimenEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface SpecimenRepository extends JpaRepository<SpecimenEntity, String> {
}
