package app.herbaria.provenance.repository;

import app.herbaria.provenance.domain.entity.SpecimenAggregationEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SpecimenAggregationRepository extends JpaRepository<SpecimenAggregationEntity, String> {
    List<SpecimenAggregationEntity> findByCatalogNumberKeyOrderBySpecimenIdentityAsc(String catalogNumberKey);

    @Query(value = """
            select min(a.catalog_number) as catalogNumber,
                   string_agg(a.specimen_identity, ',' order by a.specimen_identity) as specimenIdentities
            from app_provenance.specimen_aggregations a
            where a.catalog_number_key is not null
            group by a.catalog_number_key
            having count(*) > 1
            order by a.catalog_number_key
            """, nativeQuery = true)
    List<DuplicateGroupProjection> findDuplicateGroups();

    interface DuplicateGroupProjection {
        String getCatalogNumber();

        String getSpecimenIdentities();
    }
}
