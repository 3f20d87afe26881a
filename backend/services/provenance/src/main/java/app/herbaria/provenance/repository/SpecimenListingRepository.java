package app.herbaria.provenance.repository;

import app.herbaria.provenance.aggregate.ValueNormalizer;
import app.herbaria.provenance.domain.model.SpecimenFilter;
import app.herbaria.provenance.domain.model.SpecimenSummary;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageImpl;
import org.springframework.data.domain.Pageable;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.List;

@Repository
public class SpecimenListingRepository {

    private static final String LATEST_REVIEW_STATUS = """
            (select r.status
             from app_provenance.review_decisions r
             where r.specimen_identity = s.specimen_identity
             order by r.decided_at desc
             limit 1)
            """;

    private static final RowMapper<SpecimenSummary> SUMMARY_MAPPER = (rs, rowNum) -> {
        Timestamp firstSeen = rs.getTimestamp("first_seen_at");
        return new SpecimenSummary(
                rs.getString("specimen_identity"),
                firstSeen == null ? null : firstSeen.toInstant(),
                rs.getString("catalog_number"),
                rs.getInt("attempt_count"),
                rs.getInt("flag_count"),
                rs.getString("review_status")
        );
    };

    private final JdbcTemplate jdbcTemplate;

    public SpecimenListingRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    public Page<SpecimenSummary> findSummaries(SpecimenFilter filter, Pageable pageable) {
        List<Object> args = new ArrayList<>();
        String where = whereClause(filter, args);

        Long total = jdbcTemplate.queryForObject(
                "select count(*) from app_provenance.specimens s"
                        + " left join app_provenance.specimen_aggregations a on a.specimen_identity = s.specimen_identity"
                        + where,
                Long.class,
                args.toArray()
        );

        List<Object> pageArgs = new ArrayList<>(args);
        pageArgs.add(pageable.getPageSize());
        pageArgs.add(pageable.getOffset());
        List<SpecimenSummary> content = jdbcTemplate.query(
                """
                select s.specimen_identity,
                       s.first_seen_at,
                       a.catalog_number,
                       coalesce(a.attempt_count, 0) as attempt_count,
                       (select count(*)
                        from app_provenance.quality_flags f
                        where f.specimen_identity = s.specimen_identity) as flag_count,
                """
                        + LATEST_REVIEW_STATUS + " as review_status"
                        + " from app_provenance.specimens s"
                        + " left join app_provenance.specimen_aggregations a on a.specimen_identity = s.specimen_identity"
                        + where
                        + " order by s.specimen_identity limit ? offset ?",
                SUMMARY_MAPPER,
                pageArgs.toArray()
        );
        return new PageImpl<>(content, pageable, total == null ? 0 : total);
    }

    public List<String> findIdentitiesAfter(String afterIdentity, SpecimenFilter filter, int limit) {
        List<Object> args = new ArrayList<>();
        StringBuilder where = new StringBuilder(whereClause(filter, args));
        if (afterIdentity != null && !afterIdentity.isBlank()) {
            where.append(" and s.specimen_identity > ?");
            args.add(afterIdentity);
        }
        args.add(limit);
        return jdbcTemplate.queryForList(
                "select s.specimen_identity from app_provenance.specimens s"
                        + " left join app_provenance.specimen_aggregations a on a.specimen_identity = s.specimen_identity"
                        + where
                        + " order by s.specimen_identity limit ?",
                String.class,
                args.toArray()
        );
    }

    public List<String> findStaleIdentities(int limit) {
        return jdbcTemplate.queryForList(
                """
                select s.specimen_identity
                from app_provenance.specimens s
                left join app_provenance.specimen_aggregations a on a.specimen_identity = s.specimen_identity
                where (select count(*)
                       from app_provenance.extraction_attempts e
                       where e.specimen_identity = s.specimen_identity
                         and e.status <> 'pending') > coalesce(a.attempt_count, 0)
                order by s.specimen_identity
                limit ?
                """,
                String.class,
                limit
        );
    }

    private String whereClause(SpecimenFilter filter, List<Object> args) {
        StringBuilder where = new StringBuilder(" where 1 = 1");
        if (filter == null) {
            return where.toString();
        }
        if (filter.flagKind() != null) {
            where.append(" and exists (select 1 from app_provenance.quality_flags f"
                    + " where f.specimen_identity = s.specimen_identity"
                    + " and f.kind = cast(? as app_provenance.flag_kind))");
            args.add(filter.flagKind().name());
        }
        if (filter.reviewStatus() != null && !filter.reviewStatus().isBlank()) {
            where.append(" and ").append(LATEST_REVIEW_STATUS).append(" = ?");
            args.add(filter.reviewStatus().trim());
        }
        if (filter.catalogNumber() != null && !filter.catalogNumber().isBlank()) {
            where.append(" and a.catalog_number_key = ?");
            args.add(ValueNormalizer.normalize(filter.catalogNumber()));
        }
        return where.toString();
    }
}
