package ca.carms.residency.repository;

import ca.carms.residency.entity.ProgramStream;
import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;
import jakarta.persistence.TypedQuery;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

class ProgramStreamSearchRepositoryImpl implements ProgramStreamSearchRepository {

    private static final char LIKE_ESCAPE = '!';

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<ProgramStream> findPrograms(ProgramFilter filter, int limit, int offset) {
        List<String> where = new ArrayList<>();
        Map<String, Object> params = new LinkedHashMap<>();

        if (filter.getDisciplineId() != null) {
            where.add("d.id = :disciplineId");
            params.put("disciplineId", filter.getDisciplineId());
        }
        if (filter.getSchoolId() != null) {
            where.add("s.id = :schoolId");
            params.put("schoolId", filter.getSchoolId());
        }
        if (filter.getText() != null && !filter.getText().isBlank()) {
            String escape = " ESCAPE '" + LIKE_ESCAPE + "'";
            where.add("(LOWER(p.programName) LIKE :pattern" + escape
                + " OR LOWER(p.streamName) LIKE :pattern" + escape
                + " OR LOWER(s.name) LIKE :pattern" + escape
                + " OR LOWER(p.site) LIKE :pattern" + escape + ")");
            params.put("pattern", "%" + escapeLike(filter.getText().trim().toLowerCase(Locale.ROOT)) + "%");
        }

        StringBuilder jpql = new StringBuilder(
            "SELECT p FROM ProgramStream p JOIN FETCH p.discipline d JOIN FETCH p.school s");
        if (!where.isEmpty()) {
            jpql.append(" WHERE ").append(String.join(" AND ", where));
        }
        jpql.append(" ORDER BY p.programName ASC, p.id ASC");

        TypedQuery<ProgramStream> query = entityManager.createQuery(jpql.toString(), ProgramStream.class);
        params.forEach(query::setParameter);
        return query
            .setFirstResult(offset)
            .setMaxResults(limit)
            .getResultList();
    }

    static String escapeLike(String value) {
        StringBuilder escaped = new StringBuilder(value.length());
        for (char c : value.toCharArray()) {
            if (c == '%' || c == '_' || c == LIKE_ESCAPE) {
                escaped.append(LIKE_ESCAPE);
            }
            escaped.append(c);
        }
        return escaped.toString();
    }
}
