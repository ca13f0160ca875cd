package ca.carms.residency.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.PersistenceContext;

import java.util.Collection;
import java.util.List;

class SectionTermSearchRepositoryImpl implements SectionTermSearchRepository {

    private static final String RANK_QUERY =
        "SELECT new ca.carms.residency.repository.SectionScore(t.section.id, SUM(t.frequency)) "
            + "FROM SectionTerm t "
            + "WHERE t.term IN :terms "
            + "GROUP BY t.section.id "
            + "ORDER BY SUM(t.frequency) DESC, t.section.id ASC";

    @PersistenceContext
    private EntityManager entityManager;

    @Override
    public List<SectionScore> rankSections(Collection<String> terms, int limit, int offset) {
        return entityManager.createQuery(RANK_QUERY, SectionScore.class)
            .setParameter("terms", terms)
            .setFirstResult(offset)
            .setMaxResults(limit)
            .getResultList();
    }
}
