package ca.carms.residency.repository;

import java.util.Collection;
import java.util.List;

public interface SectionTermSearchRepository {

    /**
     * Rank sections by the summed frequency of the given terms, highest first,
     * ties broken by ascending section id.
     *
     * @param terms  analyzed query terms, must not be empty
     * @param limit  maximum number of rows
     * @param offset number of rows to skip
     */
    List<SectionScore> rankSections(Collection<String> terms, int limit, int offset);
}
