package ca.carms.residency.repository;

import ca.carms.residency.entity.ProgramStream;

import java.util.List;

public interface ProgramStreamSearchRepository {

    /**
     * Find program streams matching the filter, ordered by program name then id,
     * with discipline and school fetched.
     *
     * @param filter optional criteria
     * @param limit  maximum number of rows
     * @param offset number of rows to skip
     */
    List<ProgramStream> findPrograms(ProgramFilter filter, int limit, int offset);
}
