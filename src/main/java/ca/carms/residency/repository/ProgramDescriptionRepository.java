package ca.carms.residency.repository;

import ca.carms.residency.entity.ProgramDescription;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for ProgramDescription entities.
 */
@Repository
public interface ProgramDescriptionRepository extends JpaRepository<ProgramDescription, Integer> {

    /**
     * Every persisted source URL with its surrogate id
     */
    @Query("SELECT d.sourceUrl AS naturalKey, d.id AS id FROM ProgramDescription d")
    List<NaturalKeyIdentity> findAllIdentities();

    /**
     * Find the description of a program stream with its sections loaded
     */
    @Query("SELECT DISTINCT d FROM ProgramDescription d LEFT JOIN FETCH d.sections "
        + "WHERE d.programStream.id = :programStreamId")
    Optional<ProgramDescription> findWithSectionsByProgramStreamId(@Param("programStreamId") Integer programStreamId);

    @Query("SELECT DISTINCT d FROM ProgramDescription d LEFT JOIN FETCH d.sections WHERE d.id IN :ids")
    List<ProgramDescription> findAllWithSectionsByIdIn(@Param("ids") Collection<Integer> ids);

    List<ProgramDescription> findByProgramStreamIdIn(Collection<Integer> programStreamIds);

    boolean existsByProgramStreamId(Integer programStreamId);
}
