package ca.carms.residency.repository;

import ca.carms.residency.entity.ProgramStream;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Repository for ProgramStream entities.
 */
@Repository
public interface ProgramStreamRepository extends JpaRepository<ProgramStream, Integer>, ProgramStreamSearchRepository {

    /**
     * Every persisted program URL with its surrogate id
     */
    @Query("SELECT p.programUrl AS naturalKey, p.id AS id FROM ProgramStream p")
    List<NaturalKeyIdentity> findAllIdentities();

    /**
     * Load a stream with its discipline and school in one round trip
     */
    @Query("SELECT p FROM ProgramStream p JOIN FETCH p.discipline JOIN FETCH p.school WHERE p.id = :id")
    Optional<ProgramStream> findWithReferencesById(@Param("id") Integer id);

    List<ProgramStream> findByMatchIterationId(Integer matchIterationId);

    long countByDisciplineId(Integer disciplineId);
}
