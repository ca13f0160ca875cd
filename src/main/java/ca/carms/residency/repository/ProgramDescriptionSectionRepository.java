package ca.carms.residency.repository;

import ca.carms.residency.entity.ProgramDescriptionSection;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;

@Repository
public interface ProgramDescriptionSectionRepository extends JpaRepository<ProgramDescriptionSection, Long> {

    /**
     * Load sections together with their description, stream, discipline and school
     */
    @Query("SELECT s FROM ProgramDescriptionSection s "
        + "JOIN FETCH s.description d "
        + "JOIN FETCH d.programStream p "
        + "JOIN FETCH p.discipline "
        + "JOIN FETCH p.school "
        + "WHERE s.id IN :ids")
    List<ProgramDescriptionSection> findAllWithProgramByIdIn(@Param("ids") Collection<Long> ids);

    long countByDescriptionId(Integer programDescriptionId);
}
