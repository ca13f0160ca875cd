package ca.carms.residency.repository;

import ca.carms.residency.entity.SectionTerm;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface SectionTermRepository extends JpaRepository<SectionTerm, Long>, SectionTermSearchRepository {

    List<SectionTerm> findBySectionId(Long sectionId);
}
