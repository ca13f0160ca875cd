package ca.carms.residency.repository;

import lombok.Value;

/**
 * Relevance of one section for a set of query terms.
 */
@Value
public class SectionScore {
    Long sectionId;
    Long score;
}
