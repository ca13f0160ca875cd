package ca.carms.residency.repository;

import lombok.Builder;
import lombok.Value;

/**
 * Optional criteria for listing program streams. Null fields do not filter.
 */
@Value
@Builder
public class ProgramFilter {
    Integer disciplineId;
    Integer schoolId;
    String text;
}
