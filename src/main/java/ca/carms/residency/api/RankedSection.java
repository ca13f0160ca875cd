package ca.carms.residency.api;

import lombok.Builder;
import lombok.Data;

/**
 * One full-text search hit and the program it belongs to.
 */
@Data
@Builder
public class RankedSection {
    private Long sectionId;
    private Integer programStreamId;
    private Integer programDescriptionId;
    private String programName;
    private String schoolName;
    private String disciplineName;
    private String sectionName;
    private double rank;
    private String snippet;
}
