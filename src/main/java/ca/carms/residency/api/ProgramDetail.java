package ca.carms.residency.api;

import lombok.Builder;
import lombok.Data;

import java.util.List;

/**
 * A program stream with its description and sections in display precedence.
 */
@Data
@Builder
public class ProgramDetail {
    private ProgramSummary program;
    private DescriptionView description;
    private List<SectionView> sections;
}
