package ca.carms.residency.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class SectionView {
    private Long sectionId;
    private String sectionName;
    private String sectionText;
}
