package ca.carms.residency.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DescriptionView {
    private Integer programDescriptionId;
    private String sourceUrl;
    private String documentId;
    private Integer matchIterationId;
    private String matchIterationName;
    private Integer sectionCount;
}
