package ca.carms.residency.etl.normalize;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProgramDescriptionRow {
    Integer id;
    Integer programStreamId;
    String sourceUrl;
    String documentId;
    Integer matchIterationId;
    String matchIterationName;
    String programName;
    Integer sectionCount;
}
