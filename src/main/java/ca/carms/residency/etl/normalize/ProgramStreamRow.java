package ca.carms.residency.etl.normalize;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class ProgramStreamRow {
    Integer id;
    Integer disciplineId;
    Integer schoolId;
    String streamName;
    String site;
    String streamLabel;
    String programName;
    String programUrl;
    Integer matchIterationId;
}
