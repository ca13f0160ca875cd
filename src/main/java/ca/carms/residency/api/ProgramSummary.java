package ca.carms.residency.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class ProgramSummary {
    private Integer programStreamId;
    private String programName;
    private String programStreamName;
    private String programStream;
    private Integer disciplineId;
    private String disciplineName;
    private Integer schoolId;
    private String schoolName;
    private String programSite;
    private String programUrl;
    private Integer matchIterationId;
}
