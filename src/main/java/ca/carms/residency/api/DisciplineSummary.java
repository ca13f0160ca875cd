package ca.carms.residency.api;

import lombok.Builder;
import lombok.Data;

@Data
@Builder
public class DisciplineSummary {
    private Integer disciplineId;
    private String discipline;
}
