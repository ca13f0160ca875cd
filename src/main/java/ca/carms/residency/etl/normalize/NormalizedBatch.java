package ca.carms.residency.etl.normalize;

import ca.carms.residency.etl.EtlIssue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * The complete normalizer output for one run. Every list is ordered by natural
 * key so that equal input yields equal output.
 */
@Value
@Builder
public class NormalizedBatch {

    int matchIterationId;

    List<DisciplineRow> disciplines;
    List<SchoolRow> schools;
    List<ProgramStreamRow> programStreams;
    List<ProgramDescriptionRow> programDescriptions;
    List<SectionRow> sections;

    List<EtlIssue> errors;
    List<EtlIssue> warnings;

    Map<String, Integer> sourceRows;
    Map<String, Integer> emptySectionCells;
}
