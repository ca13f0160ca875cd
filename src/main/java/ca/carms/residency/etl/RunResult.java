package ca.carms.residency.etl;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;

/**
 * Outcome of one pipeline run.
 */
@Value
@Builder
public class RunResult {

    int matchIterationId;

    /** Rows held per table for this iteration after the run. */
    Map<String, Integer> countsPerTable;

    /** Rows removed per table because they disappeared from the raw sources. */
    Map<String, Integer> deletedPerTable;

    /** Rows read per raw source. */
    Map<String, Integer> sourceRows;

    /** Null or blank cells per known section column. */
    Map<String, Integer> emptySectionCells;

    List<EtlIssue> errors;

    List<EtlIssue> warnings;
}
