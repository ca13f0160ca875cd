package ca.carms.residency.etl.extract;

import lombok.Value;

/**
 * The three raw extracts of one match iteration.
 */
@Value
public class RawSources {
    RawTable disciplines;
    RawTable programMaster;
    RawTable sections;
}
