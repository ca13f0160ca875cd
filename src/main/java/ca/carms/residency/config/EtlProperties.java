package ca.carms.residency.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.nio.file.Path;

/**
 * Raw source locations and pipeline settings (carms.etl.* in application.yml).
 */
@Data
@ConfigurationProperties(prefix = "carms.etl")
public class EtlProperties {

    /** Directory holding the raw extracts. */
    private String rawDir = "data/raw";

    /** Discipline lookup (xlsx or csv), relative to rawDir. */
    private String disciplineFile = "1503_discipline.xlsx";

    /** Program master table (xlsx or csv), relative to rawDir. */
    private String programMasterFile = "1503_program_master.xlsx";

    /** Wide program description sections (csv, or a zip holding one), relative to rawDir. */
    private String sectionsFile = "1503_program_descriptions_x_section.csv";

    /** Match iteration stamped on program streams. */
    private int matchIterationId = 1503;

    /** Upper bound on sources extracted concurrently. */
    private int extractionThreads = 3;

    public Path disciplinePath() {
        return Path.of(rawDir).resolve(disciplineFile);
    }

    public Path programMasterPath() {
        return Path.of(rawDir).resolve(programMasterFile);
    }

    public Path sectionsPath() {
        return Path.of(rawDir).resolve(sectionsFile);
    }
}
