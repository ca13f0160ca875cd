package ca.carms.residency.etl.extract;

import java.util.List;
import java.util.Set;

/**
 * Column names of the three raw extracts.
 */
public final class SourceColumns {

    // discipline lookup
    public static final String DISCIPLINE_ID = "discipline_id";
    public static final String DISCIPLINE = "discipline";

    // program_master
    public static final String DISCIPLINE_NAME = "discipline_name";
    public static final String SCHOOL_ID = "school_id";
    public static final String SCHOOL_NAME = "school_name";
    public static final String PROGRAM_STREAM_ID = "program_stream_id";
    public static final String PROGRAM_STREAM_NAME = "program_stream_name";
    public static final String PROGRAM_SITE = "program_site";
    public static final String PROGRAM_STREAM = "program_stream";
    public static final String PROGRAM_NAME = "program_name";
    public static final String PROGRAM_URL = "program_url";

    // x_section
    public static final String DOCUMENT_ID = "document_id";
    public static final String SOURCE = "source";
    public static final String N_PROGRAM_DESCRIPTION_SECTIONS = "n_program_description_sections";
    public static final String MATCH_ITERATION_NAME = "match_iteration_name";
    public static final String MATCH_ITERATION_ID = "match_iteration_id";
    public static final String PROGRAM_DESCRIPTION_ID = "program_description_id";

    public static final List<String> DISCIPLINE_REQUIRED = List.of(DISCIPLINE_ID, DISCIPLINE);

    public static final List<String> PROGRAM_MASTER_REQUIRED = List.of(
        DISCIPLINE_ID, DISCIPLINE_NAME, SCHOOL_ID, SCHOOL_NAME, PROGRAM_URL);

    public static final List<String> SECTIONS_REQUIRED = List.of(SOURCE);

    /** x_section columns that describe the document rather than hold section text. */
    public static final Set<String> SECTION_METADATA = Set.of(
        DOCUMENT_ID, SOURCE, N_PROGRAM_DESCRIPTION_SECTIONS, PROGRAM_NAME,
        MATCH_ITERATION_NAME, MATCH_ITERATION_ID, PROGRAM_DESCRIPTION_ID);

    private SourceColumns() {
    }
}
