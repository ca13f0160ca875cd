package ca.carms.residency.etl;

import lombok.Builder;
import lombok.Value;

/**
 * A recoverable data-quality finding. The run completes; the finding is
 * counted and reported in the {@link RunResult}.
 */
@Value
@Builder
public class EtlIssue {

    public enum Kind {
        /** An x_section row whose source URL matches no program stream; the row is not loaded. */
        UNJOINED_SECTION,
        /** An x_section column outside the known section vocabulary; the column is ignored. */
        UNKNOWN_COLUMN,
        /** document_id does not end in the joined stream's source program_stream_id; the row is loaded. */
        DOCUMENT_ID_MISMATCH
    }

    Kind kind;
    String source;
    String key;
    String message;
}
