package ca.carms.residency.etl.extract;

import java.util.regex.Pattern;

/**
 * Cell and header cleanup shared by the extract readers.
 */
public final class RawCells {

    private static final Pattern LEGACY_INDEX_HEADER = Pattern.compile("^Unnamed: \\d+$");

    private RawCells() {
    }

    /**
     * Replace non-breaking spaces, drop byte-order marks and trim. Blank becomes null.
     */
    public static String clean(String value) {
        if (value == null) {
            return null;
        }
        String cleaned = value
            .replace('\u00a0', ' ')
            .replace("\ufeff", "")
            .trim();
        return cleaned.isEmpty() ? null : cleaned;
    }

    /**
     * The spreadsheet row-number column a dataframe export leaves behind.
     */
    public static boolean isLegacyIndexColumn(String header) {
        return header == null || LEGACY_INDEX_HEADER.matcher(header).matches();
    }
}
