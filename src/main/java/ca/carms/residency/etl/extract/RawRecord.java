package ca.carms.residency.etl.extract;

import ca.carms.residency.exception.RawExtractException;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * One row of a raw extract: cleaned cell values keyed by column name.
 */
@Value
public class RawRecord {

    String sourceName;

    /** 1-based data row number within the source, header excluded. */
    int rowNumber;

    Map<String, String> values;

    public String get(String column) {
        return values.get(column);
    }

    /**
     * Parse an integer cell. Spreadsheet exports may render ids as "27447.0".
     *
     * @return the value, or null when the cell is blank
     * @throws RawExtractException when the cell is not an integer
     */
    public Integer getInteger(String column) {
        String value = values.get(column);
        if (value == null) {
            return null;
        }
        try {
            return new BigDecimal(value).intValueExact();
        } catch (NumberFormatException | ArithmeticException e) {
            throw new RawExtractException(String.format("%s row %d: column %s is not an integer: '%s'",
                sourceName, rowNumber, column, value), e);
        }
    }
}
