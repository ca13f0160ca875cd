package ca.carms.residency.etl.extract;

import ca.carms.residency.exception.RawExtractException;
import lombok.Value;

import java.util.Collection;
import java.util.List;

/**
 * Row-oriented in-memory form of one raw extract.
 */
@Value
public class RawTable {

    String sourceName;
    List<String> columns;
    List<RawRecord> records;

    public int size() {
        return records.size();
    }

    /**
     * @throws RawExtractException when any of the columns is absent
     */
    public void requireColumns(Collection<String> required) {
        List<String> missing = required.stream()
            .filter(column -> !columns.contains(column))
            .toList();
        if (!missing.isEmpty()) {
            throw new RawExtractException(sourceName + " is missing required columns " + missing);
        }
    }
}
