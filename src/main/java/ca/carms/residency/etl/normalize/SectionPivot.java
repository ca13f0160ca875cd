package ca.carms.residency.etl.normalize;

import ca.carms.residency.entity.SectionName;
import ca.carms.residency.etl.extract.RawRecord;

import java.util.ArrayList;
import java.util.List;

/**
 * Wide-to-narrow transform of the x_section text columns. One row per
 * non-blank known column, in section precedence order.
 */
public final class SectionPivot {

    private SectionPivot() {
    }

    public static List<SectionRow> pivot(RawRecord record, Integer programDescriptionId) {
        List<SectionRow> rows = new ArrayList<>();
        for (SectionName name : SectionName.values()) {
            String text = record.get(name.columnName());
            if (text == null || text.isBlank()) {
                continue;
            }
            rows.add(new SectionRow(programDescriptionId, name, text.strip()));
        }
        return rows;
    }
}
