package ca.carms.residency.etl.normalize;

import ca.carms.residency.entity.SectionName;
import ca.carms.residency.etl.extract.RawRecord;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SectionPivot Unit Tests")
class SectionPivotTest {

    @Test
    @DisplayName("Should emit one row per non-blank section in precedence order")
    void shouldPivotNonBlankSections() {
        // Given
        Map<String, String> values = new HashMap<>();
        for (SectionName name : SectionName.values()) {
            values.put(name.columnName(), null);
        }
        values.put("faq", "Ask us anything.");
        values.put("program_highlights", "  Great program.  ");
        values.put("research", "Research block.");
        values.put("interviews", "Virtual interviews.");
        values.put("electives", "Many electives.");
        values.put("program_goals", "   ");
        values.put("source", "https://example.org/1");

        // When
        List<SectionRow> rows = SectionPivot.pivot(new RawRecord("x_section", 1, values), 42);

        // Then
        assertThat(SectionName.values()).hasSize(21);
        assertThat(rows).hasSize(5);
        assertThat(rows).extracting(SectionRow::getSectionName).containsExactly(
            SectionName.PROGRAM_HIGHLIGHTS, SectionName.ELECTIVES, SectionName.RESEARCH,
            SectionName.INTERVIEWS, SectionName.FAQ);
        assertThat(rows).allMatch(row -> row.getProgramDescriptionId() == 42);
        assertThat(rows.get(0).getSectionText()).isEqualTo("Great program.");
    }

    @Test
    @DisplayName("Should emit nothing when every section is empty")
    void shouldEmitNothingForEmptyRecord() {
        // When
        List<SectionRow> rows = SectionPivot.pivot(new RawRecord("x_section", 1, Map.of("source", "https://a")), 1);

        // Then
        assertThat(rows).isEmpty();
    }
}
