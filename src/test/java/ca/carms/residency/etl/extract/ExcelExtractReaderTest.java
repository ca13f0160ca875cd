package ca.carms.residency.etl.extract;

import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("ExcelExtractReader Unit Tests")
class ExcelExtractReaderTest {

    private final ExcelExtractReader reader = new ExcelExtractReader();

    @Test
    @DisplayName("Should read the first sheet, drop the index column and skip blank rows")
    void shouldReadFirstSheet(@TempDir Path dir) throws IOException {
        // Given
        Path path = dir.resolve("1503_discipline.xlsx");
        try (XSSFWorkbook workbook = new XSSFWorkbook(); OutputStream out = Files.newOutputStream(path)) {
            Sheet sheet = workbook.createSheet("disciplines");
            Row header = sheet.createRow(0);
            header.createCell(1).setCellValue("discipline_id");
            header.createCell(2).setCellValue("discipline");

            Row first = sheet.createRow(1);
            first.createCell(0).setCellValue(0);
            first.createCell(1).setCellValue(1);
            first.createCell(2).setCellValue(" Anesthesiology ");

            sheet.createRow(2);

            Row second = sheet.createRow(3);
            second.createCell(0).setCellValue(1);
            second.createCell(1).setCellValue(27);
            second.createCell(2).setCellValue("Family Medicine");

            workbook.createSheet("ignored").createRow(0).createCell(0).setCellValue("other");
            workbook.write(out);
        }

        // When
        RawTable table = reader.read("discipline", path);

        // Then
        assertThat(table.getColumns()).containsExactly("discipline_id", "discipline");
        assertThat(table.size()).isEqualTo(2);
        assertThat(table.getRecords().get(0).getInteger("discipline_id")).isEqualTo(1);
        assertThat(table.getRecords().get(0).get("discipline")).isEqualTo("Anesthesiology");
        assertThat(table.getRecords().get(1).getRowNumber()).isEqualTo(2);
        assertThat(table.getRecords().get(1).get("discipline_id")).isEqualTo("27");
    }

    @Test
    @DisplayName("Should support only spreadsheet extensions")
    void shouldSupportSpreadsheetExtensions() {
        assertThat(reader.supports(Path.of("a/1503_program_master.xlsx"))).isTrue();
        assertThat(reader.supports(Path.of("a/legacy.XLS"))).isTrue();
        assertThat(reader.supports(Path.of("a/x_section.csv"))).isFalse();
    }
}
