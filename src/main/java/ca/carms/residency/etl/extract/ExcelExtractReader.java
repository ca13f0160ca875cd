package ca.carms.residency.etl.extract;

import ca.carms.residency.exception.RawExtractException;
import lombok.extern.slf4j.Slf4j;
import org.apache.poi.ss.usermodel.Cell;
import org.apache.poi.ss.usermodel.DataFormatter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.ss.usermodel.WorkbookFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the first sheet of an Excel workbook with Apache POI. Row 0 is the header.
 */
@Slf4j
@Component
public class ExcelExtractReader implements RawExtractReader {

    @Override
    public boolean supports(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".xlsx") || name.endsWith(".xls");
    }

    @Override
    public RawTable read(String sourceName, Path path) {
        try (InputStream is = Files.newInputStream(path);
             Workbook workbook = WorkbookFactory.create(is)) {

            if (workbook.getNumberOfSheets() == 0) {
                throw new RawExtractException(sourceName + " workbook has no sheets: " + path);
            }
            Sheet sheet = workbook.getSheetAt(0);
            DataFormatter formatter = new DataFormatter(Locale.ROOT);

            Row headerRow = sheet.getRow(sheet.getFirstRowNum());
            if (headerRow == null) {
                throw new RawExtractException(sourceName + " is empty");
            }

            List<String> headers = new ArrayList<>();
            for (int j = 0; j < headerRow.getLastCellNum(); j++) {
                Cell cell = headerRow.getCell(j);
                headers.add(cell == null ? null : RawCells.clean(formatter.formatCellValue(cell)));
            }

            List<String> columns = headers.stream()
                .filter(header -> !RawCells.isLegacyIndexColumn(header))
                .toList();

            List<RawRecord> records = new ArrayList<>();
            int rowNumber = 0;
            for (int i = sheet.getFirstRowNum() + 1; i <= sheet.getLastRowNum(); i++) {
                Row row = sheet.getRow(i);
                if (row == null) {
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                boolean blank = true;
                for (int j = 0; j < headers.size(); j++) {
                    String header = headers.get(j);
                    if (RawCells.isLegacyIndexColumn(header)) {
                        continue;
                    }
                    Cell cell = row.getCell(j);
                    String value = cell == null ? null : RawCells.clean(formatter.formatCellValue(cell));
                    blank &= value == null;
                    values.put(header, value);
                }
                if (blank) {
                    continue;
                }
                rowNumber++;
                records.add(new RawRecord(sourceName, rowNumber, Collections.unmodifiableMap(values)));
            }

            log.info("Read {} rows from Excel sheet '{}' for {}", records.size(), sheet.getSheetName(), sourceName);
            return new RawTable(sourceName, columns, Collections.unmodifiableList(records));
        } catch (IOException e) {
            throw new RawExtractException("Failed to read " + sourceName + " from " + path, e);
        }
    }
}
