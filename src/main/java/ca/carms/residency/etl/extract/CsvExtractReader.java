package ca.carms.residency.etl.extract;

import ca.carms.residency.exception.RawExtractException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Reads CSV extracts with Commons CSV. A {@code .zip} source is read from its
 * first {@code .csv} entry.
 */
@Slf4j
@Component
public class CsvExtractReader implements RawExtractReader {

    private static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
        .setIgnoreEmptyLines(true)
        .build();

    @Override
    public boolean supports(Path path) {
        String name = path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".csv") || name.endsWith(".zip");
    }

    @Override
    public RawTable read(String sourceName, Path path) {
        boolean zipped = path.getFileName().toString().toLowerCase(Locale.ROOT).endsWith(".zip");
        try (InputStream in = Files.newInputStream(path)) {
            if (!zipped) {
                return parse(sourceName, new InputStreamReader(in, StandardCharsets.UTF_8));
            }
            try (ZipInputStream zip = new ZipInputStream(in, StandardCharsets.UTF_8)) {
                ZipEntry entry;
                while ((entry = zip.getNextEntry()) != null) {
                    if (!entry.isDirectory() && entry.getName().toLowerCase(Locale.ROOT).endsWith(".csv")) {
                        log.info("Reading {} from zip entry {}", sourceName, entry.getName());
                        return parse(sourceName, new InputStreamReader(zip, StandardCharsets.UTF_8));
                    }
                }
            }
            throw new RawExtractException("No CSV entry found inside " + path);
        } catch (IOException e) {
            throw new RawExtractException("Failed to read " + sourceName + " from " + path, e);
        }
    }

    RawTable parse(String sourceName, Reader reader) throws IOException {
        try (CSVParser parser = FORMAT.parse(new BufferedReader(reader))) {
            Iterator<CSVRecord> rows = parser.iterator();
            if (!rows.hasNext()) {
                throw new RawExtractException(sourceName + " is empty");
            }

            CSVRecord headerRow = rows.next();
            List<String> headers = new ArrayList<>(headerRow.size());
            for (String header : headerRow) {
                headers.add(RawCells.clean(header));
            }

            List<String> columns = headers.stream()
                .filter(header -> !RawCells.isLegacyIndexColumn(header))
                .toList();

            List<RawRecord> records = new ArrayList<>();
            int rowNumber = 0;
            while (rows.hasNext()) {
                CSVRecord row = rows.next();
                rowNumber++;
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < headers.size(); i++) {
                    String header = headers.get(i);
                    if (RawCells.isLegacyIndexColumn(header)) {
                        continue;
                    }
                    values.put(header, i < row.size() ? RawCells.clean(row.get(i)) : null);
                }
                records.add(new RawRecord(sourceName, rowNumber, Collections.unmodifiableMap(values)));
            }

            log.info("Read {} rows and {} columns from {}", records.size(), columns.size(), sourceName);
            return new RawTable(sourceName, columns, Collections.unmodifiableList(records));
        }
    }
}
