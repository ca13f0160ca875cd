package ca.carms.residency.etl.extract;

import ca.carms.residency.exception.RawExtractException;
import org.springframework.stereotype.Component;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Picks the reader for a raw file by its extension.
 */
@Component
public class RawExtractReaders {

    private final List<RawExtractReader> readers;

    public RawExtractReaders(List<RawExtractReader> readers) {
        this.readers = readers;
    }

    public RawTable read(String sourceName, Path path) {
        if (!Files.isRegularFile(path)) {
            throw new RawExtractException("Raw file for " + sourceName + " not found: " + path.toAbsolutePath());
        }
        return readers.stream()
            .filter(reader -> reader.supports(path))
            .findFirst()
            .orElseThrow(() -> new RawExtractException("No reader supports " + path.getFileName()))
            .read(sourceName, path);
    }
}
