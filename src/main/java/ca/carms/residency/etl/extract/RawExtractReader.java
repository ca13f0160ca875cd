package ca.carms.residency.etl.extract;

import java.nio.file.Path;

/**
 * Turns a raw source file into a {@link RawTable}. Implementations drop the
 * legacy index column and clean every cell with {@link RawCells#clean(String)}.
 */
public interface RawExtractReader {

    boolean supports(Path path);

    RawTable read(String sourceName, Path path);
}
