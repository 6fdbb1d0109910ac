package com.realestate.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for writing projected rows to disk, one file per table.
 */
public interface TableExportServiceInterface {
    /**
     * Writes each table as a JSON array to {@code <directory>/<table>.json}.
     * @param rows rows to write
     * @param directory target directory, created when missing
     * @return the files written, in table order
     * @throws IOException if a file cannot be written
     */
    List<Path> writeJson(RowSet rows, Path directory) throws IOException;

    /**
     * Writes each table as CSV with a header row to {@code <directory>/<table>.csv}.
     * @param rows rows to write
     * @param directory target directory, created when missing
     * @return the files written, in table order
     * @throws IOException if a file cannot be written
     */
    List<Path> writeCsv(RowSet rows, Path directory) throws IOException;
}
