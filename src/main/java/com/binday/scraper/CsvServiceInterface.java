package com.binday.scraper;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;

/**
 * Interface for CSV export of assembled collection records.
 */
public interface CsvServiceInterface {
    /**
     * Writes collection records to a CSV file with a header row.
     * @param records records to export, in output order
     * @param filename name of the output CSV file, resolved against the service's output directory
     * @return path of the written file
     * @throws IOException if file writing fails
     */
    Path writeCollectionsToCSV(List<CollectionRecord> records, String filename) throws IOException;
}
