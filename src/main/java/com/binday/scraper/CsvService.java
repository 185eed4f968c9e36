package com.binday.scraper;

import com.opencsv.CSVWriter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

/**
 * Exports collection records to CSV files using OpenCSV.
 * <p>
 * Workflow:
 * <ul>
 *   <li>One line per record, in assembly order, under a fixed header.</li>
 *   <li>Multiple waste groups are joined with {@code "; "}; absent values become empty cells.</li>
 *   <li>Files land in {@code scraped-data/} unless another directory is given.</li>
 * </ul>
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class CsvService implements CsvServiceInterface {
    private static final Logger logger = LoggerFactory.getLogger(CsvService.class);

    static final String[] HEADER = {
        "CollectionType", "WasteGroup", "StorageKey", "NextCollection", "LastCollection",
        "DaysUntilNext", "MinutesUntilNext", "TimeUntilNext", "DaysSinceLast", "MinutesSinceLast"
    };
    static final String GROUP_SEPARATOR = "; ";

    private final Path outDir;

    public CsvService() {
        this(Paths.get("scraped-data"));
    }

    public CsvService(Path outDir) {
        this.outDir = outDir;
    }

    @Override
    public Path writeCollectionsToCSV(List<CollectionRecord> records, String filename) throws IOException {
        if (records == null) {
            logger.warn("Attempted to write null record list to CSV: {}", filename);
            throw new IllegalArgumentException("Record list cannot be null");
        }
        if (filename == null || filename.trim().isEmpty()) {
            logger.warn("Attempted to write CSV with invalid filename: {}", filename);
            throw new IllegalArgumentException("Filename cannot be null or empty");
        }
        Files.createDirectories(outDir);
        Path target = outDir.resolve(filename);
        try (Writer out = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
             CSVWriter writer = new CSVWriter(out)) {
            writer.writeNext(HEADER);
            for (CollectionRecord record : records) {
                writer.writeNext(toRow(record));
            }
        }
        logger.info("Wrote {} collection records to CSV file: {}", records.size(), target);
        return target;
    }

    static String[] toRow(CollectionRecord record) {
        return new String[]{
            record.collectionType(),
            record.wasteGroups() == null ? "" : String.join(GROUP_SEPARATOR, record.wasteGroups()),
            record.storageKey() == null ? "" : record.storageKey().columnPrefix(),
            safe(record.nextCollection()),
            safe(record.lastCollection()),
            str(record.daysUntilNext()),
            str(record.minutesUntilNext()),
            safe(record.timeUntilNextText()),
            str(record.daysSinceLast()),
            str(record.minutesSinceLast())
        };
    }

    private static String str(Long value) {
        return value == null ? "" : value.toString();
    }

    private static String safe(String s) {
        return s == null ? "" : s.replaceAll("[\\r\\n]+", " ").trim();
    }
}
