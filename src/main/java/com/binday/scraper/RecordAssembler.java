package com.binday.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns a results page into ordered {@link CollectionRecord}s.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Extracts the table with {@link TableExtractor}.</li>
 *   <li>Per row, resolves the collection label and the raw next/last dates once.</li>
 *   <li>Splits composite labels with {@link LabelSplitter}; every split label shares the row's dates.</li>
 *   <li>Classifies each label with {@link WasteClassifier} and computes deltas with {@link TimeDeltaCalculator}.</li>
 * </ul>
 * Output order follows table order, then label order within a row. The result depends only on the
 * markup, {@code now} and the zone, so repeated runs over the same inputs are identical.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class RecordAssembler {
    private static final Logger logger = LoggerFactory.getLogger(RecordAssembler.class);

    private final TableExtractor tableExtractor;
    private final LabelSplitter labelSplitter;
    private final WasteClassifier wasteClassifier;
    private final TimeDeltaCalculator timeDeltaCalculator;

    public RecordAssembler() {
        this(new TableExtractor(), new LabelSplitter(), new WasteClassifier(), new TimeDeltaCalculator());
    }

    public RecordAssembler(TableExtractor tableExtractor, LabelSplitter labelSplitter,
                           WasteClassifier wasteClassifier, TimeDeltaCalculator timeDeltaCalculator) {
        this.tableExtractor = tableExtractor;
        this.labelSplitter = labelSplitter;
        this.wasteClassifier = wasteClassifier;
        this.timeDeltaCalculator = timeDeltaCalculator;
    }

    /**
     * Assembles collection records from a results page.
     * @param html results page markup (may be null or empty)
     * @param now current time, injected by the caller
     * @param zoneName zone the page's dates are local to; invalid ids fall back to Europe/London
     * @return records in table order; empty when the page has no usable table
     */
    public List<CollectionRecord> assemble(String html, ZonedDateTime now, String zoneName) {
        if (now == null) {
            throw new IllegalArgumentException("now must not be null");
        }
        ZoneId zone = CollectionDateParser.resolveZone(zoneName);
        ExtractedTable table = tableExtractor.extract(html);
        List<CollectionRecord> records = new ArrayList<>();

        int rowNumber = 0;
        for (RawRow row : table.rows()) {
            rowNumber++;
            String label = tableExtractor.resolveCollectionType(row, table.columnMapping());
            List<String> labels = labelSplitter.split(label);
            if (labels.isEmpty()) {
                logger.debug("Row {} has no collection type; skipping.", rowNumber);
                continue;
            }
            TableExtractor.RowDates dates = tableExtractor.resolveDates(row, table.columnMapping());
            TimeDelta delta = timeDeltaCalculator.compute(dates.nextCollection(), dates.lastCollection(), now, zone);
            for (String collectionType : labels) {
                WasteClassification classification = wasteClassifier.classify(collectionType);
                if (!classification.isRecognized()) {
                    logger.info("Unrecognized collection type '{}' kept without waste group.", collectionType);
                }
                records.add(CollectionRecord.of(collectionType, classification,
                    dates.nextCollection(), dates.lastCollection(), delta));
            }
        }
        logger.info("Assembled {} collection records from {} table rows.", records.size(), table.rows().size());
        return records;
    }
}
