package com.binday.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Locale;

/**
 * Main entry point for the bin collection scraper.
 * This application looks up a household's bin collection days on the council website, stores them
 * in PostgreSQL and optionally exports them to CSV.
 * <p>
 * Modes:
 * <ul>
 *   <li>{@code scrape} (default): fetch, assemble, store and export.</li>
 *   <li>{@code parse <file.html>}: assemble a saved results page and print the JSON report.</li>
 *   <li>{@code db}: start the embedded PostgreSQL only, for inspection with a DB client.</li>
 * </ul>
 * Exits with status 1 on configuration, fetch or storage failure.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class Main {
    private static final Logger logger = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;

    private static final String EMBEDDED_USER = "postgres";
    private static final String EMBEDDED_PASSWORD = "postgres";

    /**
     * Main application entry point.
     * @param args Command-line arguments
     */
    public static void main(String[] args) {
        int status = run(args, ScraperConfig.fromEnvironment(), System.out);
        if (status != EXIT_OK) System.exit(status);
    }

    /**
     * Dispatches to the requested mode.
     * @return process exit status
     */
    static int run(String[] args, ScraperConfig config, PrintStream out) {
        String mode = (args != null && args.length > 0) ? args[0].trim().toLowerCase(Locale.ROOT) : "scrape";
        switch (mode) {
            case "", "scrape":
                return scrape(config, out);
            case "parse":
                if (args.length < 2) {
                    logger.error("Usage: parse <results-page.html>");
                    return EXIT_FAILURE;
                }
                return parse(Paths.get(args[1]), config, ZonedDateTime.now(CollectionDateParser.resolveZone(config.timezone)), out);
            case "db", "db-only", "database":
                return databaseOnly(config, out);
            default:
                logger.error("Unknown mode '{}'. Expected one of: scrape, parse, db", mode);
                return EXIT_FAILURE;
        }
    }

    /**
     * Full workflow: fetch the results page, assemble records, store them and export.
     */
    static int scrape(ScraperConfig config, PrintStream out) {
        try {
            config.requireValid();
        } catch (IllegalStateException e) {
            logger.error(e.getMessage());
            return EXIT_FAILURE;
        }
        logger.info("Starting bin collection scraper with {}", config);

        ZoneId zone = CollectionDateParser.resolveZone(config.timezone);
        EmbeddedPostgres postgres = null;
        try {
            RecordStoreInterface store;
            String location;
            if (config.usesExternalDatabase()) {
                store = new PostgresRecordStore(config.jdbcUrl(), config.pgUser, config.pgPassword, zone);
                location = config.pgHost + ":" + config.pgPort + "/" + config.pgDatabase;
            } else {
                postgres = PostgresRecordStore.startEmbedded(config.embeddedPgDataDir, config.embeddedPgPort);
                store = new PostgresRecordStore(PostgresRecordStore.embeddedJdbcUrl(postgres), EMBEDDED_USER, EMBEDDED_PASSWORD, zone);
                location = "embedded PostgreSQL on port " + postgres.getPort();
            }
            store.ensureSchema();

            PageFetcherInterface fetcher = new CollectionPageFetcher(config);
            String html = fetcher.fetchResultsHtml(config.postcode, config.addressLine);

            ZonedDateTime now = ZonedDateTime.now(zone);
            List<CollectionRecord> records = new RecordAssembler().assemble(html, now, config.timezone);
            store.upsert(config.addressLine, records, now);

            if (config.exportCsv) {
                exportCsv(new CsvService(), records, config.addressLine);
            }

            out.println("Successfully processed " + records.size() + " collection types for " + config.addressLine);
            out.println("Data stored in database: " + location);
            if (config.debug) {
                out.println(new CollectionReport(config.addressLine, config.postcode, config.timezone, records).toJson());
            }
            return EXIT_OK;
        } catch (PageFetchException e) {
            logger.error("Failed to fetch collection page: {}", e.getMessage());
            return EXIT_FAILURE;
        } catch (RecordStoreException e) {
            logger.error("Database error: {}", e.getMessage(), e.getCause());
            return EXIT_FAILURE;
        } catch (Exception e) {
            logger.error("Scrape failed: {}", e.getMessage(), e);
            return EXIT_FAILURE;
        } finally {
            stopEmbedded(postgres);
        }
    }

    /**
     * Offline run over a saved results page. No browser and no database.
     */
    static int parse(Path htmlFile, ScraperConfig config, ZonedDateTime now, PrintStream out) {
        try {
            String html = Files.readString(htmlFile, StandardCharsets.UTF_8);
            List<CollectionRecord> records = new RecordAssembler().assemble(html, now, config.timezone);
            out.println(new CollectionReport(config.addressLine, config.postcode, config.timezone, records).toJson());
            return EXIT_OK;
        } catch (IOException e) {
            logger.error("Could not process results page {}: {}", htmlFile, e.getMessage());
            return EXIT_FAILURE;
        }
    }

    private static int databaseOnly(ScraperConfig config, PrintStream out) {
        EmbeddedPostgres postgres = null;
        try {
            postgres = PostgresRecordStore.startEmbedded(config.embeddedPgDataDir, config.embeddedPgPort);
            String jdbc = PostgresRecordStore.embeddedJdbcUrl(postgres);
            new PostgresRecordStore(jdbc, EMBEDDED_USER, EMBEDDED_PASSWORD, CollectionDateParser.resolveZone(config.timezone))
                .ensureSchema();
            out.println("Embedded Postgres started.");
            out.println("JDBC URL: " + jdbc);
            out.println("DB user: " + EMBEDDED_USER);
            out.println("DB password: " + EMBEDDED_PASSWORD);
            out.println("Data directory: " + config.embeddedPgDataDir);
            out.println("Press Enter to stop the embedded DB and exit.");
            try {
                System.in.read();
            } catch (IOException e) {
                logger.warn("Could not read from stdin, stopping: {}", e.getMessage());
            }
            return EXIT_OK;
        } catch (RecordStoreException e) {
            logger.error("Failed to start embedded Postgres in db-only mode: {}", e.getMessage(), e.getCause());
            return EXIT_FAILURE;
        } finally {
            stopEmbedded(postgres);
        }
    }

    private static void exportCsv(CsvServiceInterface csvService, List<CollectionRecord> records, String address) {
        String filename = Utils.sanitizeFilename(address) + ".csv";
        try {
            csvService.writeCollectionsToCSV(records, filename);
        } catch (IOException e) {
            // records are already stored; a failed export does not fail the run
            logger.error("Failed to write collections CSV '{}': {}", filename, e.getMessage());
        }
    }

    private static void stopEmbedded(EmbeddedPostgres postgres) {
        if (postgres == null) return;
        try {
            postgres.close();
            logger.info("Embedded PostgreSQL stopped.");
        } catch (IOException e) {
            logger.warn("Failed to stop embedded PostgreSQL: {}", e.getMessage());
        }
    }
}
