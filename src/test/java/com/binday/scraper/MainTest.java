package com.binday.scraper;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;
import org.junit.jupiter.api.io.TempDir;
import static org.junit.jupiter.api.Assertions.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Map;

public class MainTest {
    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    private final PrintStream out = new PrintStream(buffer, true, StandardCharsets.UTF_8);

    private static final ScraperConfig CONFIG = ScraperConfig.from(Map.of(
        "POSTCODE", "BA1 1AA", "ADDRESS_LINE", "1 High Street", "TIMEZONE", "Europe/London")::get);

    @Test
    void testParseModePrintsReport() throws Exception {
        Path page = tempDir.resolve("results.html");
        Files.writeString(page, Fixtures.load("collection-results.html"));
        ZonedDateTime now = ZonedDateTime.of(2025, 11, 10, 8, 0, 0, 0, ZoneId.of("Europe/London"));

        assertEquals(Main.EXIT_OK, Main.parse(page, CONFIG, now, out));
        JsonNode json = new ObjectMapper().readTree(buffer.toString(StandardCharsets.UTF_8));
        assertEquals("1 High Street", json.get("address").asText());
        assertEquals(6, json.get("collections").size());
        assertEquals("6 days and 23 hours", json.get("collections").get(0).get("time_until_next_text").asText());
    }

    @Test
    void testParseModeWithMissingFile() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"parse", tempDir.resolve("missing.html").toString()}, CONFIG, out));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"parse"}, CONFIG, out));
    }

    @Test
    void testScrapeFailsOnInvalidConfig() {
        ScraperConfig empty = ScraperConfig.from(key -> null);
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"scrape"}, empty, out));
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[0], empty, out));
    }

    @Test
    void testScrapeStopsBeforeAnyWorkWhenDatabaseCredentialsMissing() {
        ScraperConfig external = ScraperConfig.from(Map.of(
            "POSTCODE", "BA1 1AA", "ADDRESS_LINE", "1 High Street", "PG_HOST", "db.internal")::get);
        assertThrows(IllegalStateException.class, external::requireValid);
        assertEquals(Main.EXIT_FAILURE, Main.scrape(external, out));
        assertEquals("", buffer.toString(StandardCharsets.UTF_8));
    }

    @Test
    void testUnknownMode() {
        assertEquals(Main.EXIT_FAILURE, Main.run(new String[]{"export"}, CONFIG, out));
    }
}
