package com.binday.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.util.HashMap;
import java.util.Map;

public class ScraperConfigTest {

    private static ScraperConfig config(Map<String, String> values) {
        return ScraperConfig.from(values::get);
    }

    @Test
    void testDefaults() {
        ScraperConfig config = config(Map.of());
        assertEquals("Europe/London", config.timezone);
        assertEquals(ScraperConfig.DEFAULT_URL, config.url);
        assertEquals(5432, config.pgPort);
        assertEquals("binday", config.pgDatabase);
        assertEquals("binday-scraper", config.pgAppName);
        assertEquals("scraped-data/pgdata", config.embeddedPgDataDir);
        assertTrue(config.headless);
        assertTrue(config.exportCsv);
        assertFalse(config.debug);
        assertFalse(config.usesExternalDatabase());
    }

    @Test
    void testQuotedValuesAreCleaned() {
        ScraperConfig config = config(Map.of("POSTCODE", "\"BA1 1AA\"", "ADDRESS_LINE", " '1 High Street' "));
        assertEquals("BA1 1AA", config.postcode);
        assertEquals("1 High Street", config.addressLine);
        assertNull(ScraperConfig.clean(null));
        assertEquals("", ScraperConfig.clean("\"\""));
    }

    @Test
    void testValidateRequiresAddress() {
        ScraperConfig config = config(Map.of());
        assertEquals(2, config.validate().size());
        IllegalStateException e = assertThrows(IllegalStateException.class, config::requireValid);
        assertTrue(e.getMessage().contains("POSTCODE"));
        assertTrue(e.getMessage().contains("ADDRESS_LINE"));
    }

    @Test
    void testExternalDatabaseNeedsCredentials() {
        Map<String, String> values = new HashMap<>();
        values.put("POSTCODE", "BA1 1AA");
        values.put("ADDRESS_LINE", "1 High Street");
        values.put("PG_HOST", "db.internal");
        ScraperConfig config = config(values);
        assertTrue(config.usesExternalDatabase());
        assertEquals(2, config.validate().size());

        values.put("PG_USERNAME", "bins");
        values.put("PG_PASSWORD", "secret");
        values.put("PG_PORT", "6543");
        config = config(values);
        assertTrue(config.validate().isEmpty());
        assertDoesNotThrow(config::requireValid);
        assertEquals("jdbc:postgresql://db.internal:6543/binday?ApplicationName=binday-scraper", config.jdbcUrl());
        assertFalse(config.toString().contains("secret"));
    }

    @Test
    void testNonNumericPortFallsBack() {
        ScraperConfig config = config(Map.of("PG_PORT", "five", "EMBEDDED_PG_PORT", "15432"));
        assertEquals(5432, config.pgPort);
        assertEquals(15432, config.embeddedPgPort);
    }

    @Test
    void testBooleanFlags() {
        ScraperConfig config = config(Map.of("DEBUG", "true", "SCRAPER_HEADLESS", "false", "SCRAPER_EXPORT_CSV", "no"));
        assertTrue(config.debug);
        assertFalse(config.headless);
        assertFalse(config.exportCsv);
    }
}
