package com.binday.scraper;

import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Optional;

public class CollectionDateParserTest {
    private static final ZoneId LONDON = ZoneId.of("Europe/London");

    private final CollectionDateParser parser = new CollectionDateParser();

    @Test
    void testParsePinsSevenAmInZone() {
        Optional<ZonedDateTime> parsed = parser.parse("Monday, 17 November 2025", "Europe/London");
        assertEquals(Optional.of(ZonedDateTime.of(2025, 11, 17, 7, 0, 0, 0, LONDON)), parsed);
    }

    @Test
    void testWeekdayPrefixIsIgnored() {
        ZonedDateTime expected = ZonedDateTime.of(2025, 11, 17, 7, 0, 0, 0, LONDON);
        assertEquals(expected, parser.parse("Friday, 17 November 2025", LONDON).orElseThrow());
        assertEquals(expected, parser.parse("Whenever, 17 November 2025", LONDON).orElseThrow());
        assertEquals(expected, parser.parse("17 November 2025", LONDON).orElseThrow());
    }

    @Test
    void testCaseAndWhitespaceAreTolerated() {
        ZonedDateTime expected = ZonedDateTime.of(2025, 11, 3, 7, 0, 0, 0, LONDON);
        assertEquals(expected, parser.parse("monday,  3   NOVEMBER 2025 ", LONDON).orElseThrow());
    }

    @Test
    void testSummerDateKeepsLocalHour() {
        ZonedDateTime parsed = parser.parse("Tuesday, 1 July 2025", LONDON).orElseThrow();
        assertEquals(7, parsed.getHour());
        assertEquals(1, parsed.getOffset().getTotalSeconds() / 3600);
    }

    @Test
    void testUnparseableTextIsEmpty() {
        assertTrue(parser.parse("Not a date", LONDON).isEmpty());
        assertTrue(parser.parse("Monday, 31 February 2025", LONDON).isEmpty());
        assertTrue(parser.parse("", LONDON).isEmpty());
        assertTrue(parser.parse(null, LONDON).isEmpty());
    }

    @Test
    void testOtherZone() {
        ZoneId newYork = ZoneId.of("America/New_York");
        ZonedDateTime parsed = parser.parse("Monday, 17 November 2025", "America/New_York").orElseThrow();
        assertEquals(ZonedDateTime.of(2025, 11, 17, 7, 0, 0, 0, newYork), parsed);
    }

    @Test
    void testInvalidZoneFallsBackToLondon() {
        assertEquals(LONDON, CollectionDateParser.resolveZone("Mars/Olympus_Mons"));
        assertEquals(LONDON, CollectionDateParser.resolveZone(""));
        assertEquals(LONDON, CollectionDateParser.resolveZone(null));
        ZonedDateTime parsed = parser.parse("Monday, 17 November 2025", "Mars/Olympus_Mons").orElseThrow();
        assertEquals(LONDON, parsed.getZone());
    }
}
