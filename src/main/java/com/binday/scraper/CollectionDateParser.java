package com.binday.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.Locale;
import java.util.Optional;

/**
 * Parses council collection dates such as {@code "Monday, 17 November 2025"} into zoned timestamps.
 * <p>
 * The weekday prefix is ignored; only {@code day month-name year} is parsed. Every parsed date is
 * pinned to 07:00 local time, the hour bins are expected to be out on the kerb.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class CollectionDateParser {
    private static final Logger logger = LoggerFactory.getLogger(CollectionDateParser.class);

    public static final String DEFAULT_ZONE = "Europe/London";
    public static final int COLLECTION_HOUR = 7;

    private static final DateTimeFormatter DATE_FORMAT = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("d MMMM uuuu")
            .toFormatter(Locale.ENGLISH)
            .withResolverStyle(ResolverStyle.STRICT);

    /**
     * Parses a collection date in the named zone.
     * @param text date text, e.g. "Monday, 17 November 2025" (may be null)
     * @param zoneName IANA zone id; unresolvable ids fall back to Europe/London
     * @return the date at 07:00 in the zone, or empty if the text does not parse
     */
    public Optional<ZonedDateTime> parse(String text, String zoneName) {
        return parse(text, resolveZone(zoneName));
    }

    /**
     * Parses a collection date in an already-resolved zone.
     * @param text date text (may be null)
     * @param zone zone to pin the 07:00 timestamp in
     * @return the date at 07:00 in the zone, or empty if the text does not parse
     */
    public Optional<ZonedDateTime> parse(String text, ZoneId zone) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        // Drop "Monday," and anything else before the first comma
        int comma = text.indexOf(',');
        String datePart = (comma >= 0 ? text.substring(comma + 1) : text).trim().replaceAll("\\s+", " ");
        try {
            LocalDate date = LocalDate.parse(datePart, DATE_FORMAT);
            return Optional.of(date.atTime(COLLECTION_HOUR, 0).atZone(zone == null ? ZoneId.of(DEFAULT_ZONE) : zone));
        } catch (DateTimeParseException e) {
            logger.debug("Could not parse collection date '{}': {}", text, e.getMessage());
            return Optional.empty();
        }
    }

    /**
     * Resolves a zone id, falling back to Europe/London with a warning when it is blank or unknown.
     * @param zoneName IANA zone id (may be null)
     * @return resolved zone, never null
     */
    public static ZoneId resolveZone(String zoneName) {
        if (zoneName == null || zoneName.isBlank()) {
            logger.warn("No timezone configured, using {}", DEFAULT_ZONE);
            return ZoneId.of(DEFAULT_ZONE);
        }
        try {
            return ZoneId.of(zoneName.trim());
        } catch (DateTimeException e) {
            logger.warn("Invalid timezone '{}', using {}", zoneName, DEFAULT_ZONE);
            return ZoneId.of(DEFAULT_ZONE);
        }
    }
}
