package com.binday.scraper;

import java.time.Duration;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Computes how long until the next collection and how long since the last one, relative to a
 * caller-supplied "now".
 * <p>
 * Durations are measured in local wall-clock time in the collection zone, so 07:00 Saturday to
 * 07:00 Monday is two whole days even when the clocks change in between.
 * <p>
 * Negative durations are never reported: a next date already in the past yields zeroes and
 * {@link #COLLECTION_PASSED}, a last date in the future yields zeroes.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public class TimeDeltaCalculator {
    public static final String COLLECTION_PASSED = "Collection time has passed";
    public static final String LESS_THAN_A_MINUTE = "Less than 1 minute";

    private final CollectionDateParser dateParser;

    public TimeDeltaCalculator() {
        this(new CollectionDateParser());
    }

    public TimeDeltaCalculator(CollectionDateParser dateParser) {
        this.dateParser = dateParser == null ? new CollectionDateParser() : dateParser;
    }

    /**
     * Computes the deltas for one collection.
     * @param nextText raw next-collection text (may be null)
     * @param lastText raw last-collection text (may be null)
     * @param now current instant
     * @param zone zone the collection dates are local to
     * @return populated delta; fields whose date did not parse are null
     */
    public TimeDelta compute(String nextText, String lastText, ZonedDateTime now, ZoneId zone) {
        Long daysUntilNext = null;
        Long minutesUntilNext = null;
        String timeUntilNextText = null;
        Long daysSinceLast = null;
        Long minutesSinceLast = null;
        ZoneId localZone = zone == null ? ZoneId.of(CollectionDateParser.DEFAULT_ZONE) : zone;
        LocalDateTime localNow = now.withZoneSameInstant(localZone).toLocalDateTime();

        Optional<ZonedDateTime> next = dateParser.parse(nextText, localZone);
        if (next.isPresent()) {
            LocalDateTime localNext = next.get().toLocalDateTime();
            if (!localNext.isBefore(localNow)) {
                Duration delta = Duration.between(localNow, localNext);
                daysUntilNext = delta.toDays();
                minutesUntilNext = delta.toMinutes();
                timeUntilNextText = formatDuration(daysUntilNext, minutesUntilNext);
            } else {
                daysUntilNext = 0L;
                minutesUntilNext = 0L;
                timeUntilNextText = COLLECTION_PASSED;
            }
        }

        Optional<ZonedDateTime> last = dateParser.parse(lastText, localZone);
        if (last.isPresent()) {
            LocalDateTime localLast = last.get().toLocalDateTime();
            if (!localLast.isAfter(localNow)) {
                Duration delta = Duration.between(localLast, localNow);
                daysSinceLast = delta.toDays();
                minutesSinceLast = delta.toMinutes();
            } else {
                daysSinceLast = 0L;
                minutesSinceLast = 0L;
            }
        }

        return new TimeDelta(daysUntilNext, minutesUntilNext, timeUntilNextText, daysSinceLast, minutesSinceLast);
    }

    /**
     * Renders a duration as plain text, e.g. "2 days, 5 hours and 30 minutes".
     * @param days whole days in the duration
     * @param totalMinutes whole minutes in the whole duration (not just the remainder)
     * @return human-readable text; "Less than 1 minute" when every component is zero
     */
    public static String formatDuration(long days, long totalMinutes) {
        if (totalMinutes < 0) {
            return COLLECTION_PASSED;
        }
        long hours = totalMinutes / 60;
        long remainingMinutes = totalMinutes % 60;
        if (days > 0) {
            hours -= days * 24;
        }

        List<String> parts = new ArrayList<>();
        if (days > 0) parts.add(plural(days, "day"));
        if (hours > 0) parts.add(plural(hours, "hour"));
        if (remainingMinutes > 0) parts.add(plural(remainingMinutes, "minute"));

        if (parts.isEmpty()) {
            return LESS_THAN_A_MINUTE;
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        return String.join(", ", parts.subList(0, parts.size() - 1)) + " and " + parts.get(parts.size() - 1);
    }

    private static String plural(long count, String unit) {
        return count == 1 ? "1 " + unit : count + " " + unit + "s";
    }
}
