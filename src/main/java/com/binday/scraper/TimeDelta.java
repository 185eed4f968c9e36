package com.binday.scraper;

/**
 * Time-until / time-since figures for one collection. Each field is null when the date it depends on
 * was absent or unparseable.
 */
public record TimeDelta(
    Long daysUntilNext,
    Long minutesUntilNext,
    String timeUntilNextText,
    Long daysSinceLast,
    Long minutesSinceLast
) {
    public static final TimeDelta EMPTY = new TimeDelta(null, null, null, null, null);
}
