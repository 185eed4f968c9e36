package com.binday.scraper;

import java.time.ZonedDateTime;
import java.util.List;

/**
 * Interface for durable storage of collection schedules, one row per address.
 */
public interface RecordStoreInterface {
    /**
     * Creates the collections table and its index if they don't already exist. Safe to call repeatedly.
     * @throws RecordStoreException if the schema cannot be created
     */
    void ensureSchema();

    /**
     * Replaces the stored schedule for an address. Every bin type column is written on each call;
     * bin types missing from {@code records} are cleared.
     * @param address address the schedule belongs to (row key)
     * @param records assembled records; those without a storage key are skipped
     * @param checkedAt time the council site was checked
     * @return number of distinct bin types stored
     * @throws RecordStoreException if the write fails
     */
    int upsert(String address, List<CollectionRecord> records, ZonedDateTime checkedAt);
}
