package com.binday.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.junit.jupiter.api.*;
import static org.junit.jupiter.api.Assertions.*;

import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.List;
import java.util.Map;

public class PostgresRecordStoreTest {
    private static final ZoneId LONDON = ZoneId.of("Europe/London");
    private static final ZonedDateTime NOW = ZonedDateTime.of(2025, 11, 10, 8, 0, 0, 0, LONDON);

    private static CollectionRecord record(String type, String next, String last) {
        return CollectionRecord.of(type, new WasteClassifier().classify(type), next, last, null);
    }

    @Test
    void testSchemaSqlCoversEveryStorageKey() {
        String create = PostgresRecordStore.createTableSql();
        for (StorageColumnKey key : StorageColumnKey.values()) {
            assertTrue(create.contains(key.lastCollectionColumn() + " TIMESTAMP WITH TIME ZONE"));
            assertTrue(create.contains(key.nextCollectionColumn() + " TIMESTAMP WITH TIME ZONE"));
        }
        assertTrue(create.contains("address TEXT PRIMARY KEY"));
        assertTrue(create.contains("site_last_checked TIMESTAMP WITH TIME ZONE NOT NULL"));

        String upsert = PostgresRecordStore.upsertSql();
        assertTrue(upsert.contains("ON CONFLICT (address) DO UPDATE SET"));
        assertTrue(upsert.contains("green_garden_bin_next_collection = EXCLUDED.green_garden_bin_next_collection"));
        assertFalse(upsert.contains("address = EXCLUDED.address"));
        assertEquals(12, upsert.chars().filter(c -> c == '?').count());
    }

    @Test
    void testScheduleSkipsUnrecognizedAndKeepsLaterRecord() {
        PostgresRecordStore store = new PostgresRecordStore("jdbc:postgresql://localhost/unused", "u", "p", LONDON);
        Map<StorageColumnKey, OffsetDateTime[]> schedule = store.toSchedule(List.of(
            record("Black Rubbish Bin", "Monday, 17 November 2025", "Monday, 3 November 2025"),
            record("Bulky Items", "Monday, 17 November 2025", null),
            record("Black rubbish (extra)", "Tuesday, 18 November 2025", "not a date")
        ));
        assertEquals(1, schedule.size());
        OffsetDateTime[] black = schedule.get(StorageColumnKey.BLACK_RUBBISH_140L);
        assertNull(black[0]);
        assertEquals(ZonedDateTime.of(2025, 11, 18, 7, 0, 0, 0, LONDON).toOffsetDateTime(), black[1]);
        assertTrue(store.toSchedule(null).isEmpty());
    }

    @Test
    void testUpsertReplacesWholeRow() throws Exception {
        // initdb refuses to run as root
        Assumptions.assumeFalse("root".equals(System.getProperty("user.name")));
        try (EmbeddedPostgres postgres = EmbeddedPostgres.builder().start()) {
            PostgresRecordStore store = new PostgresRecordStore(
                PostgresRecordStore.embeddedJdbcUrl(postgres), "postgres", "postgres", LONDON);
            store.ensureSchema();
            store.ensureSchema();

            int stored = store.upsert("1 High Street", List.of(
                record("Black Rubbish Bin", "Monday, 17 November 2025", "Monday, 3 November 2025"),
                record("Garden Waste", "Tuesday, 18 November 2025", "Tuesday, 4 November 2025"),
                record("Bulky Items", "Monday, 17 November 2025", null)
            ), NOW);
            assertEquals(2, stored);

            Map<String, OffsetDateTime> row = store.loadSchedule("1 High Street");
            assertEquals(ZonedDateTime.of(2025, 11, 17, 7, 0, 0, 0, LONDON).toInstant(),
                row.get("black_rubbish_140l_next_collection").toInstant());
            assertNotNull(row.get("green_garden_bin_last_collection"));
            assertNull(row.get("blue_cardboard_bag_next_collection"));
            assertEquals(NOW.toInstant(), row.get("site_last_checked").toInstant());

            ZonedDateTime later = NOW.plusDays(1);
            assertEquals(1, store.upsert("1 High Street", List.of(
                record("Blue Cardboard Bag", "Monday, 24 November 2025", null)), later));
            row = store.loadSchedule("1 High Street");
            assertNull(row.get("black_rubbish_140l_next_collection"));
            assertNull(row.get("green_garden_bin_last_collection"));
            assertNotNull(row.get("blue_cardboard_bag_next_collection"));
            assertEquals(later.toInstant(), row.get("site_last_checked").toInstant());

            assertTrue(store.loadSchedule("2 High Street").isEmpty());
        }
    }

    @Test
    void testUpsertRejectsMissingKey() {
        PostgresRecordStore store = new PostgresRecordStore("jdbc:postgresql://localhost/unused", "u", "p", LONDON);
        assertThrows(IllegalArgumentException.class, () -> store.upsert(" ", List.of(), NOW));
        assertThrows(IllegalArgumentException.class, () -> store.upsert("1 High Street", List.of(), null));
    }

    @Test
    void testUnreachableDatabaseRaisesStoreException() {
        PostgresRecordStore store = new PostgresRecordStore("jdbc:postgresql://127.0.0.1:1/none?connectTimeout=1", "u", "p", LONDON);
        RecordStoreException e = assertThrows(RecordStoreException.class, store::ensureSchema);
        assertNotNull(e.getCause());
    }
}
