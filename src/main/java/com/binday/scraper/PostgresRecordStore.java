package com.binday.scraper;

import io.zonky.test.db.postgres.embedded.EmbeddedPostgres;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Paths;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Stores collection schedules in PostgreSQL, one row per address.
 * <p>
 * Workflow:
 * <ul>
 *   <li>Each {@link StorageColumnKey} owns a {@code <key>_last_collection} / {@code <key>_next_collection}
 *       pair of {@code TIMESTAMP WITH TIME ZONE} columns.</li>
 *   <li>An upsert writes every pair plus {@code site_last_checked}, so bin types that vanished from the
 *       council page are cleared rather than left stale.</li>
 *   <li>Records without a storage key are skipped; when two records share a key the later one wins.</li>
 * </ul>
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
@SuppressWarnings("SqlResolve")
public class PostgresRecordStore implements RecordStoreInterface {
    private static final Logger logger = LoggerFactory.getLogger(PostgresRecordStore.class);

    static final String TABLE = "collections";

    private final String url;
    private final String user;
    private final String password;
    private final ZoneId zone;
    private final CollectionDateParser dateParser = new CollectionDateParser();

    /**
     * Constructs a store with the given connection parameters.
     * @param url JDBC URL
     * @param user Database user
     * @param password Database password
     * @param zone zone collection dates are local to
     */
    public PostgresRecordStore(String url, String user, String password, ZoneId zone) {
        this.url = url;
        this.user = user;
        this.password = password;
        this.zone = zone == null ? ZoneId.of(CollectionDateParser.DEFAULT_ZONE) : zone;
    }

    /**
     * Opens a new database connection.
     * @return Connection
     * @throws SQLException if connection fails
     */
    public Connection connect() throws SQLException {
        return DriverManager.getConnection(url, user, password);
    }

    @Override
    public void ensureSchema() {
        try (Connection conn = connect(); Statement stmt = conn.createStatement()) {
            stmt.execute(createTableSql());
            stmt.execute("CREATE INDEX IF NOT EXISTS idx_collections_site_last_checked ON " + TABLE + "(site_last_checked)");
            logger.info("Ensured {} table exists.", TABLE);
        } catch (SQLException e) {
            logger.error("Error creating {} table: {}", TABLE, e.getMessage());
            throw new RecordStoreException("Could not create " + TABLE + " table", e);
        }
    }

    @Override
    public int upsert(String address, List<CollectionRecord> records, ZonedDateTime checkedAt) {
        if (address == null || address.isBlank()) {
            throw new IllegalArgumentException("address must not be blank");
        }
        if (checkedAt == null) {
            throw new IllegalArgumentException("checkedAt must not be null");
        }
        Map<StorageColumnKey, OffsetDateTime[]> schedule = toSchedule(records);

        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(upsertSql())) {
            int idx = 1;
            ps.setString(idx++, address);
            ps.setObject(idx++, checkedAt.toOffsetDateTime());
            for (StorageColumnKey key : StorageColumnKey.values()) {
                OffsetDateTime[] pair = schedule.get(key);
                setTimestamp(ps, idx++, pair == null ? null : pair[0]);
                setTimestamp(ps, idx++, pair == null ? null : pair[1]);
            }
            ps.executeUpdate();
            logger.info("Stored collection data for {} bin types for '{}'.", schedule.size(), address);
            return schedule.size();
        } catch (SQLException e) {
            logger.error("Error storing collections for '{}': {}", address, e.getMessage());
            throw new RecordStoreException("Could not store collections for " + address, e);
        }
    }

    /**
     * Reads the stored timestamp columns for an address.
     * @param address row key
     * @return column name to value (null values included), or an empty map if the address has no row
     */
    public Map<String, OffsetDateTime> loadSchedule(String address) {
        Map<String, OffsetDateTime> row = new LinkedHashMap<>();
        List<String> columns = new ArrayList<>(timestampColumns());
        columns.add("site_last_checked");
        String sql = "SELECT " + String.join(", ", columns) + " FROM " + TABLE + " WHERE address = ?";
        try (Connection conn = connect(); PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, address);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    for (String column : columns) {
                        row.put(column, rs.getObject(column, OffsetDateTime.class));
                    }
                }
            }
        } catch (SQLException e) {
            logger.error("Error reading collections for '{}': {}", address, e.getMessage());
            throw new RecordStoreException("Could not read collections for " + address, e);
        }
        return row;
    }

    // [last, next] per storage key; later records overwrite earlier ones
    Map<StorageColumnKey, OffsetDateTime[]> toSchedule(List<CollectionRecord> records) {
        Map<StorageColumnKey, OffsetDateTime[]> schedule = new EnumMap<>(StorageColumnKey.class);
        if (records == null) return schedule;
        for (CollectionRecord record : records) {
            if (record == null || !record.isPersistable()) {
                if (record != null) logger.debug("Skipping unrecognized bin type '{}'.", record.collectionType());
                continue;
            }
            schedule.put(record.storageKey(), new OffsetDateTime[]{
                toTimestamp(record.lastCollection()),
                toTimestamp(record.nextCollection())
            });
        }
        return schedule;
    }

    private OffsetDateTime toTimestamp(String text) {
        Optional<ZonedDateTime> parsed = dateParser.parse(text, zone);
        return parsed.map(ZonedDateTime::toOffsetDateTime).orElse(null);
    }

    private static void setTimestamp(PreparedStatement ps, int idx, OffsetDateTime value) throws SQLException {
        if (value != null) ps.setObject(idx, value); else ps.setNull(idx, Types.TIMESTAMP_WITH_TIMEZONE);
    }

    static List<String> timestampColumns() {
        List<String> columns = new ArrayList<>();
        for (StorageColumnKey key : StorageColumnKey.values()) {
            columns.add(key.lastCollectionColumn());
            columns.add(key.nextCollectionColumn());
        }
        return columns;
    }

    static String createTableSql() {
        StringBuilder sql = new StringBuilder("CREATE TABLE IF NOT EXISTS " + TABLE + " (address TEXT PRIMARY KEY, ");
        for (String column : timestampColumns()) {
            sql.append(column).append(" TIMESTAMP WITH TIME ZONE, ");
        }
        sql.append("site_last_checked TIMESTAMP WITH TIME ZONE NOT NULL)");
        return sql.toString();
    }

    static String upsertSql() {
        List<String> columns = new ArrayList<>(List.of("address", "site_last_checked"));
        columns.addAll(timestampColumns());
        List<String> placeholders = new ArrayList<>();
        List<String> updates = new ArrayList<>();
        for (String column : columns) {
            placeholders.add("?");
            if (!column.equals("address")) updates.add(column + " = EXCLUDED." + column);
        }
        return "INSERT INTO " + TABLE + " (" + String.join(", ", columns) + ") VALUES (" + String.join(", ", placeholders) + ") "
            + "ON CONFLICT (address) DO UPDATE SET " + String.join(", ", updates);
    }

    /**
     * Starts an embedded PostgreSQL instance on a specific port for local use and returns it.
     * @param dataDir directory under which to store DB data
     * @param port port number for the Postgres server
     * @return EmbeddedPostgres instance
     */
    public static EmbeddedPostgres startEmbedded(String dataDir, int port) {
        try {
            EmbeddedPostgres postgres = EmbeddedPostgres.builder()
                .setDataDirectory(Paths.get(dataDir))
                .setCleanDataDirectory(false)
                .setPort(port)
                .start();
            logger.info("Embedded PostgreSQL started at {} on port {}", dataDir, port);
            return postgres;
        } catch (Exception e) {
            logger.error("Failed to start embedded PostgreSQL on port {}: {}", port, e.getMessage());
            throw new RecordStoreException("Could not start embedded PostgreSQL", e);
        }
    }

    /**
     * JDBC URL of the default database inside an embedded instance.
     */
    public static String embeddedJdbcUrl(EmbeddedPostgres postgres) {
        return String.format("jdbc:postgresql://localhost:%d/postgres", postgres.getPort());
    }
}
