package com.binday.scraper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

/**
 * Runtime configuration for the scraper, read from environment variables with Java system
 * properties as a fallback (handy for IDE runs where the environment is awkward to change).
 * <p>
 * Values are trimmed and stripped of surrounding quotes, so {@code POSTCODE="BA1 1AA"} copied from a
 * .env file works unchanged.
 *
 * @author Bin Collection Scraper Team
 * @since 1.0
 */
public final class ScraperConfig {
    private static final Logger logger = LoggerFactory.getLogger(ScraperConfig.class);

    public static final String DEFAULT_URL = "https://app.bathnes.gov.uk/webforms/waste/collectionday/";
    public static final int DEFAULT_PG_PORT = 5432;

    public final String postcode;
    public final String addressLine;
    public final String timezone;
    public final String url;
    public final String pgHost;
    public final int pgPort;
    public final String pgDatabase;
    public final String pgUser;
    public final String pgPassword;
    public final String pgAppName;
    public final int embeddedPgPort;
    public final String embeddedPgDataDir;
    public final boolean headless;
    public final boolean exportCsv;
    public final boolean debug;

    private ScraperConfig(Function<String, String> lookup) {
        this.postcode = value(lookup, "POSTCODE", "");
        this.addressLine = value(lookup, "ADDRESS_LINE", "");
        this.timezone = value(lookup, "TIMEZONE", CollectionDateParser.DEFAULT_ZONE);
        this.url = value(lookup, "SCRAPER_URL", DEFAULT_URL);
        this.pgHost = value(lookup, "PG_HOST", "");
        this.pgPort = intValue(lookup, "PG_PORT", DEFAULT_PG_PORT);
        this.pgDatabase = value(lookup, "PG_DATABASE", "binday");
        this.pgUser = value(lookup, "PG_USERNAME", "");
        this.pgPassword = value(lookup, "PG_PASSWORD", "");
        this.pgAppName = value(lookup, "PG_APPNAME", "binday-scraper");
        this.embeddedPgPort = intValue(lookup, "EMBEDDED_PG_PORT", DEFAULT_PG_PORT);
        this.embeddedPgDataDir = value(lookup, "EMBEDDED_PG_DATA_DIR", "scraped-data/pgdata");
        this.headless = Boolean.parseBoolean(value(lookup, "SCRAPER_HEADLESS", "true"));
        this.exportCsv = Boolean.parseBoolean(value(lookup, "SCRAPER_EXPORT_CSV", "true"));
        this.debug = Boolean.parseBoolean(value(lookup, "DEBUG", "false"));
    }

    /**
     * Reads configuration from the process environment, falling back to system properties.
     */
    public static ScraperConfig fromEnvironment() {
        return from(ScraperConfig::envOrProp);
    }

    /**
     * Reads configuration through an arbitrary key lookup (null means unset).
     */
    public static ScraperConfig from(Function<String, String> lookup) {
        return new ScraperConfig(lookup);
    }

    /**
     * True when an external PostgreSQL host is configured; otherwise an embedded instance is used.
     */
    public boolean usesExternalDatabase() {
        return !pgHost.isEmpty();
    }

    /**
     * JDBC URL for the external database.
     */
    public String jdbcUrl() {
        return String.format("jdbc:postgresql://%s:%d/%s?ApplicationName=%s", pgHost, pgPort, pgDatabase, pgAppName);
    }

    /**
     * Lists configuration problems that prevent a scrape run.
     * @return human-readable problems, empty when the configuration is usable
     */
    public List<String> validate() {
        List<String> problems = new ArrayList<>();
        if (postcode.isEmpty()) problems.add("POSTCODE environment variable is required");
        if (addressLine.isEmpty()) problems.add("ADDRESS_LINE environment variable is required");
        if (usesExternalDatabase()) {
            if (pgUser.isEmpty()) problems.add("PG_USERNAME environment variable is required when PG_HOST is set");
            if (pgPassword.isEmpty()) problems.add("PG_PASSWORD environment variable is required when PG_HOST is set");
        }
        return problems;
    }

    /**
     * Throws when {@link #validate()} reports any problem.
     * @throws IllegalStateException listing every problem
     */
    public void requireValid() {
        List<String> problems = validate();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Invalid configuration: " + String.join("; ", problems));
        }
    }

    @Override
    public String toString() {
        String db = usesExternalDatabase()
            ? pgHost + ":" + pgPort + "/" + pgDatabase
            : "embedded (port " + embeddedPgPort + ", " + embeddedPgDataDir + ")";
        return "ScraperConfig{postcode='" + postcode + "', address='" + addressLine + "', timezone='" + timezone
            + "', database=" + db + ", headless=" + headless + ", debug=" + debug + "}";
    }

    static String clean(String raw) {
        if (raw == null) return null;
        String s = raw.trim();
        while (!s.isEmpty() && (s.charAt(0) == '"' || s.charAt(0) == '\'')) s = s.substring(1);
        while (!s.isEmpty() && (s.charAt(s.length() - 1) == '"' || s.charAt(s.length() - 1) == '\'')) s = s.substring(0, s.length() - 1);
        return s.trim();
    }

    private static String value(Function<String, String> lookup, String key, String defaultVal) {
        String v = clean(lookup.apply(key));
        return v == null || v.isEmpty() ? defaultVal : v;
    }

    private static int intValue(Function<String, String> lookup, String key, int defaultVal) {
        String v = value(lookup, key, "");
        if (v.isEmpty()) return defaultVal;
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            logger.warn("Ignoring non-numeric {}='{}', using {}", key, v, defaultVal);
            return defaultVal;
        }
    }

    private static String envOrProp(String key) {
        String ev = System.getenv(key);
        if (ev != null) return ev;
        return System.getProperty(key);
    }
}
