package io.floorsheet.data;

import java.net.URI;
import java.nio.file.Path;
import java.time.Duration;

/**
 * Settings for one invocation. {@link #fromEnv()} reads each value from a {@code floorsheet.*} system
 * property, then a {@code FLOORSHEET_*} environment variable, then the default; command line options
 * override the result through the {@code with*} copies.
 */
public record FloorsheetConfig(
        URI baseUrl,
        Path rawPath,
        Path datePath,
        Path globalPath,
        int retentionDays,
        int maxPages,
        long minPageDelayMillis,
        long maxPageDelayMillis,
        Duration httpTimeout
) {
    public static final int DEFAULT_RETENTION_DAYS = 365;

    public static FloorsheetConfig fromEnv() {
        URI base = URI.create(value("floorsheet.base.url", "FLOORSHEET_BASE_URL", "https://merolagani.com/Floorsheet.aspx"));
        Path raw = Path.of(value("floorsheet.raw", "FLOORSHEET_RAW", "public/raw_floorsheet.csv"));
        Path date = Path.of(value("floorsheet.date", "FLOORSHEET_DATE", "public/date_summarized_floorsheet.csv"));
        Path global = Path.of(value("floorsheet.global", "FLOORSHEET_GLOBAL", "public/summarized_floorsheet.csv"));
        int retention = Integer.parseInt(value("floorsheet.retention.days", "FLOORSHEET_RETENTION_DAYS", String.valueOf(DEFAULT_RETENTION_DAYS)));
        int maxPages = Integer.parseInt(value("floorsheet.max.pages", "FLOORSHEET_MAX_PAGES", "0"));
        long minDelay = Long.parseLong(value("floorsheet.delay.min", "FLOORSHEET_DELAY_MIN", "1000"));
        long maxDelay = Long.parseLong(value("floorsheet.delay.max", "FLOORSHEET_DELAY_MAX", "3000"));
        long timeout = Long.parseLong(value("floorsheet.http.timeout", "FLOORSHEET_HTTP_TIMEOUT", "30000"));
        return new FloorsheetConfig(base, raw, date, global, retention, maxPages, minDelay, maxDelay, Duration.ofMillis(timeout));
    }

    private static String value(String property, String env, String def) {
        return System.getProperty(property, System.getenv().getOrDefault(env, def));
    }

    /** Dead-letter file for rows that could not be parsed, next to the raw table. */
    public Path deadLetterPath() {
        return rawPath.resolveSibling("dlq_floorsheet.jsonl");
    }

    public FloorsheetConfig withRawPath(Path p) {
        return new FloorsheetConfig(baseUrl, p, datePath, globalPath, retentionDays, maxPages, minPageDelayMillis, maxPageDelayMillis, httpTimeout);
    }

    public FloorsheetConfig withDatePath(Path p) {
        return new FloorsheetConfig(baseUrl, rawPath, p, globalPath, retentionDays, maxPages, minPageDelayMillis, maxPageDelayMillis, httpTimeout);
    }

    public FloorsheetConfig withGlobalPath(Path p) {
        return new FloorsheetConfig(baseUrl, rawPath, datePath, p, retentionDays, maxPages, minPageDelayMillis, maxPageDelayMillis, httpTimeout);
    }

    public FloorsheetConfig withRetentionDays(int days) {
        return new FloorsheetConfig(baseUrl, rawPath, datePath, globalPath, days, maxPages, minPageDelayMillis, maxPageDelayMillis, httpTimeout);
    }

    public FloorsheetConfig withMaxPages(int pages) {
        return new FloorsheetConfig(baseUrl, rawPath, datePath, globalPath, retentionDays, pages, minPageDelayMillis, maxPageDelayMillis, httpTimeout);
    }
}
