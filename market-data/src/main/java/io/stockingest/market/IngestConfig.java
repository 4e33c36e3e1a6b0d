package io.stockingest.market;

import io.stockingest.config.ConfigLookup;

import java.time.Duration;
import java.util.List;

/**
 * Settings for one process, read once at start-up. Each value comes from a system property, then an
 * environment variable, then a default.
 */
public record IngestConfig(
        String apiKey,
        List<String> symbols,
        String scheduleCron,
        double politeDelaySeconds,
        String dbUrl,
        String dbUser,
        String dbPassword,
        String apiBaseUrl,
        String apiFunction,
        String outputSize,
        int httpTimeoutSeconds,
        int fetchMaxAttempts,
        double fetchBackoffBaseSeconds,
        double fetchBackoffMaxSeconds,
        double fetchBackoffJitter,
        int dbBatchSize,
        int dbMaxAttempts,
        double dbBackoffBaseSeconds,
        int dbPoolSize,
        int dbQueryTimeoutSeconds
) {
    public IngestConfig {
        symbols = SymbolListSource.normalize(symbols);
    }

    public static IngestConfig fromEnv() {
        return from(new ConfigLookup());
    }

    public static IngestConfig from(ConfigLookup c) {
        String host = c.get("stockingest.db.host", "POSTGRES_HOST", "postgres");
        String port = c.get("stockingest.db.port", "POSTGRES_PORT", "5432");
        String db = c.get("stockingest.db.name", "POSTGRES_DB", "stock_db");
        String defaultUrl = "jdbc:postgresql://" + host + ":" + port + "/" + db + "?reWriteBatchedInserts=true";
        return new IngestConfig(
                c.get("stockingest.apiKey", "API_KEY", null),
                c.getList("stockingest.symbols", "STOCK_SYMBOLS", "AAPL"),
                c.get("stockingest.cron", "DAG_SCHEDULE_CRON", "0 6 * * *"),
                c.getDouble("stockingest.politeDelaySec", "API_POLITE_DELAY_SEC", 12.0),
                c.get("stockingest.db.url", "DB_URL", defaultUrl),
                c.get("stockingest.db.user", "POSTGRES_USER", "stock_user"),
                c.get("stockingest.db.password", "POSTGRES_PASSWORD", "stock_pass"),
                c.get("stockingest.api.baseUrl", "API_BASE_URL", "https://www.alphavantage.co/query"),
                c.get("stockingest.api.function", "API_FUNCTION", "TIME_SERIES_DAILY_ADJUSTED"),
                c.get("stockingest.api.outputSize", "API_OUTPUT_SIZE", "compact"),
                c.getInt("stockingest.fetch.timeoutSec", "FETCH_TIMEOUT", 15),
                c.getInt("stockingest.fetch.maxRetries", "FETCH_MAX_RETRIES", 5),
                c.getDouble("stockingest.fetch.backoffBase", "FETCH_BACKOFF_BASE", 1.0),
                c.getDouble("stockingest.fetch.backoffMax", "FETCH_BACKOFF_MAX", 60.0),
                c.getDouble("stockingest.fetch.jitter", "FETCH_BACKOFF_JITTER", 0.2),
                c.getInt("stockingest.db.batchSize", "DB_BATCH_SIZE", 200),
                c.getInt("stockingest.db.maxRetries", "DB_MAX_RETRIES", 3),
                c.getDouble("stockingest.db.backoffBase", "DB_BACKOFF_BASE", 1.0),
                c.getInt("stockingest.db.poolSize", "DB_POOL_SIZE", 5),
                c.getInt("stockingest.db.queryTimeoutSec", "DB_QUERY_TIMEOUT", 30));
    }

    /** @throws IllegalStateException when the configuration cannot drive a run */
    public IngestConfig validate() {
        if (apiKey == null || apiKey.isBlank()) throw new IllegalStateException("API_KEY not set");
        if (symbols.isEmpty()) throw new IllegalStateException("No STOCK_SYMBOLS configured");
        if (politeDelaySeconds < 0) throw new IllegalStateException("API_POLITE_DELAY_SEC must not be negative");
        if (fetchMaxAttempts < 1 || dbMaxAttempts < 1) throw new IllegalStateException("Retry counts must be at least 1");
        if (dbBatchSize < 1) throw new IllegalStateException("DB_BATCH_SIZE must be at least 1");
        DailySchedule.parse(scheduleCron);
        return this;
    }

    public IngestConfig withSymbols(List<String> override) {
        return new IngestConfig(apiKey, override, scheduleCron, politeDelaySeconds, dbUrl, dbUser, dbPassword,
                apiBaseUrl, apiFunction, outputSize, httpTimeoutSeconds, fetchMaxAttempts, fetchBackoffBaseSeconds,
                fetchBackoffMaxSeconds, fetchBackoffJitter, dbBatchSize, dbMaxAttempts, dbBackoffBaseSeconds,
                dbPoolSize, dbQueryTimeoutSeconds);
    }

    public Duration politeDelay() { return seconds(politeDelaySeconds); }
    public Duration httpTimeout() { return Duration.ofSeconds(httpTimeoutSeconds); }
    public long fetchBackoffBaseMillis() { return seconds(fetchBackoffBaseSeconds).toMillis(); }
    public long fetchBackoffMaxMillis() { return seconds(fetchBackoffMaxSeconds).toMillis(); }
    public long dbBackoffBaseMillis() { return seconds(dbBackoffBaseSeconds).toMillis(); }

    private static Duration seconds(double s) {
        return Duration.ofMillis(Math.round(s * 1000));
    }

    @Override
    public String toString() {
        return "IngestConfig{symbols=" + symbols + ", cron='" + scheduleCron + "', politeDelaySeconds=" + politeDelaySeconds
                + ", dbUrl='" + dbUrl + "', dbUser='" + dbUser + "', apiBaseUrl='" + apiBaseUrl + "', function='" + apiFunction
                + "', fetchMaxAttempts=" + fetchMaxAttempts + ", dbBatchSize=" + dbBatchSize + ", apiKey=" + (apiKey == null ? "<unset>" : "***") + "}";
    }
}
