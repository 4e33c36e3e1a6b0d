package io.stockingest.market;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.Locale;

/**
 * DDL and insert-or-replace text for the databases the writer runs against. PostgreSQL is the production
 * store; H2 backs the test suite.
 */
public enum SqlDialect {
    POSTGRES(
            """
            CREATE TABLE IF NOT EXISTS stock_data (
                id SERIAL PRIMARY KEY,
                symbol TEXT NOT NULL,
                ts TIMESTAMP WITH TIME ZONE NOT NULL,
                open NUMERIC,
                high NUMERIC,
                low NUMERIC,
                close NUMERIC,
                volume BIGINT,
                raw JSONB,
                UNIQUE (symbol, ts)
            )
            """,
            """
            INSERT INTO stock_data (symbol, ts, open, high, low, close, volume, raw)
            VALUES (?, ?, ?, ?, ?, ?, ?, CAST(? AS JSONB))
            ON CONFLICT (symbol, ts) DO UPDATE
              SET open = EXCLUDED.open,
                  high = EXCLUDED.high,
                  low = EXCLUDED.low,
                  close = EXCLUDED.close,
                  volume = EXCLUDED.volume,
                  raw = EXCLUDED.raw
            """),
    H2(
            """
            CREATE TABLE IF NOT EXISTS stock_data (
                id BIGINT AUTO_INCREMENT PRIMARY KEY,
                symbol VARCHAR NOT NULL,
                ts TIMESTAMP WITH TIME ZONE NOT NULL,
                open NUMERIC(24, 8),
                high NUMERIC(24, 8),
                low NUMERIC(24, 8),
                close NUMERIC(24, 8),
                volume BIGINT,
                raw VARCHAR,
                UNIQUE (symbol, ts)
            )
            """,
            """
            MERGE INTO stock_data (symbol, ts, open, high, low, close, volume, raw)
            KEY (symbol, ts)
            VALUES (?, ?, ?, ?, ?, ?, ?, ?)
            """);

    private final String createTableSql;
    private final String upsertSql;

    SqlDialect(String createTableSql, String upsertSql) {
        this.createTableSql = createTableSql;
        this.upsertSql = upsertSql;
    }

    public String createTableSql() { return createTableSql; }

    /** Parameters: symbol, ts, open, high, low, close, volume, raw. */
    public String upsertSql() { return upsertSql; }

    public static SqlDialect detect(Connection c) throws SQLException {
        String product = c.getMetaData().getDatabaseProductName();
        String p = product == null ? "" : product.toLowerCase(Locale.ROOT);
        if (p.contains("postgres")) return POSTGRES;
        if (p.equals("h2")) return H2;
        throw new SQLException("Unsupported database: " + product, "0A000");
    }
}
