package io.stockingest.market;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.OffsetDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JDBC access to {@code stock_data}. Each call borrows its own connection from the pool.
 */
public class StockDataDao {
    private static final Logger log = LoggerFactory.getLogger(StockDataDao.class);

    private final DataSource dataSource;
    private final int queryTimeoutSeconds;
    private volatile SqlDialect dialect;

    public StockDataDao(DataSource dataSource, int queryTimeoutSeconds) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.queryTimeoutSeconds = Math.max(0, queryTimeoutSeconds);
    }

    /** Creates the table and its unique key when absent. Safe to call repeatedly. */
    public void ensureSchema() throws StoreException {
        try (Connection c = dataSource.getConnection();
             Statement s = c.createStatement()) {
            s.setQueryTimeout(queryTimeoutSeconds);
            s.execute(dialect(c).createTableSql());
            log.debug("stock_data schema ensured ({})", dialect);
        } catch (SQLException e) {
            throw StoreException.from("Failed to ensure stock_data schema", e);
        }
    }

    /**
     * Inserts or replaces every row in a single transaction; either all rows are applied or none.
     *
     * @return number of rows sent
     */
    public int upsertBatch(List<StockRow> rows) throws StoreException {
        if (rows == null || rows.isEmpty()) return 0;
        try (Connection c = dataSource.getConnection()) {
            boolean autoCommit = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(dialect(c).upsertSql())) {
                ps.setQueryTimeout(queryTimeoutSeconds);
                for (StockRow r : rows) {
                    ps.setString(1, r.symbol());
                    ps.setObject(2, r.ts());
                    ps.setBigDecimal(3, r.open());
                    ps.setBigDecimal(4, r.high());
                    ps.setBigDecimal(5, r.low());
                    ps.setBigDecimal(6, r.close());
                    if (r.volume() == null) ps.setNull(7, Types.BIGINT); else ps.setLong(7, r.volume());
                    ps.setString(8, r.raw());
                    ps.addBatch();
                }
                ps.executeBatch();
                c.commit();
            } catch (SQLException e) {
                rollbackQuietly(c, e);
                throw e;
            } finally {
                restoreAutoCommit(c, autoCommit);
            }
            return rows.size();
        } catch (SQLException e) {
            throw StoreException.from("Failed to upsert " + rows.size() + " rows for " + rows.get(0).symbol(), e);
        }
    }

    public List<StockRow> findBySymbol(String symbol) throws StoreException {
        String sql = "SELECT symbol, ts, open, high, low, close, volume, raw FROM stock_data WHERE symbol = ? ORDER BY ts ASC";
        List<StockRow> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setQueryTimeout(queryTimeoutSeconds);
            ps.setString(1, symbol);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long vol = rs.getLong("volume");
                    Long volume = rs.wasNull() ? null : vol;
                    out.add(new StockRow(
                            rs.getString("symbol"),
                            rs.getObject("ts", OffsetDateTime.class),
                            rs.getBigDecimal("open"),
                            rs.getBigDecimal("high"),
                            rs.getBigDecimal("low"),
                            rs.getBigDecimal("close"),
                            volume,
                            rs.getString("raw")));
                }
            }
        } catch (SQLException e) {
            throw StoreException.from("Failed to read rows for " + symbol, e);
        }
        return out;
    }

    public long count() throws StoreException {
        try (Connection c = dataSource.getConnection();
             Statement s = c.createStatement();
             ResultSet rs = s.executeQuery("SELECT COUNT(*) FROM stock_data")) {
            rs.next();
            return rs.getLong(1);
        } catch (SQLException e) {
            throw StoreException.from("Failed to count stock_data", e);
        }
    }

    private SqlDialect dialect(Connection c) throws SQLException {
        SqlDialect d = dialect;
        if (d == null) {
            d = SqlDialect.detect(c);
            dialect = d;
        }
        return d;
    }

    private static void rollbackQuietly(Connection c, SQLException cause) {
        try {
            c.rollback();
        } catch (SQLException re) {
            cause.addSuppressed(re);
        }
    }

    private static void restoreAutoCommit(Connection c, boolean autoCommit) {
        try {
            c.setAutoCommit(autoCommit);
        } catch (SQLException e) {
            log.debug("Could not restore autocommit: {}", e.getMessage());
        }
    }
}
