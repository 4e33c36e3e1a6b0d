package io.stockingest.market;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import io.stockingest.core.BatchSink;
import io.stockingest.metrics.Metrics;
import io.stockingest.retry.Retrier;
import io.stockingest.retry.RetryPolicy;
import io.stockingest.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Upserts rows into {@code stock_data} in chunks of at most {@code batchSize}, one transaction per chunk.
 * Transient store failures are retried per chunk; a chunk that still fails aborts the remaining chunks of
 * this call and surfaces as a {@link StoreException}, or as a {@link PartialWriteException} when earlier chunks
 * were already committed. The schema is created on first use.
 */
public class JdbcStockRowSink implements BatchSink<StockRow> {
    private static final Logger log = LoggerFactory.getLogger(JdbcStockRowSink.class);

    private final StockDataDao dao;
    private final int batchSize;
    private final Retrier retrier;
    private final Counter rowsCounter;
    private final Counter batchesCounter;
    private final Counter retriesCounter;
    private final Timer storeTimer;
    private volatile boolean schemaReady;

    public JdbcStockRowSink(StockDataDao dao, int batchSize, RetryPolicy retryPolicy, Sleeper sleeper, Metrics metrics) {
        this.dao = Objects.requireNonNull(dao, "dao");
        this.batchSize = Math.max(1, batchSize);
        this.retrier = new Retrier(Objects.requireNonNull(retryPolicy, "retryPolicy"), sleeper, "store");
        this.rowsCounter = metrics.counter("store.rows.upserted");
        this.batchesCounter = metrics.counter("store.batches");
        this.retriesCounter = metrics.counter("store.retries");
        this.storeTimer = metrics.timer("store.time");
    }

    /** Retry policy predicate: only store failures flagged transient are retried. */
    public static boolean isRetryable(Exception e) {
        return e instanceof StoreException se && se.isTransient();
    }

    @Override
    public int acceptBatch(List<StockRow> rows) throws StoreException, InterruptedException {
        if (rows == null || rows.isEmpty()) return 0;
        ensureSchema();

        List<StockRow> unique = dedupe(rows);
        int total = 0;
        int chunks = (unique.size() + batchSize - 1) / batchSize;
        for (int i = 0, n = 1; i < unique.size(); i += batchSize, n++) {
            List<StockRow> chunk = unique.subList(i, Math.min(unique.size(), i + batchSize));
            try {
                total += writeChunk(chunk, n, chunks);
            } catch (StoreException e) {
                if (total == 0) throw e;
                log.error("Batch {}/{} for {} failed after {} rows were committed", n, chunks, chunk.get(0).symbol(), total);
                throw new PartialWriteException(total, e);
            }
        }
        log.info("Upserted {} rows for {} in {} batch(es)", total, unique.get(0).symbol(), chunks);
        return total;
    }

    private int writeChunk(List<StockRow> chunk, int n, int of) throws StoreException, InterruptedException {
        String symbol = chunk.get(0).symbol();
        try (Timer.Context ignored = storeTimer.time()) {
            int written = retrier.execute(attempt -> dao.upsertBatch(chunk), (attempt, backoff, cause) -> {
                retriesCounter.inc();
                log.warn("Store batch {}/{} for {} attempt {}/{} failed: {}; retrying in {} ms",
                        n, of, symbol, attempt, retrier.policy().maxAttempts(), cause.getMessage(), backoff);
            });
            batchesCounter.inc();
            rowsCounter.inc(written);
            log.debug("Upserted batch {}/{} for {} ({} rows)", n, of, symbol, written);
            return written;
        } catch (StoreException | InterruptedException e) {
            throw e;
        } catch (Exception e) {
            throw new StoreException("Unexpected error writing batch for " + symbol + ": " + e, e, false);
        }
    }

    private void ensureSchema() throws StoreException, InterruptedException {
        if (schemaReady) return;
        synchronized (this) {
            if (schemaReady) return;
            try {
                retrier.execute(attempt -> {
                    dao.ensureSchema();
                    return null;
                }, (attempt, backoff, cause) -> log.warn("Schema check attempt {} failed: {}", attempt, cause.getMessage()));
            } catch (StoreException | InterruptedException e) {
                throw e;
            } catch (Exception e) {
                throw new StoreException("Unexpected error ensuring schema: " + e, e, false);
            }
            schemaReady = true;
        }
    }

    /** Later rows win when two rows share a (symbol, ts) key. */
    static List<StockRow> dedupe(List<StockRow> rows) {
        Map<StockRow.Key, StockRow> byKey = new LinkedHashMap<>();
        for (StockRow r : rows) byKey.put(r.key(), r);
        if (byKey.size() != rows.size()) {
            log.debug("Collapsed {} duplicate keys before upsert", rows.size() - byKey.size());
        }
        return new ArrayList<>(byKey.values());
    }
}
