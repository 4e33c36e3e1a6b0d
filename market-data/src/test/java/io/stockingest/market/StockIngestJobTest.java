package io.stockingest.market;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stockingest.budget.ExternalCallBudget;
import io.stockingest.core.BatchSink;
import io.stockingest.metrics.Metrics;
import io.stockingest.retry.ExponentialBackoffRetryPolicy;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class StockIngestJobTest {
    final Map<String, Deque<ProviderResponse>> replies = new HashMap<>();
    final List<Long> sleeps = new ArrayList<>();
    Metrics metrics;
    JdbcDataSource db;
    StockDataDao dao;
    MarketDataClient client;

    @BeforeEach
    void setUp() {
        metrics = new Metrics(new MetricRegistry());
        db = H2Support.freshDatabase();
        dao = new StockDataDao(db, 5);
        client = (symbol, apiKey) -> {
            Deque<ProviderResponse> q = replies.get(symbol);
            ProviderResponse next = q == null ? null : q.poll();
            return next == null ? new ProviderResponse(200, Fixtures.errorMessage()) : next;
        };
    }

    private void reply(String symbol, String body) {
        replies.computeIfAbsent(symbol, s -> new ArrayDeque<>()).add(new ProviderResponse(200, body));
    }

    private TimeSeriesFetcher fetcher() {
        var policy = new ExponentialBackoffRetryPolicy(3, 100, 1_000, TimeSeriesFetcher::isRetryable);
        return new TimeSeriesFetcher(client, ExternalCallBudget.UNLIMITED, policy, sleeps::add, new ObjectMapper(), metrics);
    }

    private BatchSink<StockRow> jdbcSink() {
        return jdbcSink(200);
    }

    private BatchSink<StockRow> jdbcSink(int batchSize) {
        var policy = new ExponentialBackoffRetryPolicy(3, 50, 400, JdbcStockRowSink::isRetryable);
        return new JdbcStockRowSink(dao, batchSize, policy, sleeps::add, metrics);
    }

    private StockIngestJob job(List<String> symbols, BatchSink<StockRow> sink) {
        return new StockIngestJob(symbols, "demo", fetcher(), new TimeSeriesParser(), sink, metrics);
    }

    private static String closeOn(String day, String close) {
        return Fixtures.series(Map.of(day, Fixtures.entry("184.0", "186.0", "183.0", close, "1000")));
    }

    @Test
    void rerun_with_same_data_leaves_one_row() throws Exception {
        reply("AAPL", closeOn("2024-01-02", "185.0"));
        reply("AAPL", closeOn("2024-01-02", "185.0"));
        StockIngestJob job = job(List.of("AAPL"), jdbcSink());

        RunResult first = job.run();
        RunResult second = job.run();

        assertTrue(first.succeeded());
        assertTrue(second.succeeded());
        assertEquals(1, first.rowsWritten());
        assertEquals(1, dao.count());
        assertEquals(RunState.SUCCEEDED, job.state());
    }

    @Test
    void later_run_overwrites_values() throws Exception {
        reply("AAPL", closeOn("2024-01-02", "185.0"));
        reply("AAPL", closeOn("2024-01-02", "186.5"));
        StockIngestJob job = job(List.of("AAPL"), jdbcSink());

        job.run();
        job.run();

        List<StockRow> rows = dao.findBySymbol("AAPL");
        assertEquals(1, rows.size());
        assertEquals(0, new BigDecimal("186.5").compareTo(rows.get(0).close()));
    }

    @Test
    void tolerates_partially_populated_entries() throws Exception {
        Map<String, String> entries = Fixtures.days(LocalDate.of(2024, 1, 1), 10, "50.0");
        entries.put("2024-01-11", Fixtures.entry("10.0", "11.0", "9.0", null, "10"));
        entries.put("2024-01-12", Fixtures.entry(null, null, null, "51.0", null));
        reply("MSFT", Fixtures.series(entries));

        RunResult result = job(List.of("MSFT"), jdbcSink()).run();

        assertTrue(result.succeeded());
        assertEquals(12, result.rowsWritten());
        assertEquals(0, result.rowsSkipped());
        assertTrue(result.warnings().isEmpty(), result.warnings().toString());
        assertEquals(12, dao.count());
    }

    @Test
    void structurally_bad_entries_are_reported_as_warnings() {
        Map<String, String> entries = Fixtures.days(LocalDate.of(2024, 1, 1), 2, "50.0");
        entries.put("yesterday", Fixtures.entry("1", "1", "1", "1", "1"));
        reply("IBM", Fixtures.series(entries));

        RunResult result = job(List.of("IBM"), jdbcSink()).run();

        assertTrue(result.succeeded());
        assertEquals(2, result.rowsWritten());
        assertEquals(1, result.rowsSkipped());
        assertEquals(List.of("IBM: skipped 1 malformed entry"), result.warnings());
        assertEquals(1, metrics.count("parse.skipped"));
    }

    @Test
    void run_fails_when_no_symbol_produces_data() {
        StockIngestJob job = job(List.of("BAD1", "BAD2"), jdbcSink());

        RunResult result = job.run();

        assertFalse(result.succeeded());
        assertEquals(0, result.rowsWritten());
        assertEquals(RunStatus.FAILED, result.status());
        assertEquals(2, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("BAD1: fetch failed: Provider error for BAD1"), result.warnings().get(0));
        assertEquals(RunState.FAILED, job.state());
        assertEquals(1, metrics.count("run.failed"));
    }

    @Test
    void run_fails_when_every_fetch_exhausts_its_retries() {
        for (int i = 0; i < 3; i++) {
            reply("AAPL", Fixtures.rateLimitNote());
            replies.computeIfAbsent("MSFT", s -> new ArrayDeque<>()).add(new ProviderResponse(503, "unavailable"));
        }

        RunResult result = job(List.of("AAPL", "MSFT"), jdbcSink()).run();

        assertFalse(result.succeeded());
        assertEquals(0, result.rowsWritten());
        assertEquals(RunStatus.FAILED, result.status());
        assertTrue(result.warnings().get(0).startsWith("AAPL: fetch failed: Exhausted 3 attempts fetching AAPL"), result.warnings().get(0));
        assertTrue(result.warnings().get(1).startsWith("MSFT: fetch failed: Exhausted 3 attempts fetching MSFT"), result.warnings().get(1));
        assertEquals(List.of(100L, 200L, 100L, 200L), sleeps);
        assertEquals(6, metrics.count("fetch.attempts"));
    }

    @Test
    void rows_committed_before_a_failed_chunk_still_count() throws Exception {
        JdbcStockRowSinkTest.createTableWithVolumeLimit(db);
        Map<String, String> entries = new LinkedHashMap<>();
        entries.put("2024-01-02", Fixtures.entry("10.0", "11.0", "9.0", "10.5", "1000"));
        entries.put("2024-01-03", Fixtures.entry("10.0", "11.0", "9.0", "10.7", "5000000"));
        reply("TSLA", Fixtures.series(entries));

        RunResult result = job(List.of("TSLA"), jdbcSink(1)).run();

        assertEquals(1, dao.count());
        assertEquals(1, result.rowsWritten());
        assertTrue(result.succeeded());
        assertEquals(RunStatus.SUCCEEDED, result.status());
        SymbolOutcome tsla = result.outcomes().get(0);
        assertEquals(SymbolOutcome.Stage.WRITE, tsla.failedStage());
        assertEquals(1, tsla.rowsWritten());
        assertTrue(result.warnings().get(0).startsWith("TSLA: write failed:"), result.warnings().get(0));
        assertTrue(result.warnings().get(0).endsWith("(1 rows already committed)"), result.warnings().get(0));
    }

    @Test
    void rate_limited_symbol_succeeds_after_backoff() throws Exception {
        reply("AAPL", Fixtures.rateLimitNote());
        reply("AAPL", closeOn("2024-01-02", "185.0"));

        RunResult result = job(List.of("AAPL"), jdbcSink()).run();

        assertTrue(result.succeeded());
        assertEquals(1, result.rowsWritten());
        assertFalse(sleeps.isEmpty());
        assertEquals(1, metrics.count("fetch.rateLimited"));
    }

    @Test
    void one_failing_symbol_does_not_stop_the_others() throws Exception {
        reply("AAPL", closeOn("2024-01-02", "185.0"));
        reply("WEIRD", "{\"unexpected\":true}");
        reply("MSFT", closeOn("2024-01-02", "370.0"));

        RunResult result = job(List.of("AAPL", "WEIRD", "MSFT"), jdbcSink()).run();

        assertTrue(result.succeeded());
        assertEquals(2, result.rowsWritten());
        assertEquals(1, result.warnings().size());
        assertTrue(result.warnings().get(0).startsWith("WEIRD: parse failed:"), result.warnings().get(0));
        SymbolOutcome weird = result.outcomes().get(1);
        assertEquals(SymbolOutcome.Stage.PARSE, weird.failedStage());
        assertEquals(2, dao.count());
    }

    @Test
    void write_failure_is_recorded_per_symbol() {
        reply("AAPL", closeOn("2024-01-02", "185.0"));
        reply("MSFT", closeOn("2024-01-02", "370.0"));
        BatchSink<StockRow> sink = rows -> {
            if (rows.get(0).symbol().equals("MSFT")) {
                throw new StoreException("disk full", null, false);
            }
            return rows.size();
        };

        RunResult result = job(List.of("AAPL", "MSFT"), sink).run();

        assertTrue(result.succeeded());
        assertEquals(1, result.rowsWritten());
        assertEquals(List.of("MSFT: write failed: disk full"), result.warnings());
    }

    @Test
    void empty_series_counts_as_no_rows_written() {
        reply("AAPL", closeOn("2024-01-02", "185.0"));
        reply("NEW", "{\"Time Series (Daily)\":{}}");

        RunResult result = job(List.of("AAPL", "NEW"), jdbcSink()).run();

        assertTrue(result.succeeded());
        assertEquals(List.of("NEW: no rows written"), result.warnings());
    }

    @Test
    void cancel_stops_before_the_next_symbol() {
        AtomicReference<StockIngestJob> ref = new AtomicReference<>();
        client = (symbol, apiKey) -> {
            ref.get().cancel();
            return new ProviderResponse(200, closeOn("2024-01-02", "1.0"));
        };
        StockIngestJob job = job(List.of("AAPL", "MSFT", "IBM"), jdbcSink());
        ref.set(job);

        RunResult result = job.run();

        assertFalse(result.succeeded());
        assertEquals(RunStatus.CANCELLED, result.status());
        assertEquals(1, result.outcomes().size());
        assertEquals(1, result.rowsWritten());
        assertTrue(result.warnings().contains("run cancelled after 1 of 3 symbols"), result.warnings().toString());
        assertEquals(RunState.FAILED, job.state());
        assertFalse(job.isRunning());
    }

    @Test
    void cancel_outside_a_run_is_ignored() {
        reply("AAPL", closeOn("2024-01-02", "185.0"));
        StockIngestJob job = job(List.of("AAPL"), jdbcSink());
        job.cancel();

        assertTrue(job.run().succeeded());
    }
}
