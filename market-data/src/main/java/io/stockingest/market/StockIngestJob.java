package io.stockingest.market;

import com.codahale.metrics.Timer;
import io.stockingest.core.BatchSink;
import io.stockingest.metrics.Metrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Runs fetch, parse and upsert for each configured symbol in turn and folds the per-symbol outcomes into a
 * {@link RunResult}. A failing symbol is recorded and the run moves on; the run as a whole fails only when
 * no symbol wrote a row. {@link #cancel()} takes effect before the next symbol starts.
 */
public class StockIngestJob {
    private static final Logger log = LoggerFactory.getLogger(StockIngestJob.class);

    private final List<String> symbols;
    private final String apiKey;
    private final TimeSeriesFetcher fetcher;
    private final TimeSeriesParser parser;
    private final BatchSink<StockRow> sink;
    private final Metrics metrics;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);
    private volatile RunState state = RunState.IDLE;

    public StockIngestJob(List<String> symbols, String apiKey, TimeSeriesFetcher fetcher, TimeSeriesParser parser,
                          BatchSink<StockRow> sink, Metrics metrics) {
        this.symbols = SymbolListSource.normalize(symbols);
        this.apiKey = Objects.requireNonNull(apiKey, "apiKey");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.sink = Objects.requireNonNull(sink, "sink");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public RunState state() { return state; }

    public boolean isRunning() { return running.get(); }

    /** Asks a running job to stop before its next symbol. In-flight calls finish or time out on their own. */
    public void cancel() {
        if (running.get()) {
            log.warn("Cancellation requested");
            cancelRequested.set(true);
        }
    }

    public RunResult run() {
        if (!running.compareAndSet(false, true)) {
            throw new IllegalStateException("Run already in progress");
        }
        cancelRequested.set(false);
        try (Timer.Context ignored = metrics.timer("run.time").time()) {
            return doRun();
        } finally {
            running.set(false);
        }
    }

    private RunResult doRun() {
        List<SymbolOutcome> outcomes = new ArrayList<>();
        boolean cancelled = false;
        SymbolListSource source = new SymbolListSource(symbols);
        log.info("Starting run for {} symbol(s)", source.size());

        while (!source.isFinished()) {
            if (cancelRequested.get() || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                log.warn("Run cancelled after {}/{} symbols", source.position(), source.size());
                break;
            }
            String symbol = source.poll().orElseThrow();
            log.info("Processing symbol {} ({}/{})", symbol, source.position(), source.size());
            outcomes.add(runSymbol(symbol));
        }

        state = RunState.AGGREGATING;
        RunResult result = aggregate(outcomes, cancelled, source.size());
        state = result.succeeded() ? RunState.SUCCEEDED : RunState.FAILED;
        if (!result.succeeded()) metrics.counter("run.failed").inc();
        metrics.reportTo(log);
        return result;
    }

    private SymbolOutcome runSymbol(String symbol) {
        SymbolOutcome.Stage stage = SymbolOutcome.Stage.FETCH;
        int skipped = 0;
        try {
            state = RunState.FETCHING;
            RawTimeSeriesResponse raw = fetcher.fetch(symbol, apiKey);

            stage = SymbolOutcome.Stage.PARSE;
            state = RunState.PARSING;
            ParsedSeries parsed = parser.parse(symbol, raw);
            List<StockRow> rows = parsed.toList();
            for (SkippedEntry s : parsed.skipped()) {
                log.warn("Skipping {} entry '{}': {}", symbol, s.dateKey(), s.reason());
            }
            skipped = parsed.skippedCount();
            metrics.counter("parse.rows").inc(rows.size());
            metrics.counter("parse.skipped").inc(skipped);
            log.info("Parsed {} rows for {} ({} skipped)", rows.size(), symbol, skipped);

            stage = SymbolOutcome.Stage.WRITE;
            state = RunState.WRITING;
            int written = rows.isEmpty() ? 0 : sink.acceptBatch(rows);
            return SymbolOutcome.ok(symbol, written, skipped);
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            cancelRequested.set(true);
            log.warn("Interrupted while processing {} ({})", symbol, stage);
            return SymbolOutcome.failed(symbol, stage, skipped, "interrupted");
        } catch (PartialWriteException e) {
            log.error("WRITE failed for {} after {} rows were committed: {}", symbol, e.rowsCommitted(), e.getMessage());
            return SymbolOutcome.failed(symbol, stage, e.rowsCommitted(), skipped, e.getMessage());
        } catch (IngestException e) {
            log.error("{} failed for {}: {}", stage, symbol, e.getMessage());
            return SymbolOutcome.failed(symbol, stage, skipped, e.getMessage());
        } catch (Exception e) {
            log.error("Unexpected {} failure for {}", stage, symbol, e);
            return SymbolOutcome.failed(symbol, stage, skipped, e.toString());
        }
    }

    static RunResult aggregate(List<SymbolOutcome> outcomes, boolean cancelled, int planned) {
        int written = 0;
        int skipped = 0;
        List<String> warnings = new ArrayList<>();
        for (SymbolOutcome o : outcomes) {
            written += o.rowsWritten();
            skipped += o.rowsSkipped();
            if (!o.succeeded()) {
                warnings.add(o.symbol() + ": " + o.failedStage().name().toLowerCase(Locale.ROOT) + " failed: " + o.error());
            } else if (o.rowsWritten() == 0) {
                warnings.add(o.symbol() + ": no rows written");
            }
            if (o.rowsSkipped() > 0) {
                warnings.add(o.symbol() + ": skipped " + o.rowsSkipped() + " malformed entr" + (o.rowsSkipped() == 1 ? "y" : "ies"));
            }
        }

        RunStatus status;
        if (cancelled) {
            status = RunStatus.CANCELLED;
            warnings.add("run cancelled after " + outcomes.size() + " of " + planned + " symbols");
        } else if (written == 0) {
            status = RunStatus.FAILED;
        } else {
            status = RunStatus.SUCCEEDED;
        }

        for (String w : warnings) log.warn(w);
        if (status == RunStatus.SUCCEEDED) {
            log.info("Run succeeded: {} rows written, {} skipped, {} warning(s)", written, skipped, warnings.size());
        } else {
            log.error("Run {}: {} rows written across {} symbol(s)", status, written, outcomes.size());
        }
        return new RunResult(status == RunStatus.SUCCEEDED, written, warnings, skipped, status, outcomes);
    }
}
