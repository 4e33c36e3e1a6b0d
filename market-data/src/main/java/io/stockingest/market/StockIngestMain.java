package io.stockingest.market;

import com.google.inject.Guice;
import com.google.inject.Injector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;

import javax.sql.DataSource;
import java.io.Closeable;
import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * Runs the ingestion job once (default) or on its daily schedule. The exit code of a single run tells the
 * invoking scheduler whether it succeeded.
 */
@CommandLine.Command(name = "stock-ingest", mixinStandardHelpOptions = true,
        description = "Fetch daily stock time series and upsert them into Postgres")
public final class StockIngestMain implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(StockIngestMain.class);

    static final int EXIT_OK = 0;
    static final int EXIT_RUN_FAILED = 1;
    static final int EXIT_CONFIG = 2;

    static final Duration SHUTDOWN_GRACE = Duration.ofMinutes(2);

    @CommandLine.Option(names = {"-s", "--symbols"}, split = ",", description = "Tickers overriding STOCK_SYMBOLS")
    List<String> symbols = new ArrayList<>();

    @CommandLine.Option(names = "--schedule", description = "Stay running and trigger on the configured daily cron (UTC)")
    boolean schedule;

    public static void main(String[] args) {
        int code = new CommandLine(new StockIngestMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        IngestConfig config;
        DailySchedule daily;
        try {
            config = IngestConfig.fromEnv();
            if (!symbols.isEmpty()) config = config.withSymbols(symbols);
            config.validate();
            daily = DailySchedule.parse(config.scheduleCron());
        } catch (IllegalStateException | IllegalArgumentException e) {
            log.error("Invalid configuration: {}", e.getMessage());
            return EXIT_CONFIG;
        }
        log.info("Starting with {}", config);

        Injector injector = Guice.createInjector(new IngestModule(config));
        StockIngestJob job = injector.getInstance(StockIngestJob.class);
        DataSource dataSource = injector.getInstance(DataSource.class);
        // counted down once the run has returned and the pool is closed; shutdown hooks wait on it
        CountDownLatch finished = new CountDownLatch(1);
        try {
            if (!schedule) {
                Runtime.getRuntime().addShutdownHook(shutdownHook(job, () -> {}, finished, SHUTDOWN_GRACE));
                RunResult result = job.run();
                return result.succeeded() ? EXIT_OK : EXIT_RUN_FAILED;
            }
            ScheduledThreadPoolExecutor exec = new ScheduledThreadPoolExecutor(1, r -> new Thread(r, "stock-ingest-scheduler"));
            // shutdown drops the pending trigger but lets a run in progress finish
            exec.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
            CountDownLatch stopped = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(shutdownHook(job, () -> {
                exec.shutdown();
                stopped.countDown();
            }, finished, SHUTDOWN_GRACE));
            runScheduled(exec, stopped, job, daily, injector.getInstance(Clock.class));
            return EXIT_OK;
        } finally {
            closeQuietly(dataSource);
            finished.countDown();
        }
    }

    /**
     * Cancels the job, runs {@code stop}, then blocks until {@code finished} is counted down or {@code grace}
     * elapses. The JVM halts when the hook returns, so the symbol in flight must complete first.
     */
    static Thread shutdownHook(StockIngestJob job, Runnable stop, CountDownLatch finished, Duration grace) {
        return new Thread(() -> {
            log.info("Shutdown requested; letting the current symbol finish");
            job.cancel();
            stop.run();
            try {
                if (!finished.await(grace.toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Run still active after {}; exiting anyway", grace);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "stock-ingest-shutdown");
    }

    private static void runScheduled(ScheduledExecutorService exec, CountDownLatch stopped, StockIngestJob job,
                                     DailySchedule daily, Clock clock) throws InterruptedException {
        Runnable[] tick = new Runnable[1];
        tick[0] = () -> {
            try {
                RunResult r = job.run();
                log.info("Scheduled run finished: succeeded={} rowsWritten={} warnings={}", r.succeeded(), r.rowsWritten(), r.warnings().size());
            } catch (RuntimeException e) {
                log.error("Scheduled run crashed", e);
            }
            scheduleNext(exec, daily, clock, tick[0]);
        };
        scheduleNext(exec, daily, clock, tick[0]);
        stopped.await();
        if (!exec.awaitTermination(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
            log.warn("Scheduled run did not finish within {}", SHUTDOWN_GRACE);
        }
    }

    /** @return false when the executor has been shut down and no further run was scheduled */
    static boolean scheduleNext(ScheduledExecutorService exec, DailySchedule daily, Clock clock, Runnable task) {
        Duration wait = daily.untilNext(clock);
        try {
            exec.schedule(task, wait.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            log.info("Scheduler stopped; no further runs");
            return false;
        }
        log.info("Next run at {} (in {})", clock.instant().plus(wait), wait);
        return true;
    }

    private static void closeQuietly(DataSource dataSource) {
        if (dataSource instanceof Closeable c) {
            try {
                c.close();
            } catch (IOException e) {
                log.warn("Failed to close data source: {}", e.getMessage());
            }
        }
    }
}
