package io.stockingest.market;

import com.codahale.metrics.MetricRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.inject.AbstractModule;
import com.google.inject.Provides;
import com.google.inject.Singleton;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.stockingest.budget.ExternalCallBudget;
import io.stockingest.budget.MinIntervalCallBudget;
import io.stockingest.core.BatchSink;
import io.stockingest.metrics.Metrics;
import io.stockingest.retry.ExponentialBackoffRetryPolicy;
import io.stockingest.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.net.http.HttpClient;
import java.time.Clock;

public class IngestModule extends AbstractModule {
    private static final Logger log = LoggerFactory.getLogger(IngestModule.class);

    private final IngestConfig config;

    public IngestModule(IngestConfig config) { this.config = config; }

    @Override
    protected void configure() {
        bind(IngestConfig.class).toInstance(config);
        bind(Sleeper.class).toInstance(Sleeper.SYSTEM);
        bind(Clock.class).toInstance(Clock.systemUTC());
    }

    @Provides @Singleton MetricRegistry metricRegistry() { return new MetricRegistry(); }

    @Provides @Singleton Metrics metrics(MetricRegistry registry) { return new Metrics(registry); }

    @Provides @Singleton ObjectMapper objectMapper() { return new ObjectMapper(); }

    @Provides @Singleton HttpClient httpClient() {
        return HttpClient.newBuilder()
                .connectTimeout(config.httpTimeout())
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Provides @Singleton MarketDataClient marketDataClient(HttpClient http) {
        return new HttpMarketDataClient(http, config.apiBaseUrl(), config.apiFunction(), config.outputSize(), config.httpTimeout());
    }

    @Provides @Singleton ExternalCallBudget externalCallBudget(Clock clock, Sleeper sleeper) {
        return new MinIntervalCallBudget(config.politeDelay(), clock, sleeper);
    }

    @Provides @Singleton TimeSeriesFetcher fetcher(MarketDataClient client, ExternalCallBudget budget, Sleeper sleeper,
                                                   ObjectMapper mapper, Metrics metrics) {
        var retry = new ExponentialBackoffRetryPolicy(config.fetchMaxAttempts(), config.fetchBackoffBaseMillis(),
                config.fetchBackoffMaxMillis(), TimeSeriesFetcher::isRetryable, config.fetchBackoffJitter(), null);
        return new TimeSeriesFetcher(client, budget, retry, sleeper, mapper, metrics);
    }

    @Provides @Singleton TimeSeriesParser parser() { return new TimeSeriesParser(); }

    @Provides @Singleton DataSource dataSource() {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(config.dbUrl());
        hc.setUsername(config.dbUser());
        hc.setPassword(config.dbPassword());
        hc.setMaximumPoolSize(Math.max(1, config.dbPoolSize()));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(5000);
        // the database may still be starting; connection failures are handled per batch
        hc.setInitializationFailTimeout(-1);
        hc.setPoolName("stock-ingest-hikari");
        log.info("DB: url={}, user={}, pool={}", config.dbUrl(), config.dbUser(), config.dbPoolSize());
        return new HikariDataSource(hc);
    }

    @Provides @Singleton StockDataDao stockDataDao(DataSource dataSource) {
        return new StockDataDao(dataSource, config.dbQueryTimeoutSeconds());
    }

    @Provides @Singleton BatchSink<StockRow> sink(StockDataDao dao, Sleeper sleeper, Metrics metrics) {
        var retry = new ExponentialBackoffRetryPolicy(config.dbMaxAttempts(), config.dbBackoffBaseMillis(),
                config.dbBackoffBaseMillis() * 8, JdbcStockRowSink::isRetryable);
        return new JdbcStockRowSink(dao, config.dbBatchSize(), retry, sleeper, metrics);
    }

    @Provides @Singleton StockIngestJob job(TimeSeriesFetcher fetcher, TimeSeriesParser parser, BatchSink<StockRow> sink,
                                            Metrics metrics) {
        return new StockIngestJob(config.symbols(), config.apiKey(), fetcher, parser, sink, metrics);
    }
}
