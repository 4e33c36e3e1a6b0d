package io.stockingest.market;

import com.codahale.metrics.Counter;
import com.codahale.metrics.Timer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.stockingest.budget.ExternalCallBudget;
import io.stockingest.metrics.Metrics;
import io.stockingest.retry.Retrier;
import io.stockingest.retry.RetryPolicy;
import io.stockingest.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Retrieves one symbol's time series. Every call first waits on the shared {@link ExternalCallBudget} so
 * consecutive symbols stay spaced; retries inside a call are governed by the retry policy alone.
 *
 * <p>Network errors, HTTP 5xx/429 and in-band rate-limit notices are retried with backoff. A provider
 * {@code Error Message}, an undecodable body or another non-2xx status ends the call at once.
 */
public class TimeSeriesFetcher {
    private static final Logger log = LoggerFactory.getLogger(TimeSeriesFetcher.class);

    private final MarketDataClient client;
    private final ExternalCallBudget budget;
    private final Retrier retrier;
    private final ObjectMapper mapper;
    private final Counter attemptsCounter;
    private final Counter rateLimitedCounter;
    private final Counter failuresCounter;
    private final Timer fetchTimer;

    public TimeSeriesFetcher(MarketDataClient client, ExternalCallBudget budget, RetryPolicy retryPolicy,
                             Sleeper sleeper, ObjectMapper mapper, Metrics metrics) {
        this.client = Objects.requireNonNull(client, "client");
        this.budget = budget == null ? ExternalCallBudget.UNLIMITED : budget;
        this.retrier = new Retrier(Objects.requireNonNull(retryPolicy, "retryPolicy"), sleeper, "fetch");
        this.mapper = mapper == null ? new ObjectMapper() : mapper;
        this.attemptsCounter = metrics.counter("fetch.attempts");
        this.rateLimitedCounter = metrics.counter("fetch.rateLimited");
        this.failuresCounter = metrics.counter("fetch.failures");
        this.fetchTimer = metrics.timer("fetch.time");
    }

    /** Retry policy predicate: only transient fetch failures are worth another attempt. */
    public static boolean isRetryable(Exception e) {
        return e instanceof TransientFetchException;
    }

    public RawTimeSeriesResponse fetch(String symbol, String apiKey) throws FetchException, InterruptedException {
        budget.acquireExternalOp();
        AtomicInteger attempts = new AtomicInteger();
        try (Timer.Context ignored = fetchTimer.time()) {
            return retrier.execute(attempt -> {
                attempts.set(attempt);
                return attemptOnce(symbol, apiKey, attempt);
            }, (attempt, backoff, cause) ->
                    log.warn("Fetch {} attempt {}/{} failed: {}; backing off {} ms",
                            symbol, attempt, retrier.policy().maxAttempts(), cause.getMessage(), backoff));
        } catch (InterruptedException ie) {
            throw ie;
        } catch (FetchException e) {
            failuresCounter.inc();
            log.error("Fetch {} failed: {}", symbol, e.getMessage());
            throw e;
        } catch (TransientFetchException e) {
            failuresCounter.inc();
            log.error("Exhausted {} attempts fetching {}. Last error: {}", attempts.get(), symbol, e.getMessage());
            throw new FetchException("Exhausted " + attempts.get() + " attempts fetching " + symbol + ": " + e.getMessage(), e, attempts.get());
        } catch (Exception e) {
            failuresCounter.inc();
            log.error("Unexpected error fetching {}", symbol, e);
            throw new FetchException("Unexpected error fetching " + symbol + ": " + e, e, attempts.get());
        }
    }

    private RawTimeSeriesResponse attemptOnce(String symbol, String apiKey, int attempt)
            throws IngestException, InterruptedException {
        attemptsCounter.inc();
        log.debug("Fetching {} attempt={}", symbol, attempt);
        ProviderResponse resp;
        try {
            resp = client.get(symbol, apiKey);
        } catch (IOException e) {
            throw new TransientFetchException("Network error for " + symbol + ": " + e, e);
        }

        int status = resp.statusCode();
        if (status >= 500 || status == 429) {
            throw new TransientFetchException("Server error " + status + " for " + symbol);
        }
        if (status < 200 || status >= 300) {
            throw new FetchException("HTTP " + status + " for " + symbol, attempt);
        }

        JsonNode json;
        try {
            json = mapper.readTree(resp.body() == null ? "" : resp.body());
        } catch (JsonProcessingException e) {
            throw new FetchException("Undecodable JSON for " + symbol + ": " + e.getOriginalMessage(), e, attempt);
        }
        RawTimeSeriesResponse raw = new RawTimeSeriesResponse(symbol, json);

        var notice = raw.rateLimitNotice();
        if (notice.isPresent()) {
            rateLimitedCounter.inc();
            throw new RateLimitedException(symbol, notice.get());
        }
        var error = raw.errorMessage();
        if (error.isPresent()) {
            throw new FetchException("Provider error for " + symbol + ": " + error.get(), attempt);
        }
        return raw;
    }
}
