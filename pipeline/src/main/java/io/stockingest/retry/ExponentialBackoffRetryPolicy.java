package io.stockingest.retry;

import java.util.Random;
import java.util.function.Predicate;

/**
 * Doubles the delay after every failed attempt starting at {@code baseMillis}, capped at {@code maxMillis}.
 * Only exceptions accepted by {@code retryOn} are retried. An optional jitter spreads each delay uniformly
 * within {@code +/- jitterFraction} of its nominal value.
 */
public class ExponentialBackoffRetryPolicy implements RetryPolicy {
    private final int maxAttempts;
    private final long baseMillis;
    private final long maxMillis;
    private final Predicate<Exception> retryOn;
    private final double jitterFraction;
    private final Random random;

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis) {
        this(maxAttempts, baseMillis, maxMillis, e -> true);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis, Predicate<Exception> retryOn) {
        this(maxAttempts, baseMillis, maxMillis, retryOn, 0.0, null);
    }

    public ExponentialBackoffRetryPolicy(int maxAttempts, long baseMillis, long maxMillis,
                                         Predicate<Exception> retryOn, double jitterFraction, Random random) {
        this.maxAttempts = Math.max(1, maxAttempts);
        this.baseMillis = Math.max(1, baseMillis);
        this.maxMillis = Math.max(this.baseMillis, maxMillis);
        this.retryOn = retryOn == null ? e -> true : retryOn;
        this.jitterFraction = Math.max(0.0, Math.min(1.0, jitterFraction));
        this.random = random == null ? new Random() : random;
    }

    @Override
    public boolean shouldRetry(int attempt, Exception e) {
        return attempt < maxAttempts && retryOn.test(e);
    }

    @Override
    public long backoffMillis(int attempt) {
        long delay = baseMillis * (1L << Math.min(20, Math.max(0, attempt - 1)));
        delay = Math.min(delay, maxMillis);
        if (jitterFraction > 0) {
            double factor = 1.0 - jitterFraction + (2 * jitterFraction * random.nextDouble());
            delay = Math.max(1, Math.round(delay * factor));
        }
        return delay;
    }

    @Override
    public int maxAttempts() {
        return maxAttempts;
    }
}
