package io.stockingest.retry;

import io.stockingest.time.Sleeper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Runs an operation in a bounded loop, sleeping between attempts as dictated by a {@link RetryPolicy}.
 * When the policy declines another attempt the last failure is rethrown unchanged.
 */
public final class Retrier {
    private static final Logger log = LoggerFactory.getLogger(Retrier.class);

    @FunctionalInterface
    public interface Attempt<T> {
        T call(int attempt) throws Exception;
    }

    /** Notified before each backoff sleep. */
    @FunctionalInterface
    public interface RetryListener {
        void onRetry(int attempt, long backoffMillis, Exception cause);
    }

    private final RetryPolicy policy;
    private final Sleeper sleeper;
    private final String name;

    public Retrier(RetryPolicy policy, Sleeper sleeper, String name) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
        this.name = name;
    }

    public <T> T execute(Attempt<T> attempt) throws Exception {
        return execute(attempt, null);
    }

    public <T> T execute(Attempt<T> attempt, RetryListener listener) throws Exception {
        int n = 0;
        while (true) {
            n++;
            try {
                return attempt.call(n);
            } catch (InterruptedException ie) {
                throw ie;
            } catch (Exception e) {
                if (!policy.shouldRetry(n, e)) {
                    if (n > 1) {
                        log.debug("{}: giving up after attempt {}/{}: {}", name, n, policy.maxAttempts(), e.toString());
                    }
                    throw e;
                }
                long backoff = policy.backoffMillis(n);
                log.debug("{}: attempt {}/{} failed ({}); retrying in {} ms", name, n, policy.maxAttempts(), e.toString(), backoff);
                if (listener != null) listener.onRetry(n, backoff, e);
                sleeper.sleep(backoff);
            }
        }
    }

    public RetryPolicy policy() { return policy; }
}
