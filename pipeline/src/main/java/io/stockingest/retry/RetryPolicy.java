package io.stockingest.retry;

public interface RetryPolicy {
    /** @param attempt 1-based number of the attempt that just failed */
    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);

    int maxAttempts();
}
