package io.stockingest.time;

/**
 * Blocking pause used by retry and rate limiting code. Tests substitute a recording implementation
 * so backoff timing can be asserted without waiting.
 */
@FunctionalInterface
public interface Sleeper {
    Sleeper SYSTEM = Thread::sleep;

    void sleep(long millis) throws InterruptedException;
}
