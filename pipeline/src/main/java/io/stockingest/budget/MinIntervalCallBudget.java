package io.stockingest.budget;

import io.stockingest.time.Sleeper;

import java.time.Clock;
import java.time.Duration;
import java.util.Objects;

/**
 * Enforces a minimum spacing between consecutive external calls. The first call is never delayed;
 * each later call waits until {@code minInterval} has passed since the previous call was released.
 */
public class MinIntervalCallBudget implements ExternalCallBudget {
    private final long minIntervalMillis;
    private final Clock clock;
    private final Sleeper sleeper;

    private long lastReleaseMillis = Long.MIN_VALUE;

    public MinIntervalCallBudget(Duration minInterval, Clock clock, Sleeper sleeper) {
        this.minIntervalMillis = Math.max(0, Objects.requireNonNull(minInterval, "minInterval").toMillis());
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.sleeper = sleeper == null ? Sleeper.SYSTEM : sleeper;
    }

    @Override
    public synchronized void acquireExternalOp() throws InterruptedException {
        if (minIntervalMillis > 0 && lastReleaseMillis != Long.MIN_VALUE) {
            long wait = lastReleaseMillis + minIntervalMillis - clock.millis();
            if (wait > 0) {
                sleeper.sleep(wait);
            }
        }
        lastReleaseMillis = clock.millis();
    }

    public long minIntervalMillis() { return minIntervalMillis; }
}
