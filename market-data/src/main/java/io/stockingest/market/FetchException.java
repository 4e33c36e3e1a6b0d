package io.stockingest.market;

/**
 * Terminal fetch failure for one symbol: retries exhausted, or an error that retrying cannot fix.
 */
public class FetchException extends IngestException {
    private final int attempts;

    public FetchException(String message, int attempts) {
        super(message);
        this.attempts = attempts;
    }

    public FetchException(String message, Throwable cause, int attempts) {
        super(message, cause);
        this.attempts = attempts;
    }

    public int attempts() { return attempts; }

    /** Whether the last failure before giving up was provider throttling. */
    public boolean rateLimited() { return getCause() instanceof RateLimitedException; }
}
