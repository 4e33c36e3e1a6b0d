package io.stockingest.market;

/**
 * The provider answered, but with an in-band throttling notice instead of data.
 */
public class RateLimitedException extends TransientFetchException {
    private final String notice;

    public RateLimitedException(String symbol, String notice) {
        super("Rate limited while fetching " + symbol + ": " + notice);
        this.notice = notice;
    }

    public String notice() { return notice; }
}
