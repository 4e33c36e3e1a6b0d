package io.stockingest.market;

/** Network error or retryable HTTP status; worth another attempt after backoff. */
public class TransientFetchException extends IngestException {
    public TransientFetchException(String message) {
        super(message);
    }

    public TransientFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
