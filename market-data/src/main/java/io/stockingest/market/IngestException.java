package io.stockingest.market;

/**
 * Base of the failures a single symbol can run into. None of them abort sibling symbols.
 */
public class IngestException extends Exception {
    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
