package io.stockingest.market;

/**
 * A chunk failed after earlier chunks of the same call were already committed. Those rows stay in the store
 * and are reported through {@link #rowsCommitted()}.
 */
public class PartialWriteException extends StoreException {
    private final int rowsCommitted;

    public PartialWriteException(int rowsCommitted, StoreException cause) {
        super(cause.getMessage() + " (" + rowsCommitted + " rows already committed)", cause, cause.isTransient());
        this.rowsCommitted = rowsCommitted;
    }

    public int rowsCommitted() { return rowsCommitted; }
}
