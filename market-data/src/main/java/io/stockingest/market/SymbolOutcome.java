package io.stockingest.market;

/**
 * Result of running fetch, parse and write for one symbol. {@code failedStage} and {@code error} are null on success.
 */
public record SymbolOutcome(String symbol, int rowsWritten, int rowsSkipped, Stage failedStage, String error) {
    public enum Stage { FETCH, PARSE, WRITE }

    public static SymbolOutcome ok(String symbol, int rowsWritten, int rowsSkipped) {
        return new SymbolOutcome(symbol, rowsWritten, rowsSkipped, null, null);
    }

    public static SymbolOutcome failed(String symbol, Stage stage, int rowsSkipped, String error) {
        return failed(symbol, stage, 0, rowsSkipped, error);
    }

    /** Failure that still left {@code rowsWritten} rows committed. */
    public static SymbolOutcome failed(String symbol, Stage stage, int rowsWritten, int rowsSkipped, String error) {
        return new SymbolOutcome(symbol, rowsWritten, rowsSkipped, stage, error);
    }

    public boolean succeeded() { return failedStage == null; }
}
