package io.stockingest.market;

public enum RunStatus {
    SUCCEEDED,
    /** No rows were written by any symbol. */
    FAILED,
    /** Stopped between symbols by an external request. */
    CANCELLED
}
