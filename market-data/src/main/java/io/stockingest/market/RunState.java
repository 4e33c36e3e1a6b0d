package io.stockingest.market;

/** Where a job currently is in its run. */
public enum RunState {
    IDLE,
    FETCHING,
    PARSING,
    WRITING,
    AGGREGATING,
    SUCCEEDED,
    FAILED
}
