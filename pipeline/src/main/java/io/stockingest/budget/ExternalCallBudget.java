package io.stockingest.budget;

/**
 * Governs how often calls to an external, rate limited service may be issued.
 */
public interface ExternalCallBudget {
    /** Block as needed to respect the external call budget (one op). */
    void acquireExternalOp() throws InterruptedException;

    /** Budget that never waits. */
    ExternalCallBudget UNLIMITED = () -> {};
}
