package io.stockingest.market;

import java.util.List;

/**
 * What a run reports back to whoever triggered it. {@code succeeded} is false when nothing was written
 * or the run was cancelled.
 */
public record RunResult(boolean succeeded,
                        int rowsWritten,
                        List<String> warnings,
                        int rowsSkipped,
                        RunStatus status,
                        List<SymbolOutcome> outcomes) {
    public RunResult {
        warnings = List.copyOf(warnings);
        outcomes = List.copyOf(outcomes);
    }
}
