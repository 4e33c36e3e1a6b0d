package io.stockingest.core;

import java.io.Closeable;
import java.util.Optional;

/**
 * A Source produces work items one at a time. Finite sources report completion through
 * {@link #isFinished()} once every item has been handed out.
 */
public interface Source<T> extends Closeable {
    /**
     * Next item if any; empty once the source is exhausted.
     */
    Optional<T> poll();

    /**
     * Whether the source has reached a terminal state and will produce no more items.
     */
    boolean isFinished();

    @Override
    default void close() {}
}
