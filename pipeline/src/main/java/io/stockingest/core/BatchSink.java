package io.stockingest.core;

import java.io.Closeable;
import java.util.List;

/** Sink that consumes items in batches for IO efficiency and reports how many were persisted. */
public interface BatchSink<T> extends Closeable {
    int acceptBatch(List<T> items) throws Exception;

    @Override
    default void close() {}
}
