package io.organise.core;

import java.io.Closeable;
import java.io.IOException;
import java.util.Optional;

/**
 * A Source produces records one at a time, in stream order.
 */
public interface Source<T> extends Closeable {
    /**
     * Decode and return the next record. Returns empty once the source is exhausted; from then on
     * {@link #isFinished()} is true.
     *
     * @throws IOException when the underlying stream cannot be read or a record is malformed.
     *                     The source is unusable afterwards.
     */
    Optional<Record<T>> poll() throws IOException;

    /**
     * Whether the source has reached a terminal state and will produce no more records.
     */
    boolean isFinished();

    @Override
    default void close() throws IOException {}
}
