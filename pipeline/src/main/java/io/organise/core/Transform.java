package io.organise.core;

import java.io.IOException;

/**
 * Transform converts one input record into exactly one output record.
 * Implementations must preserve the input's seq.
 */
@FunctionalInterface
public interface Transform<I, O> {
    Record<O> apply(Record<I> input) throws IOException;
}
