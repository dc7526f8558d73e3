package io.organise.workbench.report;

import java.util.Objects;

/**
 * Forwards the first {@code limit} failures of a run in full and only counts the rest, then
 * reports the held-back count once in {@link #finish()}. Owned by a single run; not thread-safe.
 */
public class ValidationReporter {
    public static final int DEFAULT_LIMIT = 25;

    private final int limit;
    private final DiagnosticSink sink;
    private long reported = 0;
    private long suppressed = 0;
    private boolean finished = false;

    public ValidationReporter(int limit, DiagnosticSink sink) {
        if (limit < 0) throw new IllegalArgumentException("limit must be >= 0");
        this.limit = limit;
        this.sink = Objects.requireNonNull(sink, "sink");
    }

    public ValidationReporter(DiagnosticSink sink) {
        this(DEFAULT_LIMIT, sink);
    }

    public void report(ValidationFailure failure) {
        if (finished) throw new IllegalStateException("Reporter already finished");
        if (reported < limit) {
            reported++;
            sink.failure(failure);
        } else {
            suppressed++;
        }
    }

    /** Emit the rollup for held-back failures, if any. Idempotent. */
    public void finish() {
        if (finished) return;
        finished = true;
        if (suppressed > 0) sink.suppressed(suppressed, limit);
    }

    public int limit() { return limit; }
    public long reported() { return reported; }
    public long suppressed() { return suppressed; }
}
