package io.organise.workbench.report;

/**
 * Where validation diagnostics end up. Kept apart from the logging backend so the reporting
 * policy can be tested on its own.
 */
public interface DiagnosticSink {
    void failure(ValidationFailure failure);

    /** Called at most once per run, after the last row, when failures were held back. */
    void suppressed(long count, int limit);
}
