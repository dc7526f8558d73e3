package io.organise.workbench.report;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/** Writes validation diagnostics as WARN log lines. */
public class LoggingDiagnosticSink implements DiagnosticSink {
    private static final Logger log = LoggerFactory.getLogger(LoggingDiagnosticSink.class);

    @Override
    public void failure(ValidationFailure f) {
        log.warn("Validation failed for column '{}' at row {} using modifier '{}'. Current value='{}'",
                f.column(), f.rowNumber(), f.modifier(), f.rawValue());
    }

    @Override
    public void suppressed(long count, int limit) {
        log.warn("Suppressed {} further validation failures after the first {}", count, limit);
    }
}
