package io.organise.workbench.process;

import com.codahale.metrics.MetricRegistry;
import io.organise.core.Sink;
import io.organise.core.Source;
import io.organise.csv.CsvRow;
import io.organise.metrics.Metrics;
import io.organise.runtime.Pipeline;
import io.organise.runtime.PipelineBuilder;
import io.organise.workbench.report.DiagnosticSink;
import io.organise.workbench.report.ValidationReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Objects;

/**
 * Streams a table through a set of modifiers, row by row, and returns what changed.
 */
public class ModifierPipeline {
    private static final Logger log = LoggerFactory.getLogger(ModifierPipeline.class);

    private final DiagnosticSink diagnostics;
    private final int validationLogLimit;
    private final MetricRegistry registry;

    public ModifierPipeline(DiagnosticSink diagnostics, int validationLogLimit, MetricRegistry registry) {
        this.diagnostics = Objects.requireNonNull(diagnostics, "diagnostics");
        this.validationLogLimit = validationLogLimit;
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public ModifierPipeline(DiagnosticSink diagnostics) {
        this(diagnostics, ValidationReporter.DEFAULT_LIMIT, new MetricRegistry());
    }

    /**
     * Apply {@code active} to every record of {@code source}, writing each to {@code sink} before the
     * next is read. The sink is flushed but not closed.
     *
     * @throws IOException on a malformed record, a read failure or a write failure; the run stops and
     *                     the sink's output is incomplete
     */
    public ProcessingStats run(ActiveModifiers active, Source<CsvRow> source, Sink<CsvRow> sink) throws IOException {
        return run(active, source, sink, false);
    }

    /**
     * As {@link #run(ActiveModifiers, Source, Sink)}, optionally cleaning every cell with
     * {@link io.organise.workbench.modify.TextSanitizer} first. Cleaned cells count as modified.
     */
    public ProcessingStats run(ActiveModifiers active, Source<CsvRow> source, Sink<CsvRow> sink, boolean sanitizeText) throws IOException {
        StatsCollector stats = new StatsCollector();
        ValidationReporter reporter = new ValidationReporter(validationLogLimit, diagnostics);
        Pipeline<CsvRow, CsvRow> pipeline = new PipelineBuilder<CsvRow, CsvRow>()
                .source(source)
                .transform(new ModifierTransform(active, stats, reporter, new Metrics(registry), sanitizeText))
                .sink(sink)
                .metrics(registry)
                .build();
        log.debug("Running modifiers {}", active.names());
        try {
            pipeline.run();
        } finally {
            reporter.finish();
        }
        ProcessingStats result = stats.snapshot();
        log.info("Processed {} rows, modified {} cells, {} validation failures",
                result.totalRows(), result.cellsModified(), result.validationFailures());
        return result;
    }
}
