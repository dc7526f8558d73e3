package io.organise.workbench.process;

import com.codahale.metrics.Counter;
import io.organise.core.Record;
import io.organise.core.Transform;
import io.organise.csv.CsvRow;
import io.organise.metrics.Metrics;
import io.organise.workbench.modify.ColumnModifier;
import io.organise.workbench.modify.RowContext;
import io.organise.workbench.modify.TextSanitizer;
import io.organise.workbench.report.ValidationFailure;
import io.organise.workbench.report.ValidationReporter;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * Applies the active modifiers to one row in place.
 *
 * <p>The context is snapshotted before the first modifier runs. A modifier whose target column is
 * absent from the row is skipped without comment. A failed validation is counted and reported, and
 * the modifier's output is still written. A modifier is also skipped when the row lacks a column it
 * reads (see {@link ColumnModifier#appliesTo}).
 */
public class ModifierTransform implements Transform<CsvRow, CsvRow> {
    private final ActiveModifiers active;
    private final StatsCollector stats;
    private final ValidationReporter reporter;
    private final Counter cellsCounter;
    private final Counter failuresCounter;
    private final boolean sanitizeText;

    public ModifierTransform(ActiveModifiers active, StatsCollector stats, ValidationReporter reporter, Metrics metrics) {
        this(active, stats, reporter, metrics, false);
    }

    /**
     * @param sanitizeText clean every cell with {@link TextSanitizer} before the modifiers see the row
     */
    public ModifierTransform(ActiveModifiers active, StatsCollector stats, ValidationReporter reporter, Metrics metrics,
                             boolean sanitizeText) {
        this.sanitizeText = sanitizeText;
        this.active = Objects.requireNonNull(active, "active");
        this.stats = Objects.requireNonNull(stats, "stats");
        this.reporter = Objects.requireNonNull(reporter, "reporter");
        this.cellsCounter = metrics.counter("modifier.cells.modified");
        this.failuresCounter = metrics.counter("modifier.validation.failures");
    }

    @Override
    public Record<CsvRow> apply(Record<CsvRow> input) {
        CsvRow row = input.payload();
        if (sanitizeText) sanitize(row);
        RowContext context = RowContext.snapshot(row, input.seq());
        for (ModifierBinding binding : active) {
            OptionalInt index = row.header().indexOf(binding.column());
            if (index.isEmpty()) continue;
            int i = index.getAsInt();
            ColumnModifier modifier = binding.modifier();
            if (!modifier.appliesTo(context)) continue;
            String current = row.get(i);

            if (!modifier.validate(current, context)) {
                stats.validationFailed();
                failuresCounter.inc();
                reporter.report(new ValidationFailure(modifier.description(), binding.column(), input.seq(), current));
            }

            String next = Objects.requireNonNull(modifier.modify(current, context),
                    () -> "Modifier '" + binding.name() + "' returned null");
            if (!next.equals(current)) {
                row.set(i, next);
                stats.cellModified(binding.column());
                cellsCounter.inc();
            }
        }
        stats.rowProcessed();
        return input;
    }

    private void sanitize(CsvRow row) {
        for (int i = 0; i < row.size(); i++) {
            String current = row.get(i);
            String clean = TextSanitizer.sanitize(current);
            if (!clean.equals(current)) {
                row.set(i, clean);
                stats.cellModified(row.header().name(i));
                cellsCounter.inc();
            }
        }
    }
}
