package io.organise.workbench.process;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Mutable counters behind {@link ProcessingStats}. Owned by the single loop of one run.
 */
public final class StatsCollector {
    private long totalRows;
    private long cellsModified;
    private long validationFailures;
    private final Set<String> columnsProcessed = new LinkedHashSet<>();

    void rowProcessed() { totalRows++; }

    void cellModified(String column) {
        cellsModified++;
        columnsProcessed.add(column);
    }

    void validationFailed() { validationFailures++; }

    public ProcessingStats snapshot() {
        return new ProcessingStats(totalRows, cellsModified, validationFailures, columnsProcessed);
    }
}
