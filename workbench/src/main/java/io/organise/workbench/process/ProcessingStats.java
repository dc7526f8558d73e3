package io.organise.workbench.process;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Result of one modifier run.
 *
 * @param totalRows          data rows read and written (header excluded)
 * @param cellsModified      cells whose value a modifier changed
 * @param validationFailures every failed pre-check, including those whose detail was not logged
 * @param columnsProcessed   columns with at least one changed cell, in first-change order
 */
public record ProcessingStats(long totalRows, long cellsModified, long validationFailures, Set<String> columnsProcessed) {
    public ProcessingStats {
        columnsProcessed = Collections.unmodifiableSet(new LinkedHashSet<>(columnsProcessed));
    }
}
