package io.organise.workbench.items;

/**
 * @param uniqueParents distinct parent ids, one summary row each
 * @param totalItems    rows counted towards some parent id
 * @param skippedRows   rows with an empty or placeholder parent id
 */
public record ItemGenerationStats(long uniqueParents, long totalItems, long skippedRows) {
}
