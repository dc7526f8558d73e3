package io.organise.workbench.cli;

import java.nio.file.Path;
import java.util.Optional;

/**
 * Default output locations for processed tables and item summaries.
 */
final class OutputPaths {
    static final String SHEETS_OUTPUT = "sheets-output-modified.csv";
    static final String ITEMS_OUTPUT = "items.csv";

    private OutputPaths() {}

    /** {@code data.csv -> data-modified.csv}, next to the input. */
    static Path modifiedFor(Path input) {
        String name = input.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot <= 0 ? name : name.substring(0, dot);
        String ext = dot <= 0 ? "csv" : name.substring(dot + 1);
        return input.resolveSibling(stem + "-modified." + ext);
    }

    /** {@code data-modified.csv -> data-modified-items.csv}, next to the processed table. */
    static Path itemsFor(Path processed) {
        String name = processed.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot <= 0 ? name : name.substring(0, dot);
        return processed.resolveSibling(stem + "-items.csv");
    }

    /**
     * Final location: an explicit path wins, relative ones land under {@code outputDir} when given;
     * without an explicit path the default's file name is placed under {@code outputDir}.
     */
    static Path resolve(Optional<Path> explicit, Path fallback, Optional<Path> outputDir) {
        if (explicit.isPresent()) {
            Path p = explicit.get();
            return p.isAbsolute() || outputDir.isEmpty() ? p : outputDir.get().resolve(p);
        }
        return outputDir.map(dir -> dir.resolve(fallback.getFileName())).orElse(fallback);
    }
}
