package io.organise.workbench.cli;

import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class OutputPathsTest {

    @Test
    void modifiedFileSitsNextToInput() {
        assertEquals(Path.of("data/sheet-modified.csv"), OutputPaths.modifiedFor(Path.of("data/sheet.csv")));
        assertEquals(Path.of("sheet-modified.tsv"), OutputPaths.modifiedFor(Path.of("sheet.tsv")));
        assertEquals(Path.of("noext-modified.csv"), OutputPaths.modifiedFor(Path.of("noext")));
    }

    @Test
    void itemsFileIsNamedAfterProcessedTable() {
        assertEquals(Path.of("out/sheet-modified-items.csv"), OutputPaths.itemsFor(Path.of("out/sheet-modified.csv")));
    }

    @Test
    void outputDirRelocatesDefaultsAndRelativePaths() {
        Optional<Path> dir = Optional.of(Path.of("target-dir"));
        assertEquals(Path.of("target-dir/sheet-modified.csv"),
                OutputPaths.resolve(Optional.empty(), Path.of("data/sheet-modified.csv"), dir));
        assertEquals(Path.of("target-dir/custom.csv"),
                OutputPaths.resolve(Optional.of(Path.of("custom.csv")), Path.of("ignored.csv"), dir));
        Path absolute = Path.of("/tmp/abs.csv").toAbsolutePath();
        assertEquals(absolute, OutputPaths.resolve(Optional.of(absolute), Path.of("ignored.csv"), dir));
    }

    @Test
    void withoutOutputDirPathsAreUsedAsGiven() {
        assertEquals(Path.of("data/sheet-modified.csv"),
                OutputPaths.resolve(Optional.empty(), Path.of("data/sheet-modified.csv"), Optional.empty()));
        assertEquals(Path.of("x.csv"), OutputPaths.resolve(Optional.of(Path.of("x.csv")), Path.of("y.csv"), Optional.empty()));
    }
}
