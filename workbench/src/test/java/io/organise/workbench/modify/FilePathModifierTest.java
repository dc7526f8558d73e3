package io.organise.workbench.modify;

import io.organise.csv.CsvHeader;
import io.organise.csv.CsvRow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FilePathModifierTest {
    private static final CsvHeader HEADER = CsvHeader.of("accessIdentifier", "file", "file_extension");
    private final FilePathModifier modifier = new FilePathModifier();

    private static RowContext row(String accessIdentifier, String file, String extension) {
        return RowContext.snapshot(CsvRow.of(HEADER, accessIdentifier, file, extension), 0);
    }

    @Test
    void composesParentDirectoryBaseNameAndExtension() {
        RowContext ctx = row("2024_19_01_001", "image_001", "jpg");
        assertTrue(modifier.validate("image_001", ctx));
        assertEquals("2024_19_01/image_001.jpg", modifier.modify("image_001", ctx));
    }

    @Test
    void replacesExistingExtension() {
        RowContext ctx = row("a_b_1", "scan.tiff", "jp2");
        assertEquals("a_b/scan.jp2", modifier.modify("scan.tiff", ctx));
    }

    @Test
    void readsLegacyExtensionColumn() {
        CsvHeader legacy = CsvHeader.of("accessIdentifier", "file", "file_extention");
        RowContext ctx = RowContext.snapshot(CsvRow.of(legacy, "x_y_2", "page", "pdf"), 0);
        assertEquals("x_y/page.pdf", modifier.modify("page", ctx));
    }

    @Test
    void currentExtensionColumnWinsOverLegacy() {
        CsvHeader both = CsvHeader.of("accessIdentifier", "file", "file_extension", "file_extention");
        RowContext ctx = RowContext.snapshot(CsvRow.of(both, "x_1", "f", "png", "gif"), 0);
        assertEquals("x/f.png", modifier.modify("f", ctx));
    }

    @Test
    void appliesOnlyWhenIdentifierAndSomeExtensionColumnExist() {
        assertTrue(modifier.appliesTo(row("", "", "")));
        RowContext legacyOnly = RowContext.snapshot(CsvRow.of(CsvHeader.of("accessIdentifier", "file", "file_extention"), "a_1", "f", "pdf"), 0);
        assertTrue(modifier.appliesTo(legacyOnly));
        RowContext noExtensionColumn = RowContext.snapshot(CsvRow.of(CsvHeader.of("accessIdentifier", "file"), "a_1", "f"), 0);
        assertFalse(modifier.appliesTo(noExtensionColumn));
        RowContext noIdentifierColumn = RowContext.snapshot(CsvRow.of(CsvHeader.of("file", "file_extension"), "f", "pdf"), 0);
        assertFalse(modifier.appliesTo(noIdentifierColumn));
    }

    @Test
    void anyMissingInputFailsValidationAndClearsTarget() {
        RowContext noExtension = row("a_b_1", "f", "");
        assertFalse(modifier.validate("f", noExtension));
        assertEquals("", modifier.modify("f", noExtension));

        RowContext noIdentifier = row("#VALUE!", "f", "jpg");
        assertFalse(modifier.validate("f", noIdentifier));
        assertEquals("", modifier.modify("f", noIdentifier));

        RowContext noFile = row("a_b_1", "", "jpg");
        assertFalse(modifier.validate("", noFile));
        assertEquals("", modifier.modify("", noFile));
    }
}
