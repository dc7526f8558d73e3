package io.organise.workbench.modify;

import io.organise.csv.CsvHeader;
import io.organise.csv.CsvRow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class AccessIdentifierValidatorTest {
    private final AccessIdentifierValidator validator = new AccessIdentifierValidator();
    private final RowContext ctx = RowContext.snapshot(CsvRow.of(CsvHeader.of("accessIdentifier"), "x"), 0);

    @Test
    void itemLevelIdentifiersPass() {
        assertTrue(validator.validate("2024_19_01_001", ctx));
        assertTrue(validator.validate("2024_19_01_100", ctx));
    }

    @Test
    void containerAndEmptyIdentifiersFail() {
        assertFalse(validator.validate("2024_19_01_00", ctx));
        assertFalse(validator.validate("2024_19_01_000", ctx));
        assertFalse(validator.validate("", ctx));
        assertFalse(validator.validate("#VALUE!", ctx));
    }

    @Test
    void modifyNormalizes() {
        assertEquals("a_1", validator.modify("  a_1 ", ctx));
        assertEquals("", validator.modify("#VALUE!", ctx));
    }
}
