package io.organise.workbench.modify;

import io.organise.csv.CsvHeader;
import io.organise.csv.CsvRow;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class FieldDescriptionEscaperTest {
    private final FieldDescriptionEscaper escaper = new FieldDescriptionEscaper();
    private final RowContext ctx = RowContext.snapshot(CsvRow.of(CsvHeader.of("field_description"), ""), 0);

    @Test
    void escapesBareSemicolons() {
        assertEquals("a\\;b\\;c", FieldDescriptionEscaper.escapeSemicolons("a;b;c"));
    }

    @Test
    void leavesEscapedSemicolonsAlone() {
        assertEquals("a\\;b\\;c", FieldDescriptionEscaper.escapeSemicolons("a\\;b;c"));
    }

    @Test
    void wrapsOnceInQuotes() {
        assertEquals("\"text\"", escaper.modify("text", ctx));
        assertEquals("\"already\"", escaper.modify("\"already\"", ctx));
    }

    @Test
    void emptyBecomesEmptyQuotes() {
        assertEquals("\"\"", escaper.modify("", ctx));
    }

    @Test
    void escapingIsIdempotent() {
        String once = escaper.modify("one; two", ctx);
        assertEquals("\"one\\; two\"", once);
        assertEquals(once, escaper.modify(once, ctx));
    }
}
