package io.organise.workbench.items;

import io.organise.csv.CsvFormatException;
import io.organise.csv.CsvRecordSink;
import io.organise.csv.CsvRecordSource;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringReader;
import java.io.StringWriter;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ItemsAggregatorTest {
    private final ItemsAggregator aggregator = new ItemsAggregator();

    private String aggregate(String csv, Optional<String> node, ItemGenerationStats[] stats) throws IOException {
        StringWriter out = new StringWriter();
        try (CsvRecordSource source = new CsvRecordSource(new StringReader(csv));
             CsvRecordSink sink = new CsvRecordSink(out, ItemsAggregator.SUMMARY_HEADER)) {
            stats[0] = aggregator.aggregate(source, sink, node);
        }
        return out.toString();
    }

    @Test
    void groupsByParentInFirstAppearanceOrder() throws IOException {
        String csv = "parent_id,fileTitle\n"
                + "b,Second\n"
                + "a,First\n"
                + "b,Other title\n"
                + "a,\n"
                + "b,Third\n";
        ItemGenerationStats[] stats = new ItemGenerationStats[1];
        String out = aggregate(csv, Optional.empty(), stats);
        assertEquals("file_identifier,title,# of items,field_member_of\n"
                + "b,Second,3,\n"
                + "a,First,2,\n", out);
        assertEquals(new ItemGenerationStats(2, 5, 0), stats[0]);
    }

    @Test
    void firstTitleWinsEvenWhenEmpty() throws IOException {
        ItemGenerationStats[] stats = new ItemGenerationStats[1];
        String out = aggregate("parent_id,fileTitle\np,\np,Later\n", Optional.empty(), stats);
        assertEquals("file_identifier,title,# of items,field_member_of\np,,2,\n", out);
    }

    @Test
    void emptyAndPlaceholderParentsAreSkipped() throws IOException {
        String csv = "parent_id,fileTitle\n,x\n#VALUE!,y\n  ,z\np,T\n";
        ItemGenerationStats[] stats = new ItemGenerationStats[1];
        String out = aggregate(csv, Optional.empty(), stats);
        assertEquals("file_identifier,title,# of items,field_member_of\np,T,1,\n", out);
        assertEquals(new ItemGenerationStats(1, 1, 3), stats[0]);
    }

    @Test
    void keysAndTitlesAreTrimmed() throws IOException {
        ItemGenerationStats[] stats = new ItemGenerationStats[1];
        String out = aggregate("parent_id,fileTitle\n p ,  Title \np,x\n", Optional.empty(), stats);
        assertEquals("file_identifier,title,# of items,field_member_of\np,Title,2,\n", out);
    }

    @Test
    void nodeIsStampedOnEveryRow() throws IOException {
        ItemGenerationStats[] stats = new ItemGenerationStats[1];
        String out = aggregate("parent_id,fileTitle\na,A\nb,B\n", Optional.of("42"), stats);
        assertEquals("file_identifier,title,# of items,field_member_of\na,A,1,42\nb,B,1,42\n", out);
    }

    @Test
    void titlesWithCommasAreQuoted() throws IOException {
        ItemGenerationStats[] stats = new ItemGenerationStats[1];
        String out = aggregate("parent_id,fileTitle\na,\"Smith, J.\"\n", Optional.empty(), stats);
        assertEquals("file_identifier,title,# of items,field_member_of\na,\"Smith, J.\",1,\n", out);
    }

    @Test
    void missingColumnFailsWithoutSummaryRows() throws IOException {
        StringWriter out = new StringWriter();
        try (CsvRecordSource source = new CsvRecordSource(new StringReader("parent_id,title\na,x\n"));
             CsvRecordSink sink = new CsvRecordSink(out, ItemsAggregator.SUMMARY_HEADER)) {
            CsvFormatException e = assertThrows(CsvFormatException.class, () -> aggregator.aggregate(source, sink, Optional.empty()));
            assertTrue(e.getMessage().contains("fileTitle"));
        }
        assertEquals("file_identifier,title,# of items,field_member_of\n", out.toString());
    }

    @Test
    void malformedRowLateInTheStreamLeavesNoSummaryRows() throws IOException {
        StringWriter out = new StringWriter();
        try (CsvRecordSource source = new CsvRecordSource(new StringReader("parent_id,fileTitle\na,x\nb,y\nbroken\n"));
             CsvRecordSink sink = new CsvRecordSink(out, ItemsAggregator.SUMMARY_HEADER)) {
            assertThrows(CsvFormatException.class, () -> aggregator.aggregate(source, sink, Optional.empty()));
        }
        assertEquals("file_identifier,title,# of items,field_member_of\n", out.toString());
    }

    @Test
    void headerOnlyInputYieldsHeaderOnlySummary() throws IOException {
        ItemGenerationStats[] stats = new ItemGenerationStats[1];
        String out = aggregate("parent_id,fileTitle\n", Optional.empty(), stats);
        assertEquals("file_identifier,title,# of items,field_member_of\n", out);
        assertEquals(new ItemGenerationStats(0, 0, 0), stats[0]);
    }

    @Test
    void requireColumnsChecksTheHeaderUpFront() throws IOException {
        CsvRecordSource source = new CsvRecordSource(new StringReader("parent_id\n"));
        assertThrows(CsvFormatException.class, () -> ItemsAggregator.requireColumns(source.header()));
    }
}
