package io.organise.workbench.items;

import io.organise.core.Record;
import io.organise.core.Sink;
import io.organise.core.Source;
import io.organise.csv.CsvFormatException;
import io.organise.csv.CsvHeader;
import io.organise.csv.CsvRow;
import io.organise.workbench.modify.Cells;
import io.organise.workbench.modify.Columns;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Groups a processed table by {@code parent_id} into one summary row per parent: the first title
 * seen for it and the number of rows that carry it. Summary rows are written only once the whole
 * input has been read, in the order parents first appeared.
 */
public class ItemsAggregator {
    private static final Logger log = LoggerFactory.getLogger(ItemsAggregator.class);

    public static final CsvHeader SUMMARY_HEADER =
            CsvHeader.of("file_identifier", "title", "# of items", "field_member_of");

    public ItemGenerationStats aggregate(Source<CsvRow> source, Sink<CsvRow> sink, Optional<String> node) throws IOException {
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(sink, "sink");
        String memberOf = node.map(String::trim).orElse("");

        Map<String, Group> groups = new LinkedHashMap<>();
        long totalItems = 0;
        long skipped = 0;
        CsvHeader checked = null;
        int parentIdx = -1;
        int titleIdx = -1;

        while (true) {
            Optional<Record<CsvRow>> next = source.poll();
            if (next.isEmpty()) {
                if (source.isFinished()) break;
                throw new IllegalStateException("Source returned no record before finishing");
            }
            CsvRow row = next.get().payload();
            if (!row.header().equals(checked)) {
                parentIdx = row.header().require(Columns.PARENT_ID, "Run the parent-id modifier first");
                titleIdx = row.header().require(Columns.FILE_TITLE, null);
                checked = row.header();
            }
            String key = Cells.normalize(row.get(parentIdx));
            if (key.isEmpty()) {
                skipped++;
                continue;
            }
            String title = Cells.normalize(row.get(titleIdx));
            groups.computeIfAbsent(key, k -> new Group(title)).count++;
            totalItems++;
        }

        long seq = 0;
        for (Map.Entry<String, Group> e : groups.entrySet()) {
            CsvRow out = CsvRow.of(SUMMARY_HEADER, e.getKey(), e.getValue().title, Long.toString(e.getValue().count), memberOf);
            sink.accept(new Record<>(seq++, out));
        }
        sink.flush();
        log.debug("Aggregated {} items into {} parents, skipped {} rows", totalItems, groups.size(), skipped);
        return new ItemGenerationStats(groups.size(), totalItems, skipped);
    }

    /** Schema check for callers that know the header before the first row, e.g. a header-only table. */
    public static void requireColumns(CsvHeader header) throws CsvFormatException {
        header.require(Columns.PARENT_ID, "Run the parent-id modifier first");
        header.require(Columns.FILE_TITLE, null);
    }

    private static final class Group {
        final String title;
        long count;

        Group(String title) { this.title = title; }
    }
}
