package io.organise.csv;

import io.organise.core.Record;
import io.organise.core.Sink;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Writes records as CSV, header first. Fields are quoted only when they contain a comma, a quote
 * or a line break; embedded quotes are doubled. Records end with {@code \n}.
 * The header is written on the first record, or on flush/close for an empty table.
 */
public class CsvRecordSink implements Sink<CsvRow> {
    private final Writer out;
    private final CsvHeader header;
    private boolean headerWritten = false;
    private long written = 0;

    public CsvRecordSink(Writer writer, CsvHeader header) {
        Objects.requireNonNull(writer, "writer");
        this.out = writer instanceof BufferedWriter ? writer : new BufferedWriter(writer);
        this.header = Objects.requireNonNull(header, "header");
    }

    public static CsvRecordSink open(OutputStream out, CsvHeader header) {
        return new CsvRecordSink(new OutputStreamWriter(out, StandardCharsets.UTF_8), header);
    }

    public static CsvRecordSink create(Path file, CsvHeader header) throws IOException {
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        return new CsvRecordSink(Files.newBufferedWriter(file, StandardCharsets.UTF_8), header);
    }

    public CsvHeader header() { return header; }

    /** Data records written so far. */
    public long written() { return written; }

    @Override
    public void accept(Record<CsvRow> record) throws IOException {
        CsvRow row = record.payload();
        if (row.size() != header.size()) {
            throw new CsvFormatException("Row " + (record.seq() + 1) + " has " + row.size()
                    + " fields but the output header has " + header.size(), record.seq());
        }
        writeHeaderOnce();
        writeRecord(row.values());
        written++;
    }

    @Override
    public void flush() throws IOException {
        writeHeaderOnce();
        out.flush();
    }

    @Override
    public void close() throws IOException {
        try {
            flush();
        } finally {
            out.close();
        }
    }

    private void writeHeaderOnce() throws IOException {
        if (headerWritten) return;
        writeRecord(header.names());
        headerWritten = true;
    }

    private void writeRecord(List<String> fields) throws IOException {
        if (fields.size() == 1 && fields.get(0).isEmpty()) {
            // a bare empty line would read back as a blank line
            out.write("\"\"\n");
            return;
        }
        for (int i = 0; i < fields.size(); i++) {
            if (i > 0) out.write(',');
            out.write(escape(fields.get(i)));
        }
        out.write('\n');
    }

    static String escape(String field) {
        boolean needsQuotes = false;
        for (int i = 0; i < field.length(); i++) {
            char c = field.charAt(i);
            if (c == ',' || c == '"' || c == '\n' || c == '\r') {
                needsQuotes = true;
                break;
            }
        }
        if (!needsQuotes) return field;
        return '"' + field.replace("\"", "\"\"") + '"';
    }
}
