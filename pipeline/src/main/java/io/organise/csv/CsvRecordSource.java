package io.organise.csv;

import io.organise.core.Record;
import io.organise.core.Source;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Streams RFC 4180 records from a character stream, one record per {@link #poll()}.
 * The first record is the header and fixes the schema; every later record must have the same
 * number of fields. Quoted fields may hold delimiters, doubled quotes and line breaks.
 * Blank physical lines between records are skipped. Memory use is bounded by the longest record.
 */
public class CsvRecordSource implements Source<CsvRow> {
    private static final int EOF = -1;
    private static final int NONE = -2;

    private final Reader in;
    private final CsvHeader header;
    private int pushedBack = NONE;
    private long nextSeq = 0;
    private boolean finished = false;

    public CsvRecordSource(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader");
        this.in = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
        int first = in.read();
        if (first != '\uFEFF') pushBack(first);
        List<String> names = readRecord();
        if (names == null) {
            throw new CsvFormatException("Input has no header row");
        }
        this.header = CsvHeader.of(names);
    }

    public static CsvRecordSource open(InputStream in) throws IOException {
        return new CsvRecordSource(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    public static CsvRecordSource open(Path file) throws IOException {
        return new CsvRecordSource(Files.newBufferedReader(file, StandardCharsets.UTF_8));
    }

    public CsvHeader header() { return header; }

    @Override
    public Optional<Record<CsvRow>> poll() throws IOException {
        if (finished) return Optional.empty();
        List<String> fields = readRecord();
        if (fields == null) {
            finished = true;
            return Optional.empty();
        }
        long seq = nextSeq;
        if (fields.size() != header.size()) {
            finished = true;
            throw new CsvFormatException("Row " + (seq + 1) + " has " + fields.size()
                    + " fields but the header has " + header.size(), seq);
        }
        nextSeq++;
        return Optional.of(new Record<>(seq, new CsvRow(header, fields)));
    }

    @Override
    public boolean isFinished() {
        return finished;
    }

    @Override
    public void close() throws IOException {
        finished = true;
        in.close();
    }

    /** Next record's fields, or null at end of input. */
    private List<String> readRecord() throws IOException {
        int c;
        while (true) {
            c = read();
            if (c == EOF) return null;
            if (c == '\n') continue;
            if (c == '\r') {
                skipLineFeed();
                continue;
            }
            pushBack(c);
            return readFields();
        }
    }

    private List<String> readFields() throws IOException {
        List<String> fields = new ArrayList<>();
        StringBuilder field = new StringBuilder();
        boolean inQuotes = false;
        boolean quotedField = false;
        while (true) {
            int c = read();
            if (inQuotes) {
                if (c == EOF) {
                    finished = true;
                    throw new CsvFormatException("Unterminated quoted field in row " + (nextSeq + 1), nextSeq);
                }
                if (c == '"') {
                    int d = read();
                    if (d == '"') {
                        field.append('"');
                    } else {
                        inQuotes = false;
                        pushBack(d);
                    }
                } else {
                    field.append((char) c);
                }
                continue;
            }
            switch (c) {
                case EOF, '\n' -> {
                    fields.add(field.toString());
                    return fields;
                }
                case '\r' -> {
                    skipLineFeed();
                    fields.add(field.toString());
                    return fields;
                }
                case ',' -> {
                    fields.add(field.toString());
                    field.setLength(0);
                    quotedField = false;
                }
                case '"' -> {
                    if (field.length() == 0 && !quotedField) {
                        inQuotes = true;
                        quotedField = true;
                    } else {
                        field.append('"');
                    }
                }
                default -> field.append((char) c);
            }
        }
    }

    private void skipLineFeed() throws IOException {
        int d = read();
        if (d != '\n') pushBack(d);
    }

    private int read() throws IOException {
        if (pushedBack != NONE) {
            int c = pushedBack;
            pushedBack = NONE;
            return c;
        }
        return in.read();
    }

    private void pushBack(int c) {
        pushedBack = c;
    }
}
