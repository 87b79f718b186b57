package com.ac.iisc.cardinal;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

/**
 * A CSV table held in memory: a header row plus string cells, row order preserved.
 *
 * Quoted fields with embedded commas, quotes and newlines (serialized plans) survive a
 * read/write round trip. Rows shorter than the header are padded with empty cells; a row
 * longer than the header is rejected, since an unquoted comma would otherwise shift cells.
 */
public final class QueryTable {

    private static final CsvMapper MAPPER = new CsvMapper();

    private final List<String> columns;
    private final List<List<String>> rows;

    public QueryTable(List<String> columns, List<List<String>> rows) {
        if (columns == null) throw new IllegalArgumentException("columns must not be null");
        this.columns = List.copyOf(columns);
        List<List<String>> copy = new ArrayList<>();
        if (rows != null) {
            for (List<String> row : rows) {
                if (row != null && row.size() > this.columns.size()) {
                    throw new IllegalArgumentException("row has " + row.size() + " cells, header has " + this.columns.size());
                }
                copy.add(pad(row, this.columns.size()));
            }
        }
        this.rows = Collections.unmodifiableList(copy);
    }

    /**
     * Read a CSV file whose first record is the header. An empty file gives an empty table.
     *
     * @throws IOException when the file cannot be read or a record has more fields than the header
     */
    public static QueryTable read(Path path) throws IOException {
        List<String> header = null;
        List<List<String>> rows = new ArrayList<>();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
             MappingIterator<String[]> it = MAPPER.readerFor(String[].class)
                 .with(CsvParser.Feature.WRAP_AS_ARRAY)
                 .with(CsvParser.Feature.SKIP_EMPTY_LINES)
                 .readValues(reader)) {
            while (it.hasNextValue()) {
                String[] record = it.nextValue();
                if (header == null) {
                    header = new ArrayList<>();
                    for (String h : record) header.add(h == null ? "" : h.trim());
                } else {
                    if (record.length > header.size()) {
                        throw new IOException("Error tokenizing " + path + ": expected " + header.size()
                            + " fields in record " + (rows.size() + 2) + ", saw " + record.length);
                    }
                    rows.add(Arrays.asList(record));
                }
            }
        }
        return new QueryTable(header == null ? List.of() : header, rows);
    }

    /** Write the table with its header; columns keep their order. */
    public void write(Path path) throws IOException {
        CsvSchema.Builder builder = CsvSchema.builder();
        for (String c : columns) builder.addColumn(c);
        CsvSchema schema = builder.build();

        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8);
             SequenceWriter out = MAPPER.writer(schema).writeValues(writer)) {
            Map<String, String> header = new LinkedHashMap<>();
            for (String c : columns) header.put(c, c);
            out.write(header);
            for (List<String> row : rows) {
                Map<String, String> record = new LinkedHashMap<>();
                for (int i = 0; i < columns.size(); i++) record.put(columns.get(i), row.get(i));
                out.write(record);
            }
        }
    }

    public List<String> getColumns() { return columns; }
    public int size() { return rows.size(); }
    public List<String> getRow(int row) { return rows.get(row); }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    /** Cell value, or null when the column does not exist. */
    public String get(int row, String column) {
        int idx = columns.indexOf(column);
        return idx < 0 ? null : rows.get(row).get(idx);
    }

    /**
     * Copy of this table with {@code column} set to {@code values}; the column is appended
     * when absent and overwritten in place otherwise. Null values become empty cells.
     */
    public QueryTable withColumn(String column, List<String> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("expected " + rows.size() + " values for " + column + ", got " + values.size());
        }
        List<String> newColumns = new ArrayList<>(columns);
        int idx = newColumns.indexOf(column);
        if (idx < 0) {
            newColumns.add(column);
            idx = newColumns.size() - 1;
        }
        List<List<String>> newRows = new ArrayList<>(rows.size());
        for (int r = 0; r < rows.size(); r++) {
            List<String> row = pad(rows.get(r), newColumns.size());
            String v = values.get(r);
            row.set(idx, v == null ? "" : v);
            newRows.add(row);
        }
        return new QueryTable(newColumns, newRows);
    }

    private static List<String> pad(List<String> row, int width) {
        List<String> out = new ArrayList<>(width);
        for (int i = 0; i < width; i++) {
            String v = row != null && i < row.size() ? row.get(i) : null;
            out.add(v == null ? "" : v);
        }
        return out;
    }

    @Override
    public String toString() {
        return "QueryTable[" + columns + ", " + rows.size() + " rows]";
    }
}
