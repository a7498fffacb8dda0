package org.cpoanalyzer.data;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.regex.Pattern;

/**
 * Header-plus-rows table decoded from a whitespace-delimited text stream, as written by the
 * particle output of the simulation.
 * <p>
 * The first non-blank line is the header. Fields are separated by runs of spaces or tabs.
 * Column lookup is by header name, so extra columns are tolerated and column order does
 * not matter. Parse failures name the file, the line and the column.
 */
public final class DelimitedTable {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private final Path source;
    private final Map<String, Integer> columns;
    private final List<Row> rows;

    private DelimitedTable(Path source, Map<String, Integer> columns, List<Row> rows) {
        this.source = source;
        this.columns = columns;
        this.rows = rows;
    }

    /**
     * Reads a whole table. The stream is consumed but not closed.
     *
     * @param source path used in error messages.
     * @param in     decoded (already decompressed) stream.
     * @return the table; a stream with no header yields a table with no columns and no rows.
     * @throws IOException if reading fails; {@link java.util.zip.ZipException} surfaces here
     *                     for a corrupt compressed stream.
     */
    public static DelimitedTable read(Path source, InputStream in) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
        Map<String, Integer> columns = new HashMap<>();
        List<Row> rows = new ArrayList<>();

        String line;
        int lineNumber = 0;
        boolean headerSeen = false;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            String trimmed = line.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            String[] fields = WHITESPACE.split(trimmed);
            if (!headerSeen) {
                for (int i = 0; i < fields.length; i++) {
                    columns.putIfAbsent(fields[i], i);
                }
                headerSeen = true;
            } else {
                rows.add(new Row(lineNumber, fields));
            }
        }
        return new DelimitedTable(source, Collections.unmodifiableMap(columns), Collections.unmodifiableList(rows));
    }

    public Path source() {
        return source;
    }

    public List<Row> rows() {
        return rows;
    }

    /**
     * @return true if the stream held neither a header nor rows.
     */
    public boolean isEmpty() {
        return columns.isEmpty() && rows.isEmpty();
    }

    public boolean hasColumn(String name) {
        return columns.containsKey(name);
    }

    /**
     * Reads a required integer field.
     *
     * @throws MalformedRecordException if the column is missing, the row is short or the value is not an integer.
     */
    public long getLong(Row row, String column) throws MalformedRecordException {
        String raw = rawValue(row, column);
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            // ids are sometimes written as floating point values, e.g. "12.0"
            try {
                double asDouble = Double.parseDouble(raw);
                if (asDouble == Math.rint(asDouble)) {
                    return (long) asDouble;
                }
            } catch (NumberFormatException ignored) {
                // reported below with the original value
            }
            throw new MalformedRecordException(source,
                    "line " + row.lineNumber() + ", column '" + column + "': not an integer: '" + raw + "'", e);
        }
    }

    /**
     * Reads a required floating point field.
     *
     * @throws MalformedRecordException if the column is missing, the row is short or the value is not a number.
     */
    public double getDouble(Row row, String column) throws MalformedRecordException {
        String raw = rawValue(row, column);
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new MalformedRecordException(source,
                    "line " + row.lineNumber() + ", column '" + column + "': not a number: '" + raw + "'", e);
        }
    }

    /**
     * Reads an optional floating point field: empty if the header has no such column.
     *
     * @throws MalformedRecordException if the column exists but the value is missing or not a number.
     */
    public OptionalDouble getOptionalDouble(Row row, String column) throws MalformedRecordException {
        if (!hasColumn(column)) {
            return OptionalDouble.empty();
        }
        return OptionalDouble.of(getDouble(row, column));
    }

    private String rawValue(Row row, String column) throws MalformedRecordException {
        Integer index = columns.get(column);
        if (index == null) {
            throw new MalformedRecordException(source, "missing column '" + column + "'");
        }
        if (index >= row.fieldCount()) {
            throw new MalformedRecordException(source,
                    "line " + row.lineNumber() + ": " + row.fieldCount() + " fields, column '" + column
                            + "' expected at position " + index);
        }
        return row.field(index);
    }

    /**
     * One data line. Rows compare by identity.
     */
    public static final class Row {

        private final int lineNumber;
        private final String[] fields;

        Row(int lineNumber, String[] fields) {
            this.lineNumber = lineNumber;
            this.fields = fields;
        }

        /**
         * @return 1-based line number in the decoded stream.
         */
        public int lineNumber() {
            return lineNumber;
        }

        /**
         * @return number of fields on the line.
         */
        public int fieldCount() {
            return fields.length;
        }

        String field(int index) {
            return fields[index];
        }

        @Override
        public String toString() {
            return "Row[line " + lineNumber + ": " + String.join(" ", fields) + "]";
        }
    }
}
