package com.ac.iisc.plandiff;

import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Declarative description of where each semantic field lives in a report row.
 *
 * A layout is plain configuration data: every {@link PlanDialect} owns one with
 * the header names and default positions of its columns. When the real header
 * row is available, {@link #resolve(List)} re-derives the positions by name so
 * that reports with additional columns (EXPLAIN ANALYZE adds {@code actRows},
 * {@code execution info}, {@code memory}, {@code disk}) still map correctly.
 *
 * Fields a dialect does not print (the v3 report has no access object column)
 * are simply absent; {@link #cell(List, Field)} returns an empty string for them.
 */
public final class ColumnLayout
{
    /** Semantic fields consumed by the assembler. */
    public enum Field { ID, EST_ROWS, TASK, ACCESS_OBJECT, OPERATOR_INFO }

    private final Map<Field, String> headers;
    private final Map<Field, Integer> positions;
    private final int columnCount;

    private ColumnLayout(Map<Field, String> headers, Map<Field, Integer> positions, int columnCount) {
        this.headers = Collections.unmodifiableMap(new EnumMap<>(headers));
        this.positions = Collections.unmodifiableMap(new EnumMap<>(positions));
        this.columnCount = columnCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    // --- Accessors ---
    public boolean has(Field field) { return positions.containsKey(field); }
    public String header(Field field) { return headers.get(field); }
    public int columnCount() { return columnCount; }

    /** Position of {@code field}, or -1 when the layout has no such column. */
    public int position(Field field) {
        Integer p = positions.get(field);
        return p == null ? -1 : p;
    }

    /** Trimmed cell for {@code field}, or "" when the column is absent from this layout. */
    public String cell(List<String> row, Field field) {
        int p = position(field);
        if (p < 0 || p >= row.size()) return "";
        return row.get(p).trim();
    }

    /** Untrimmed cell; the id column keeps its tree glyphs and padding for shape reconstruction. */
    public String rawCell(List<String> row, Field field) {
        int p = position(field);
        if (p < 0 || p >= row.size()) return "";
        return row.get(p);
    }

    /**
     * Re-derive column positions from the header cells of an actual report.
     *
     * Header names are compared trimmed and case-insensitively.
     *
     * @param headerCells header row split into cells
     * @return a layout with the same fields positioned as in {@code headerCells}
     * @throws PlanFormatException if a field of this layout is missing from the header
     */
    public ColumnLayout resolve(List<String> headerCells) throws PlanFormatException {
        Map<Field, Integer> resolved = new EnumMap<>(Field.class);
        for (Map.Entry<Field, String> e : headers.entrySet()) {
            int idx = indexOfHeader(headerCells, e.getValue());
            if (idx < 0) {
                throw new PlanFormatException("explain header is missing column '" + e.getValue()
                        + "': " + String.join("|", headerCells));
            }
            resolved.put(e.getKey(), idx);
        }
        return new ColumnLayout(headers, resolved, headerCells.size());
    }

    private static int indexOfHeader(List<String> headerCells, String name) {
        String wanted = name.toLowerCase(Locale.ROOT);
        for (int i = 0; i < headerCells.size(); i++) {
            if (headerCells.get(i).trim().toLowerCase(Locale.ROOT).equals(wanted)) return i;
        }
        return -1;
    }

    @Override
    public String toString() {
        return "ColumnLayout" + positions + " of " + columnCount;
    }

    /** Columns are positioned in the order they are declared. */
    public static final class Builder
    {
        private final Map<Field, String> headers = new EnumMap<>(Field.class);
        private final Map<Field, Integer> positions = new EnumMap<>(Field.class);
        private int next;

        private Builder() {}

        public Builder column(Field field, String header) {
            if (headers.containsKey(field)) {
                throw new IllegalArgumentException("column declared twice: " + field);
            }
            headers.put(field, header);
            positions.put(field, next++);
            return this;
        }

        public ColumnLayout build() {
            if (!headers.containsKey(Field.ID)) {
                throw new IllegalArgumentException("a layout needs an id column");
            }
            return new ColumnLayout(headers, positions, next);
        }
    }
}
