package com.ac.iisc.plandiff;

import java.util.Locale;

import com.ac.iisc.plandiff.ColumnLayout.Field;

/**
 * Report dialects understood by the parser, one per supported TiDB major line.
 *
 * The two dialects differ only in their column layouts:
 * - v3: {@code id | count | task | operator info}
 * - v4: {@code id | estRows | task | access object | operator info}
 *
 * Everything else (border handling, tree glyphs, operator naming) is shared,
 * so adding a dialect means adding a constant with its {@link ColumnLayout}.
 */
public enum PlanDialect
{
    V3("v3", ColumnLayout.builder()
            .column(Field.ID, "id")
            .column(Field.EST_ROWS, "count")
            .column(Field.TASK, "task")
            .column(Field.OPERATOR_INFO, "operator info")
            .build()),

    V4("v4", ColumnLayout.builder()
            .column(Field.ID, "id")
            .column(Field.EST_ROWS, "estRows")
            .column(Field.TASK, "task")
            .column(Field.ACCESS_OBJECT, "access object")
            .column(Field.OPERATOR_INFO, "operator info")
            .build());

    private final String tag;
    private final ColumnLayout layout;

    PlanDialect(String tag, ColumnLayout layout) {
        this.tag = tag;
        this.layout = layout;
    }

    public String getTag() { return tag; }
    public ColumnLayout getLayout() { return layout; }

    /**
     * Classify a report by its header row: v4 reports name the estimate column
     * {@code estRows} (case-sensitive), anything else is read as v3.
     */
    public static PlanDialect identify(String headerLine) {
        if (headerLine != null && headerLine.contains("estRows")) {
            return V4;
        }
        return V3;
    }

    /**
     * Map a free-text database version (e.g. {@code 5.7.25-TiDB-v4.0.8}) or a
     * dialect tag to a dialect. Matching is a case-insensitive substring test.
     *
     * @throws UnsupportedVersionException if neither "v3" nor "v4" occurs
     */
    public static PlanDialect matchVersion(String version) throws UnsupportedVersionException {
        String v = version == null ? "" : version.toLowerCase(Locale.ROOT);
        if (v.contains("v3")) {
            return V3;
        } else if (v.contains("v4")) {
            return V4;
        }
        throw new UnsupportedVersionException(version);
    }
}
