package com.ac.iisc.plandiff;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.ac.iisc.plandiff.ColumnLayout.Field;

/**
 * Turns TiDB EXPLAIN output into a {@link Plan}.
 *
 * Pipeline:
 * 1) {@link ExplainTable#extract(String)} isolates the bordered block.
 * 2) {@link PlanDialect#identify(String)} picks v3 or v4 from the header row.
 * 3) The dialect's {@link ColumnLayout} is resolved against the header.
 * 4) {@link PlanTreeBuilder} recovers the shape from the id column while
 *    {@link OperatorClassifier} types each row.
 *
 * Both dialects go through the same {@link #assemble} step; the only thing a
 * dialect contributes is its column layout. Every method is a pure function
 * of its arguments and safe to call from any number of threads.
 */
public final class PlanParser
{
    private static final String NO_ESTIMATE = "N/A";

    private PlanParser() {}

    /**
     * Parse a complete report as printed by a MySQL client, borders included.
     *
     * @param sql statement that was explained; normalized with {@link #normalizeSql(String)}
     * @param explainText raw report text
     * @throws PlanFormatException if the text is not a well-formed report
     */
    public static Plan parseText(String sql, String explainText) throws PlanParseException {
        ExplainTable table = ExplainTable.extract(explainText);
        PlanDialect dialect = table.dialect();
        ColumnLayout layout = dialect.getLayout().resolve(table.headerCells());
        return assemble(dialect, layout, normalizeSql(sql), table.rows());
    }

    /**
     * Parse rows that were already split into cells, e.g. read straight from a
     * JDBC result set. Cells are expected in the dialect's default column order.
     *
     * @param version version string or dialect tag, e.g. {@code 5.7.25-TiDB-v4.0.8} or {@code v3}
     * @throws UnsupportedVersionException if the version names no supported dialect
     * @throws PlanFormatException if a row has fewer cells than the dialect needs
     */
    public static Plan parse(String version, String sql, List<List<String>> explainRows) throws PlanParseException {
        PlanDialect dialect = PlanDialect.matchVersion(version);
        ColumnLayout layout = dialect.getLayout();
        for (int i = 0; i < explainRows.size(); i++) {
            if (explainRows.get(i).size() < layout.columnCount()) {
                throw new PlanFormatException("row " + (i + 1) + ": expected " + layout.columnCount()
                        + " columns for " + dialect.getTag() + " but found " + explainRows.get(i).size());
            }
        }
        return assemble(dialect, layout, normalizeSql(sql), explainRows);
    }

    /** Strip surrounding whitespace and one trailing ';'. */
    public static String normalizeSql(String sql) {
        String s = sql == null ? "" : sql.trim();
        if (s.endsWith(";")) {
            s = s.substring(0, s.length() - 1).trim();
        }
        return s;
    }

    // --- Assembly ---

    private static Plan assemble(PlanDialect dialect, ColumnLayout layout, String sql, List<List<String>> rows)
            throws PlanParseException {
        Set<String> seenIds = new HashSet<>();
        Operator root = PlanTreeBuilder.build(rows, layout.position(Field.ID),
                (rowNo, children) -> toOperator(layout, rows.get(rowNo), rowNo, children, seenIds));
        return new Plan(sql, dialect, root);
    }

    private static Operator toOperator(ColumnLayout layout, List<String> row, int rowNo,
                                       List<Operator> children, Set<String> seenIds) throws PlanFormatException {
        String id = PlanTreeBuilder.extractOperatorId(layout.rawCell(row, Field.ID));
        if (id.isEmpty()) {
            throw new PlanFormatException("row " + (rowNo + 1) + " has an empty operator id");
        }
        if (!seenIds.add(id)) {
            throw new PlanFormatException("row " + (rowNo + 1) + ": duplicate operator id " + id);
        }

        OperatorType type = OperatorClassifier.matchOpType(id);
        String operatorInfo = layout.cell(row, Field.OPERATOR_INFO);

        // access object wins over operator info for keys present in both
        Map<String, String> attributes = new LinkedHashMap<>();
        if (layout.has(Field.ACCESS_OBJECT)) {
            attributes.putAll(OperatorClassifier.splitKVs(layout.cell(row, Field.ACCESS_OBJECT)));
        }
        OperatorClassifier.splitKVs(operatorInfo).forEach(attributes::putIfAbsent);

        Operator.Builder b = Operator.builder(id, type)
                .estRows(parseEstRows(layout.cell(row, Field.EST_ROWS), id))
                .task(OperatorClassifier.parseTaskType(layout.cell(row, Field.TASK)))
                .table(attributes.get("table"))
                .index(attributes.get("index"))
                .attributes(attributes)
                .children(children);
        if (type.isJoin()) {
            b.joinType(OperatorClassifier.parseJoinType(operatorInfo));
        }
        return b.build();
    }

    /** DML operators print N/A (or nothing) where the estimator gave no figure; read as zero. */
    private static double parseEstRows(String text, String opId) throws PlanFormatException {
        if (text.isEmpty() || text.equalsIgnoreCase(NO_ESTIMATE)) {
            return 0;
        }
        double v;
        try {
            v = Double.parseDouble(text);
        } catch (NumberFormatException e) {
            throw new PlanFormatException("invalid estimated row count '" + text + "' for " + opId, e);
        }
        if (!(v >= 0) || Double.isInfinite(v)) {
            throw new PlanFormatException("invalid estimated row count '" + text + "' for " + opId);
        }
        return v;
    }
}
