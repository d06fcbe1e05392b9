package com.ac.iisc.plandiff;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Objects;

/**
 * An operator tree reconstructed from one EXPLAIN report, paired with the
 * statement it explains. Built once by {@link PlanParser} (or read back by
 * {@link PlanJson}) and never mutated afterwards.
 */
public final class Plan
{
    private final String sql;
    private final PlanDialect dialect;
    private final Operator root;

    public Plan(String sql, PlanDialect dialect, Operator root) {
        this.sql = Objects.requireNonNull(sql, "sql");
        this.dialect = Objects.requireNonNull(dialect, "dialect");
        this.root = Objects.requireNonNull(root, "root");
    }

    /** Normalized statement text: no surrounding whitespace, no trailing ';'. */
    public String getSql() { return sql; }
    public PlanDialect getDialect() { return dialect; }
    public Operator getRoot() { return root; }

    /** All operators in depth-first pre-order, which is the row order of the source report. */
    public List<Operator> operators() {
        List<Operator> out = new ArrayList<>();
        Deque<Operator> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            Operator op = stack.pop();
            out.add(op);
            List<Operator> children = op.getChildren();
            for (int i = children.size() - 1; i >= 0; i--) {
                stack.push(children.get(i));
            }
        }
        return out;
    }

    /**
     * Human readable dump used in logs and regression reports:
     * <pre>
     * SQL: select * from t
     * TableReader_5	10000.0
     *     TableFullScan_4	10000.0
     * </pre>
     */
    public String format() {
        return "SQL: " + sql + "\n" + root.format(0);
    }

    @Override
    public String toString() {
        return format();
    }
}
