package com.ac.iisc.plandiff;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One node of a {@link Plan}.
 *
 * All variants share this class: {@link #getType()} is the discriminant and the
 * variant payload ({@link #getTable()}, {@link #getIndex()}, {@link #getJoinType()})
 * is {@code null} wherever it does not apply:
 * - TABLE_SCAN carries a table,
 * - INDEX_SCAN carries a table and an index,
 * - the join variants carry a join type.
 *
 * Instances are immutable and every child belongs to exactly one parent.
 */
public final class Operator
{
    private final String id;
    private final OperatorType type;
    private final double estRows;
    private final TaskType task;
    private final String table;
    private final String index;
    private final JoinType joinType;
    private final Map<String, String> attributes;
    private final List<Operator> children;

    private Operator(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id");
        this.type = Objects.requireNonNull(b.type, "type");
        this.task = Objects.requireNonNull(b.task, "task");
        if (!(b.estRows >= 0)) {
            throw new IllegalArgumentException("estimated rows of " + b.id + " must be >= 0 but was " + b.estRows);
        }
        this.estRows = b.estRows;
        boolean scan = type == OperatorType.TABLE_SCAN || type == OperatorType.INDEX_SCAN;
        this.table = scan ? nullToEmpty(b.table) : null;
        this.index = type == OperatorType.INDEX_SCAN ? nullToEmpty(b.index) : null;
        this.joinType = type.isJoin() ? (b.joinType == null ? JoinType.UNKNOWN : b.joinType) : null;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(b.attributes));
        this.children = List.copyOf(b.children);
    }

    public static Builder builder(String id, OperatorType type) {
        return new Builder(id, type);
    }

    // --- Getters ---
    public String getId() { return id; }
    public OperatorType getType() { return type; }
    public double getEstRows() { return estRows; }
    public TaskType getTask() { return task; }
    /** Scanned table for TABLE_SCAN and INDEX_SCAN, otherwise null. */
    public String getTable() { return table; }
    /** Scanned index for INDEX_SCAN, otherwise null. */
    public String getIndex() { return index; }
    /** Join kind for the join variants, otherwise null. */
    public JoinType getJoinType() { return joinType; }
    /** Key/value pairs extracted from the access object and operator info cells. */
    public Map<String, String> getAttributes() { return attributes; }
    public List<Operator> getChildren() { return children; }

    /** Indented rendering of this subtree, one operator per line: {@code <id>\t<estRows>}. */
    public String format(int indent) {
        StringBuilder sb = new StringBuilder();
        format(sb, indent);
        return sb.toString();
    }

    private void format(StringBuilder sb, int indent) {
        sb.append(" ".repeat(indent)).append(id).append('\t').append(estRows).append('\n');
        for (Operator child : children) {
            child.format(sb, indent + 4);
        }
    }

    @Override
    public String toString() {
        return id + "(" + type + ", " + task + ")";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    /** Collects the fields of one operator; children must be complete before {@link #build()}. */
    public static final class Builder
    {
        private final String id;
        private final OperatorType type;
        private double estRows;
        private TaskType task = TaskType.ROOT;
        private String table;
        private String index;
        private JoinType joinType;
        private Map<String, String> attributes = Map.of();
        private List<Operator> children = List.of();

        private Builder(String id, OperatorType type) {
            this.id = id;
            this.type = type;
        }

        public Builder estRows(double estRows) { this.estRows = estRows; return this; }
        public Builder task(TaskType task) { this.task = task; return this; }
        public Builder table(String table) { this.table = table; return this; }
        public Builder index(String index) { this.index = index; return this; }
        public Builder joinType(JoinType joinType) { this.joinType = joinType; return this; }
        public Builder attributes(Map<String, String> attributes) { this.attributes = attributes; return this; }
        public Builder children(List<Operator> children) { this.children = children; return this; }

        public Operator build() {
            return new Operator(this);
        }
    }
}
