package com.ac.iisc.plandiff;

import java.util.List;
import java.util.Objects;

/**
 * Structural diff of two plans, typically the same statement explained by
 * two server versions.
 *
 * Rules:
 * - The normalized SQL must be identical, otherwise nothing else is compared.
 * - Walking both trees in pre-order, each operator pair must agree on type,
 *   task and number of children; scans must also read the same table (and
 *   the same index for index scans).
 * - Estimated row counts, ids and join kinds are not compared: they drift
 *   between versions without the plan changing shape.
 *
 * The walk stops at the first difference. Comparison never throws; every
 * mismatch is reported through {@link PlanComparison#reason()}.
 */
public final class PlanComparator
{
    static final String SQL_MISMATCH = "differing SQL text";

    private PlanComparator() {}

    public static PlanComparison compare(Plan p1, Plan p2) {
        if (!p1.getSql().equals(p2.getSql())) {
            return PlanComparison.different(SQL_MISMATCH);
        }
        return compare(p1.getRoot(), p2.getRoot());
    }

    /** Compare two subtrees; exposed for callers that diff fragments of a plan. */
    public static PlanComparison compare(Operator op1, Operator op2) {
        if (op1.getType() != op2.getType()) {
            return mismatch(op1, op2, "operator type", op1.getType(), op2.getType());
        }
        if (op1.getTask() != op2.getTask()) {
            return mismatch(op1, op2, "task", op1.getTask(), op2.getTask());
        }
        List<Operator> c1 = op1.getChildren();
        List<Operator> c2 = op2.getChildren();
        if (c1.size() != c2.size()) {
            return mismatch(op1, op2, "child count", c1.size(), c2.size());
        }

        switch (op1.getType()) {
            case TABLE_SCAN:
                if (!Objects.equals(op1.getTable(), op2.getTable())) {
                    return PlanComparison.different(op1.getId() + ":" + op1.getTable() + ", "
                            + op2.getId() + ":" + op2.getTable());
                }
                break;
            case INDEX_SCAN:
                if (!Objects.equals(op1.getTable(), op2.getTable()) || !Objects.equals(op1.getIndex(), op2.getIndex())) {
                    return PlanComparison.different(op1.getId() + ":" + op1.getTable() + "." + op1.getIndex() + ", "
                            + op2.getId() + ":" + op2.getTable() + "." + op2.getIndex());
                }
                break;
            default:
                break;
        }

        for (int i = 0; i < c1.size(); i++) {
            PlanComparison r = compare(c1.get(i), c2.get(i));
            if (!r.same()) {
                return r;
            }
        }
        return PlanComparison.SAME;
    }

    private static PlanComparison mismatch(Operator op1, Operator op2, String field, Object v1, Object v2) {
        return PlanComparison.different(op1.getId() + " and " + op2.getId() + " have different "
                + field + " (" + v1 + " vs " + v2 + ")");
    }
}
