package com.ac.iisc.plandiff;

/**
 * Verdict of {@link PlanComparator#compare(Plan, Plan)}.
 *
 * @param reason first difference found, empty when {@code same} is true
 * @param same   whether the two plans are structurally equivalent
 */
public record PlanComparison(String reason, boolean same)
{
    static final PlanComparison SAME = new PlanComparison("", true);

    static PlanComparison different(String reason) {
        return new PlanComparison(reason, false);
    }
}
