package com.ac.iisc.plandiff;

import java.util.Locale;

/**
 * Logical join kind printed at the start of a join operator's info column,
 * e.g. {@code inner join, equal:[eq(test.t1.a, test.t2.a)]}.
 */
public enum JoinType
{
    UNKNOWN(""),
    INNER("inner join"),
    LEFT_OUTER("left outer join"),
    RIGHT_OUTER("right outer join"),
    SEMI("semi join"),
    ANTI_SEMI("anti semi join"),
    LEFT_OUTER_SEMI("left outer semi join"),
    ANTI_LEFT_OUTER_SEMI("anti left outer semi join");

    private final String text;

    JoinType(String text) {
        this.text = text;
    }

    /** Text the server prints for this join kind (empty for UNKNOWN). */
    public String getText() {
        return text;
    }

    /**
     * Match one trimmed operator-info entry against the known join texts.
     * Returns {@link #UNKNOWN} when the entry names no join kind.
     */
    public static JoinType fromText(String entry) {
        if (entry == null) return UNKNOWN;
        String e = entry.trim().toLowerCase(Locale.ROOT);
        if (e.isEmpty()) return UNKNOWN;
        for (JoinType jt : values()) {
            if (jt != UNKNOWN && jt.text.equals(e)) return jt;
        }
        return UNKNOWN;
    }
}
