package com.ac.iisc.plandiff;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Maps the free text of a report row onto the typed operator model.
 *
 * Classification is deliberately lenient: later server versions keep adding
 * operators (e.g. {@code TableFullScan}, {@code IndexRangeScan},
 * {@code ExchangeSender}) and the parser must keep working on them, so an
 * unrecognised name is {@link OperatorType#UNKNOWN}, an unrecognised task is
 * {@link TaskType#STORAGE_ENGINE} and an unparsable attribute is skipped.
 */
public final class OperatorClassifier
{
    private static final String COLUMNAR_STORE = "tiflash";

    private OperatorClassifier() {}

    /**
     * Classify an operator id by case-insensitive substrings.
     *
     * Rule order matters and must not be changed: the join family is tested
     * first, so {@code IndexHashJoin_7} is a hash join, and {@code IndexJoin_9}
     * is an index join rather than something from the index family.
     */
    public static OperatorType matchOpType(String opId) {
        String x = opId.toLowerCase(Locale.ROOT);
        if (x.contains("join")) {
            if (x.contains("hash")) {
                return OperatorType.HASH_JOIN;
            } else if (x.contains("merge")) {
                return OperatorType.MERGE_JOIN;
            } else if (x.contains("index")) {
                return OperatorType.INDEX_JOIN;
            }
            return OperatorType.UNKNOWN;
        }
        if (x.contains("table")) {
            if (x.contains("reader")) {
                return OperatorType.TABLE_READER;
            } else if (x.contains("scan")) {
                return OperatorType.TABLE_SCAN;
            }
            return OperatorType.UNKNOWN;
        }
        if (x.contains("index")) {
            if (x.contains("reader")) {
                return OperatorType.INDEX_READER;
            } else if (x.contains("scan")) {
                return OperatorType.INDEX_SCAN;
            } else if (x.contains("lookup")) {
                return OperatorType.INDEX_LOOKUP;
            }
            return OperatorType.UNKNOWN;
        }
        if (x.contains("selection")) {
            return OperatorType.SELECTION;
        }
        if (x.contains("projection")) {
            return OperatorType.PROJECTION;
        }
        if (x.contains("point")) {
            return OperatorType.POINT_GET;
        }
        return OperatorType.UNKNOWN;
    }

    /** {@code root}, anything mentioning the columnar store, or the row store by default. */
    public static TaskType parseTaskType(String taskStr) {
        String task = taskStr.trim().toLowerCase(Locale.ROOT);
        if (task.equals("root")) {
            return TaskType.ROOT;
        }
        if (task.contains(COLUMNAR_STORE)) {
            return TaskType.COLUMNAR_ENGINE;
        }
        return TaskType.STORAGE_ENGINE;
    }

    /**
     * Extract {@code key:value} pairs from an access-object or operator-info cell.
     *
     * The cell is split on ',' and every entry on ':'. Only entries that split
     * into exactly two parts are kept (both sides trimmed); {@code a:b:c} and
     * fragments such as the {@code 2]} of {@code range:[1,2]} are dropped.
     *
     * @return pairs in encounter order; a later duplicate key overwrites an earlier one
     */
    public static Map<String, String> splitKVs(String kvStr) {
        Map<String, String> kvMap = new LinkedHashMap<>();
        for (String kv : kvStr.split(",", -1)) {
            String[] fields = kv.split(":", -1);
            if (fields.length == 2) {
                kvMap.put(fields[0].trim(), fields[1].trim());
            }
        }
        return kvMap;
    }

    /**
     * Join kind from a join operator's info cell: the first comma-separated
     * entry that names a join kind, e.g. {@code left outer join, equal:[...]}.
     */
    public static JoinType parseJoinType(String operatorInfo) {
        for (String entry : operatorInfo.split(",", -1)) {
            JoinType jt = JoinType.fromText(entry);
            if (jt != JoinType.UNKNOWN) return jt;
        }
        return JoinType.UNKNOWN;
    }
}
