package com.ac.iisc.plandiff;

import java.util.List;
import java.util.stream.Collectors;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanComparatorTest
{
    private static final String V4 = TestReports.read("v4_hash_join.explain");

    private static Plan v4(String text) throws PlanParseException {
        return PlanParser.parseText(TestReports.HASH_JOIN_SQL, text);
    }

    @Test
    void identicalReportsAreSame() throws Exception {
        PlanComparison cmp = PlanComparator.compare(v4(V4), v4(V4));
        assertTrue(cmp.same());
        assertEquals("", cmp.reason());
    }

    @Test
    void sameShapeAcrossDialectsIsSame() throws Exception {
        Plan v3 = TestReports.parse(TestReports.HASH_JOIN_SQL, "v3_hash_join.explain");
        PlanComparison cmp = PlanComparator.compare(v3, v4(V4));
        assertTrue(cmp.same(), cmp.reason());
    }

    @Test
    void differentSqlStopsBeforeTraversal() throws Exception {
        Plan other = PlanParser.parseText("select * from t2 join t1 on t1.a = t2.a", V4);
        PlanComparison cmp = PlanComparator.compare(v4(V4), other);
        assertFalse(cmp.same());
        assertEquals("differing SQL text", cmp.reason());
    }

    @Test
    void renamedTableOnLeafScan() throws Exception {
        Plan renamed = v4(V4.replace("table:t1", "table:t3"));
        PlanComparison cmp = PlanComparator.compare(v4(V4), renamed);
        assertFalse(cmp.same());
        assertEquals("TableFullScan_10:t1, TableFullScan_10:t3", cmp.reason());
    }

    @Test
    void differentDepthReportsChildCount() throws Exception {
        String shallower = V4.lines()
                .filter(line -> !line.contains("TableFullScan_10"))
                .collect(Collectors.joining("\n"));
        assertNotEquals(V4, shallower);
        PlanComparison cmp = PlanComparator.compare(v4(V4), v4(shallower));
        assertFalse(cmp.same());
        assertTrue(cmp.reason().startsWith("Selection_11 and Selection_11"), cmp.reason());
        assertTrue(cmp.reason().contains("child count (1 vs 0)"), cmp.reason());
    }

    @Test
    void taskMismatchNamesBothOperators() throws Exception {
        Plan tiflash = v4(V4.replace("cop[tikv]", "cop[tiflash]"));
        PlanComparison cmp = PlanComparator.compare(v4(V4), tiflash);
        assertFalse(cmp.same());
        assertEquals("Selection_14 and Selection_14 have different task (STORAGE_ENGINE vs COLUMNAR_ENGINE)", cmp.reason());
    }

    @Test
    void indexScanComparesIndex() throws Exception {
        String sql = "select t.a, s.b from t left join s on t.a = s.a where t.b > 1";
        String text = TestReports.read("v4_analyze_index_join.explain");
        Plan p1 = PlanParser.parseText(sql, text);
        Plan p2 = PlanParser.parseText(sql, text.replace("index:idx_a(a)", "index:idx_b(a)"));
        PlanComparison cmp = PlanComparator.compare(p1, p2);
        assertFalse(cmp.same());
        assertEquals("IndexRangeScan_8(Build):s.idx_a(a), IndexRangeScan_8(Build):s.idx_b(a)", cmp.reason());
    }

    @Test
    void firstDifferenceWins() {
        Operator left = Operator.builder("HashJoin_1", OperatorType.HASH_JOIN)
                .children(List.of(
                        Operator.builder("TableReader_2", OperatorType.TABLE_READER).build(),
                        Operator.builder("Selection_3", OperatorType.SELECTION).build()))
                .build();
        Operator right = Operator.builder("MergeJoin_1", OperatorType.MERGE_JOIN)
                .children(List.of(
                        Operator.builder("IndexReader_2", OperatorType.INDEX_READER).build()))
                .build();
        PlanComparison cmp = PlanComparator.compare(left, right);
        assertEquals("HashJoin_1 and MergeJoin_1 have different operator type (HASH_JOIN vs MERGE_JOIN)", cmp.reason());
    }

    @Test
    void estimatesAndIdsAreIgnored() {
        Operator a = Operator.builder("TableFullScan_4", OperatorType.TABLE_SCAN)
                .estRows(10).task(TaskType.STORAGE_ENGINE).table("t").build();
        Operator b = Operator.builder("TableScan_9", OperatorType.TABLE_SCAN)
                .estRows(12345.6).task(TaskType.STORAGE_ENGINE).table("t").build();
        assertSame(PlanComparison.SAME, PlanComparator.compare(a, b));
    }
}
