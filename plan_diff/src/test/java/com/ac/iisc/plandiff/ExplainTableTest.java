package com.ac.iisc.plandiff;

import java.util.List;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExplainTableTest
{
    private static final String BORDER = "+----+-------+";

    @Test
    void extractsBlockBetweenFirstAndThirdBorder() throws Exception {
        String text = String.join("\n",
                "mysql> explain select 1;",
                BORDER,
                "| id | count |",
                BORDER,
                "| Projection_3 | 1.00 |",
                "| └─TableDual_4 | 1.00 |",
                BORDER,
                "2 rows in set (0.00 sec)",
                BORDER);
        ExplainTable table = ExplainTable.extract(text);

        assertEquals(6, table.lines().size());
        assertEquals(BORDER, table.lines().get(0));
        assertEquals(BORDER, table.lines().get(5));
        assertEquals("| id | count |", table.headerLine());
        assertEquals(table.lines().size() - 4, table.bodyLines().size());
        assertEquals(2, table.rows().size());
    }

    @Test
    void rowCountMatchesInteriorLines() throws Exception {
        for (int n = 0; n < 5; n++) {
            StringBuilder sb = new StringBuilder(BORDER).append("\r\n| id | count |\r\n").append(BORDER).append("\r\n");
            for (int i = 0; i < n; i++) {
                sb.append("| Op_").append(i).append(" | 1 |\r\n");
            }
            sb.append(BORDER);
            ExplainTable table = ExplainTable.extract(sb.toString());
            assertEquals(n, table.rows().size());
            assertEquals(table.lines().size() - 4, table.rows().size());
        }
    }

    @Test
    void fewerThanThreeBordersIsFormatError() {
        String truncated = BORDER + "\n| id | count |\n" + BORDER + "\n| Projection_3 | 1.00 |\n";
        PlanFormatException ex = assertThrows(PlanFormatException.class, () -> ExplainTable.extract(truncated));
        assertTrue(ex.getMessage().contains("found 2"));
        assertThrows(PlanFormatException.class, () -> ExplainTable.extract("ERROR 1105 (HY000): unknown"));
    }

    @Test
    void borderLineDetection() {
        assertTrue(ExplainTable.isBorderLine("  +---+--+  "));
        assertTrue(ExplainTable.isBorderLine("---"));
        assertFalse(ExplainTable.isBorderLine("   "));
        assertFalse(ExplainTable.isBorderLine("+---+ x"));
        assertFalse(ExplainTable.isBorderLine("| id |"));
    }

    @Test
    void splitRowKeepsEmptyCellsAndDropsOuterFields() throws Exception {
        List<String> cells = ExplainTable.splitRow("| TableFullScan_4 | 10000.00 | cop[tikv] |  | keep order:false |", 1);
        assertEquals(5, cells.size());
        assertEquals(" TableFullScan_4 ", cells.get(0));
        assertEquals("  ", cells.get(3));
        assertEquals(" keep order:false ", cells.get(4));
    }

    @Test
    void columnCountMismatchNamesTheLine() throws Exception {
        String text = String.join("\n", BORDER, "| id | count |", BORDER, "| A_1 | 1 |", "| B_2 | 1 | extra |", BORDER);
        ExplainTable table = ExplainTable.extract(text);
        PlanFormatException ex = assertThrows(PlanFormatException.class, table::rows);
        assertTrue(ex.getMessage().startsWith("line 5"), ex.getMessage());
        assertTrue(ex.getMessage().contains("B_2"));
    }

    @Test
    void undelimitedRowIsFormatError() throws Exception {
        String text = String.join("\n", BORDER, "| id | count |", BORDER, "A_1 | 1", BORDER);
        ExplainTable table = ExplainTable.extract(text);
        assertThrows(PlanFormatException.class, table::rows);
    }
}
