package com.ac.iisc.plandiff;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * The bordered tabular block of an EXPLAIN report, isolated from whatever
 * surrounds it (client prompts, the echoed statement, "N rows in set" footers).
 *
 * Shape of the extracted block:
 * <pre>
 * +----+---------+------+---------------+
 * | id | estRows | task | operator info |   header
 * +----+---------+------+---------------+
 * | ...                                 |   zero or more body rows
 * +----+---------+------+---------------+
 * </pre>
 * Instances are immutable.
 */
public final class ExplainTable
{
    private final List<String> lines;
    private final int firstLineNo;

    private ExplainTable(List<String> lines, int firstLineNo) {
        this.lines = List.copyOf(lines);
        this.firstLineNo = firstLineNo;
    }

    /**
     * Isolate the block from the first border line through the third one, inclusive.
     *
     * @param explainText raw report text; {@code \n} and {@code \r\n} line ends are accepted
     * @throws PlanFormatException if fewer than three border lines are present
     */
    public static ExplainTable extract(String explainText) throws PlanFormatException {
        if (explainText == null) {
            throw new PlanFormatException("invalid explain result: no text");
        }
        String[] all = explainText.split("\r?\n", -1);
        int[] idx = new int[3];
        int found = 0;
        for (int i = 0; i < all.length && found < 3; i++) {
            if (isBorderLine(all[i])) {
                idx[found++] = i;
            }
        }
        if (found != 3) {
            throw new PlanFormatException("invalid explain result: expected 3 border lines, found " + found);
        }
        return new ExplainTable(Arrays.asList(all).subList(idx[0], idx[2] + 1), idx[0] + 1);
    }

    /** A border line is non-empty after trimming and made only of '+' and '-'. */
    public static boolean isBorderLine(String line) {
        String t = line.trim();
        if (t.isEmpty()) return false;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c != '+' && c != '-') return false;
        }
        return true;
    }

    // --- Views over the block ---

    /** Every extracted line, top border through bottom border. */
    public List<String> lines() { return lines; }

    public String headerLine() { return lines.get(1); }

    /** Body lines between the header separator and the bottom border. */
    public List<String> bodyLines() {
        return lines.subList(3, lines.size() - 1);
    }

    public List<String> headerCells() throws PlanFormatException {
        return splitRow(headerLine(), firstLineNo + 1);
    }

    public PlanDialect dialect() {
        return PlanDialect.identify(headerLine());
    }

    /**
     * Split every body line into its cells. Each row must have as many cells
     * as the header; row order is kept because it is the tree's pre-order.
     *
     * @throws PlanFormatException for a line that is not delimited by '|' or
     *         whose column count differs from the header's
     */
    public List<List<String>> rows() throws PlanFormatException {
        int expected = headerCells().size();
        List<String> body = bodyLines();
        List<List<String>> rows = new ArrayList<>(body.size());
        for (int i = 0; i < body.size(); i++) {
            int lineNo = firstLineNo + 3 + i;
            List<String> cells = splitRow(body.get(i), lineNo);
            if (cells.size() != expected) {
                throw new PlanFormatException("line " + lineNo + ": expected " + expected
                        + " columns but found " + cells.size() + ": " + body.get(i));
            }
            rows.add(cells);
        }
        return rows;
    }

    /**
     * Split one bordered line on '|', dropping the empty fields outside the
     * bounding delimiters. Cells are returned untrimmed.
     *
     * @param lineNo 1-based line number used in the error message
     */
    static List<String> splitRow(String line, int lineNo) throws PlanFormatException {
        String s = line.strip();
        if (s.length() < 2 || s.charAt(0) != '|' || s.charAt(s.length() - 1) != '|') {
            throw new PlanFormatException("line " + lineNo + ": not a table row: " + line);
        }
        String[] cols = s.split("\\|", -1);
        return List.of(Arrays.copyOfRange(cols, 1, cols.length - 1));
    }
}
