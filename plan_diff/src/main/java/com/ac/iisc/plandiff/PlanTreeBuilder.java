package com.ac.iisc.plandiff;

import java.util.ArrayList;
import java.util.List;

/**
 * Rebuilds parent/child links from the tree glyphs drawn in the id column.
 *
 * A report has no parent pointers; the shape is only visible as indentation:
 * <pre>
 *  HashJoin_8
 *  ├─TableReader_15(Build)
 *  │ └─TableFullScan_13
 *  └─TableReader_12(Probe)
 *    └─TableFullScan_10
 * </pre>
 * For a parent row, its <em>anchor column</em> is the offset of the first letter
 * in its id cell. Scanning downward, a '├' or '└' at that offset marks a direct
 * child, a '│' marks a row further down the same subtree, and anything else
 * means the subtree has ended.
 *
 * All offsets are code point offsets, never byte offsets: the glyphs are
 * multi-byte once encoded.
 */
public final class PlanTreeBuilder
{
    private static final int BRANCH = '├';
    private static final int LAST_BRANCH = '└';
    private static final int VERTICAL = '│';
    private static final int HORIZONTAL = '─';

    private PlanTreeBuilder() {}

    /** Creates one node once the nodes of all its children exist. */
    @FunctionalInterface
    public interface NodeFactory<T>
    {
        T create(int rowNo, List<T> children) throws PlanParseException;
    }

    /**
     * Build the tree rooted at row 0.
     *
     * Every row must be reached exactly once; a row left detached from the
     * root's tree, or claimed by two parents, means the glyphs are corrupt.
     *
     * @param rows split report rows in report order
     * @param idColNo index of the id column within a row
     * @param factory turns a row and its finished children into a node
     * @return the root node
     * @throws PlanFormatException if there are no rows or the shape is inconsistent
     */
    public static <T> T build(List<List<String>> rows, int idColNo, NodeFactory<T> factory)
            throws PlanParseException {
        if (rows.isEmpty()) {
            throw new PlanFormatException("explain result has no operator rows");
        }
        boolean[] visited = new boolean[rows.size()];
        T root = build(rows, 0, idColNo, factory, visited);
        for (int i = 0; i < visited.length; i++) {
            if (!visited[i]) {
                throw new PlanFormatException("row " + (i + 1) + " is not attached to the plan tree: "
                        + extractOperatorId(rows.get(i).get(idColNo)));
            }
        }
        return root;
    }

    private static <T> T build(List<List<String>> rows, int rowNo, int idColNo,
                               NodeFactory<T> factory, boolean[] visited) throws PlanParseException {
        if (visited[rowNo]) {
            throw new PlanFormatException("row " + (rowNo + 1) + " is claimed by more than one parent");
        }
        visited[rowNo] = true;
        List<Integer> childRows = findChildRowNos(rows, rowNo, idColNo);
        List<T> children = new ArrayList<>(childRows.size());
        for (int childRow : childRows) {
            children.add(build(rows, childRow, idColNo, factory, visited));
        }
        return factory.create(rowNo, children);
    }

    /**
     * Row numbers of the direct children of {@code parentRowNo}, ascending.
     * Returns an empty list for a leaf, including a row whose id cell has no letter.
     */
    public static List<Integer> findChildRowNos(List<List<String>> rows, int parentRowNo, int idColNo) {
        int col = anchorColumn(rows.get(parentRowNo).get(idColNo));
        if (col < 0) {
            return List.of();
        }
        List<Integer> childRowNos = new ArrayList<>(2);
        for (int i = parentRowNo + 1; i < rows.size(); i++) {
            int[] field = rows.get(i).get(idColNo).codePoints().toArray();
            int c = col < field.length ? field[col] : -1;
            if (c == BRANCH || c == LAST_BRANCH) {
                childRowNos.add(i);
            } else if (c != VERTICAL) {
                break;
            }
        }
        return childRowNos;
    }

    /** Code point offset of the first letter in {@code field}, or -1 if it has none. */
    public static int anchorColumn(String field) {
        int[] cps = field.codePoints().toArray();
        for (int i = 0; i < cps.length; i++) {
            if (Character.isLetter(cps[i])) return i;
        }
        return -1;
    }

    /** The operator id with tree glyphs and padding stripped from both ends. */
    public static String extractOperatorId(String field) {
        int[] cps = field.codePoints().toArray();
        int start = 0;
        int end = cps.length;
        while (start < end && isTreeGlyph(cps[start])) start++;
        while (end > start && isTreeGlyph(cps[end - 1])) end--;
        return new String(cps, start, end - start);
    }

    private static boolean isTreeGlyph(int c) {
        return c == LAST_BRANCH || c == HORIZONTAL || c == VERTICAL || c == BRANCH || c == ' ';
    }
}
