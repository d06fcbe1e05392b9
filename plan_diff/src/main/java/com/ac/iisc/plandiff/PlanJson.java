package com.ac.iisc.plandiff;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

/**
 * JSON form of a {@link Plan}, used to keep baseline plans on disk so a later
 * server version can be checked against them without re-running the old one.
 *
 * Layout:
 * <pre>
 * {
 *   "sql": "select ...",
 *   "version": "v4",
 *   "root": {
 *     "id": "HashJoin_8", "type": "HASH_JOIN", "estRows": 12487.5, "task": "ROOT",
 *     "joinType": "INNER",
 *     "attributes": { "equal": "[eq(test.t1.a" },
 *     "children": [ ... ]
 *   }
 * }
 * </pre>
 * {@code table}, {@code index} and {@code joinType} are written only for the
 * operator variants that carry them.
 */
public final class PlanJson
{
    private PlanJson() {}

    public static String toJson(Plan plan) {
        JSONObject obj = new JSONObject();
        obj.put("sql", plan.getSql());
        obj.put("version", plan.getDialect().getTag());
        obj.put("root", toJson(plan.getRoot()));
        return obj.toString(2);
    }

    private static JSONObject toJson(Operator op) {
        JSONObject obj = new JSONObject();
        obj.put("id", op.getId());
        obj.put("type", op.getType().name());
        obj.put("estRows", op.getEstRows());
        obj.put("task", op.getTask().name());
        if (op.getTable() != null) obj.put("table", op.getTable());
        if (op.getIndex() != null) obj.put("index", op.getIndex());
        if (op.getJoinType() != null) obj.put("joinType", op.getJoinType().name());
        obj.put("attributes", new JSONObject(op.getAttributes()));
        JSONArray children = new JSONArray();
        for (Operator child : op.getChildren()) {
            children.put(toJson(child));
        }
        obj.put("children", children);
        return obj;
    }

    /**
     * Read a plan written by {@link #toJson(Plan)}.
     *
     * @throws PlanFormatException for malformed JSON, a missing or unknown field
     *         value, or a tree that breaks the plan invariants (duplicate ids,
     *         negative estimates)
     * @throws UnsupportedVersionException if the stored version tag is not supported
     */
    public static Plan fromJson(String json) throws PlanParseException {
        if (json == null || json.isBlank()) {
            throw new PlanFormatException("plan JSON is empty");
        }
        try {
            JSONObject obj = new JSONObject(json);
            PlanDialect dialect = PlanDialect.matchVersion(obj.getString("version"));
            Operator root = fromJson(obj.getJSONObject("root"), new HashSet<>());
            return new Plan(PlanParser.normalizeSql(obj.getString("sql")), dialect, root);
        } catch (JSONException | IllegalArgumentException ex) {
            throw new PlanFormatException("invalid plan JSON: " + ex.getMessage(), ex);
        }
    }

    private static Operator fromJson(JSONObject obj, Set<String> seenIds) throws PlanFormatException {
        String id = obj.getString("id");
        if (!seenIds.add(id)) {
            throw new PlanFormatException("duplicate operator id " + id);
        }

        List<Operator> children = new ArrayList<>();
        JSONArray arr = obj.optJSONArray("children");
        if (arr != null) {
            for (int i = 0; i < arr.length(); i++) {
                children.add(fromJson(arr.getJSONObject(i), seenIds));
            }
        }

        Map<String, String> attributes = new LinkedHashMap<>();
        JSONObject attrs = obj.optJSONObject("attributes");
        if (attrs != null) {
            for (String key : attrs.keySet()) {
                attributes.put(key, attrs.getString(key));
            }
        }

        Operator.Builder b = Operator.builder(id, OperatorType.valueOf(obj.getString("type")))
                .estRows(obj.getDouble("estRows"))
                .task(TaskType.valueOf(obj.getString("task")))
                .table(obj.optString("table", null))
                .index(obj.optString("index", null))
                .attributes(attributes)
                .children(children);
        if (obj.has("joinType")) {
            b.joinType(JoinType.valueOf(obj.getString("joinType")));
        }
        return b.build();
    }
}
