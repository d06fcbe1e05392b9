package com.ac.iisc.plandiff;

import org.json.JSONObject;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PlanJsonTest
{
    @Test
    void savedPlanComparesSameAsTheParsedOne() throws Exception {
        Plan plan = TestReports.parse("select t.a, s.b from t left join s on t.a = s.a where t.b > 1",
                "v4_analyze_index_join.explain");
        Plan reloaded = PlanJson.fromJson(PlanJson.toJson(plan));

        assertTrue(PlanComparator.compare(plan, reloaded).same());
        assertEquals(plan.format(), reloaded.format());
        assertEquals(PlanDialect.V4, reloaded.getDialect());

        Operator join = reloaded.getRoot().getChildren().get(0);
        assertEquals(JoinType.LEFT_OUTER, join.getJoinType());
        Operator indexScan = join.getChildren().get(1).getChildren().get(0);
        assertEquals("idx_a(a)", indexScan.getIndex());
        assertEquals(plan.getRoot().getChildren().get(0).getAttributes(), join.getAttributes());
    }

    @Test
    void writesPayloadOnlyForMatchingVariants() throws Exception {
        Plan plan = TestReports.parse(TestReports.HASH_JOIN_SQL, "v3_hash_join.explain");
        JSONObject root = new JSONObject(PlanJson.toJson(plan)).getJSONObject("root");

        assertEquals("HASH_JOIN", root.getString("type"));
        assertEquals("INNER", root.getString("joinType"));
        assertFalse(root.has("table"));

        JSONObject reader = root.getJSONArray("children").getJSONObject(0);
        assertFalse(reader.has("joinType"));
        JSONObject scan = reader.getJSONArray("children").getJSONObject(0).getJSONArray("children").getJSONObject(0);
        assertEquals("t2", scan.getString("table"));
        assertFalse(scan.has("index"));
    }

    @Test
    void malformedJsonIsFormatError() {
        assertThrows(PlanFormatException.class, () -> PlanJson.fromJson("{not json"));
        assertThrows(PlanFormatException.class, () -> PlanJson.fromJson(""));
        assertThrows(PlanFormatException.class,
                () -> PlanJson.fromJson("{\"sql\":\"select 1\",\"version\":\"v4\"}"));
        assertThrows(PlanFormatException.class, () -> PlanJson.fromJson(
                "{\"sql\":\"select 1\",\"version\":\"v4\",\"root\":{\"id\":\"X_1\",\"type\":\"NOPE\",\"estRows\":1,\"task\":\"ROOT\"}}"));
        assertThrows(PlanFormatException.class, () -> PlanJson.fromJson(
                "{\"sql\":\"select 1\",\"version\":\"v4\",\"root\":{\"id\":\"X_1\",\"type\":\"UNKNOWN\",\"estRows\":-1,\"task\":\"ROOT\"}}"));
    }

    @Test
    void unsupportedStoredVersion() {
        assertThrows(UnsupportedVersionException.class, () -> PlanJson.fromJson(
                "{\"sql\":\"select 1\",\"version\":\"v9\",\"root\":{\"id\":\"X_1\",\"type\":\"UNKNOWN\",\"estRows\":1,\"task\":\"ROOT\"}}"));
    }

    @Test
    void duplicateIdsAreRejected() {
        String json = "{\"sql\":\"select 1\",\"version\":\"v3\",\"root\":{\"id\":\"X_1\",\"type\":\"UNKNOWN\","
                + "\"estRows\":1,\"task\":\"ROOT\",\"children\":[{\"id\":\"X_1\",\"type\":\"UNKNOWN\","
                + "\"estRows\":1,\"task\":\"ROOT\"}]}}";
        PlanFormatException ex = assertThrows(PlanFormatException.class, () -> PlanJson.fromJson(json));
        assertTrue(ex.getMessage().contains("X_1"));
    }
}
