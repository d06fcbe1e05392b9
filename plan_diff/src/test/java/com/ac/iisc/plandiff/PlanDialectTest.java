package com.ac.iisc.plandiff;

import org.junit.jupiter.api.Test;

import com.ac.iisc.plandiff.ColumnLayout.Field;

import static org.junit.jupiter.api.Assertions.*;

class PlanDialectTest
{
    @Test
    void headerWithEstRowsIsV4() {
        assertEquals(PlanDialect.V4, PlanDialect.identify("| id | estRows | task | access object | operator info |"));
        assertEquals(PlanDialect.V3, PlanDialect.identify("| id | count | task | operator info |"));
        // the marker is case-sensitive
        assertEquals(PlanDialect.V3, PlanDialect.identify("| id | ESTROWS | task |"));
    }

    @Test
    void versionStringsMatchCaseInsensitively() throws Exception {
        assertEquals(PlanDialect.V4, PlanDialect.matchVersion("5.7.25-TiDB-v4.0.8"));
        assertEquals(PlanDialect.V3, PlanDialect.matchVersion("5.7.25-TiDB-V3.0.12"));
        assertEquals(PlanDialect.V3, PlanDialect.matchVersion("v3"));
        assertEquals(PlanDialect.V4, PlanDialect.matchVersion(PlanDialect.V4.getTag()));
    }

    @Test
    void unknownVersionIsRejected() {
        UnsupportedVersionException ex = assertThrows(UnsupportedVersionException.class,
                () -> PlanDialect.matchVersion("9.9.9-Other"));
        assertEquals("9.9.9-Other", ex.getVersion());
        assertThrows(UnsupportedVersionException.class, () -> PlanDialect.matchVersion(null));
    }

    @Test
    void layoutsDifferOnlyInColumns() {
        ColumnLayout v3 = PlanDialect.V3.getLayout();
        ColumnLayout v4 = PlanDialect.V4.getLayout();
        assertEquals(4, v3.columnCount());
        assertEquals(5, v4.columnCount());
        assertEquals("count", v3.header(Field.EST_ROWS));
        assertEquals("estRows", v4.header(Field.EST_ROWS));
        assertFalse(v3.has(Field.ACCESS_OBJECT));
        assertEquals(3, v3.position(Field.OPERATOR_INFO));
        assertEquals(4, v4.position(Field.OPERATOR_INFO));
    }
}
