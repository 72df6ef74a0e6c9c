package com.solidfire.log.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.solidfire.log.parser.model.FlatRecord;

public class SchemaReconcilerTest {

    private static FlatRecord record(String... keyValues) {
        Map<String, String> values = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            values.put(keyValues[i], keyValues[i + 1]);
        }
        return FlatRecord.fromMap(values);
    }

    @Test
    public void testReconcile() {
        List<FlatRecord> reconciled = SchemaReconciler.reconcile(List.of(
                record("line_number", "1", "a", "x"),
                record("line_number", "2", "b", "y")));

        assertEquals(List.of("line_number", "a", "b"), List.copyOf(reconciled.get(1).getFieldNames()));
        assertNull(reconciled.get(0).get("b"));
        assertTrue(reconciled.get(0).has("b"));
        assertNull(reconciled.get(1).get("a"));
        assertEquals("y", reconciled.get(1).get("b"));
    }

    @Test
    public void testEmpty() {
        assertTrue(SchemaReconciler.reconcile(List.of()).isEmpty());
        assertTrue(SchemaReconciler.unionFields(List.of()).isEmpty());
    }
}
