package com.solidfire.log.filter;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.solidfire.log.parser.model.FlatRecord;

/**
 * Gives a list of records one common schema: the union of their field names, in order
 * of first appearance, with missing fields present as null.
 */
public class SchemaReconciler {

    public static Set<String> unionFields(List<FlatRecord> records) {
        Set<String> fields = new LinkedHashSet<>();
        for (FlatRecord record : records) {
            fields.addAll(record.getFieldNames());
        }
        return fields;
    }

    public static List<FlatRecord> reconcile(List<FlatRecord> records) {
        Set<String> fields = unionFields(records);
        List<FlatRecord> result = new ArrayList<>(records.size());
        for (FlatRecord record : records) {
            Map<String, String> values = new LinkedHashMap<>();
            for (String field : fields) {
                values.put(field, record.get(field));
            }
            result.add(FlatRecord.fromMap(values));
        }
        return result;
    }
}
