package com.solidfire.log.parser.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Flattened representation of a single log line: field name to string value (or null).
 * The set of fields is discovered per line, so this is a map wrapper rather than a fixed
 * structure. Records are writable only until {@link #freeze()} is called, which happens
 * before a record is placed into a {@link Chunk}.
 */
public class FlatRecord {

    public static final String LINE_NUMBER = "line_number";
    public static final String TIMESTAMP = "timestamp";
    public static final String COMPONENT = "component";
    public static final String RAW_LINE = "raw_line";
    public static final String DETAILS_SUFFIX = "details";

    private final Map<String, String> fields = new LinkedHashMap<>();
    private boolean frozen = false;

    public FlatRecord(long lineNumber) {
        fields.put(LINE_NUMBER, Long.toString(lineNumber));
    }

    private FlatRecord() {
    }

    /**
     * Rebuilds a record from previously emitted data, e.g. a chunk file. The result is frozen.
     */
    public static FlatRecord fromMap(Map<String, String> values) {
        FlatRecord record = new FlatRecord();
        record.fields.putAll(values);
        record.frozen = true;
        return record;
    }

    /**
     * Sets a field, replacing any previous value.
     */
    public void put(String field, String value) {
        checkWritable();
        fields.put(field, value);
    }

    /**
     * Sets a field only if no field of that exact name exists yet.
     * @return true if the value was stored
     */
    public boolean putIfAbsent(String field, String value) {
        checkWritable();
        if (fields.containsKey(field)) {
            return false;
        }
        fields.put(field, value);
        return true;
    }

    public String get(String field) {
        return fields.get(field);
    }

    public boolean has(String field) {
        return fields.containsKey(field);
    }

    public boolean isNonNull(String field) {
        return fields.get(field) != null;
    }

    public long getLineNumber() {
        String value = fields.get(LINE_NUMBER);
        if (value == null) {
            return -1;
        }
        try {
            return Long.parseLong(value);
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    public Set<String> getFieldNames() {
        return Collections.unmodifiableSet(fields.keySet());
    }

    public Map<String, String> asMap() {
        return Collections.unmodifiableMap(fields);
    }

    public int size() {
        return fields.size();
    }

    public FlatRecord freeze() {
        frozen = true;
        return this;
    }

    public boolean isFrozen() {
        return frozen;
    }

    private void checkWritable() {
        if (frozen) {
            throw new IllegalStateException("Record for line " + fields.get(LINE_NUMBER) + " is already frozen");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        return Objects.equals(fields, ((FlatRecord) o).fields);
    }

    @Override
    public int hashCode() {
        return fields.hashCode();
    }

    @Override
    public String toString() {
        return fields.toString();
    }
}
