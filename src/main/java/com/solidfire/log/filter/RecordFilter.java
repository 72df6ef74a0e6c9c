package com.solidfire.log.filter;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.solidfire.log.parser.model.FlatRecord;

/**
 * Selects flat records by time window and by exact field values.
 */
public class RecordFilter {

    public static final String NULL_VALUE = "null";

    private final TimeFilter timeFilter;
    private final List<FieldMatch> fieldMatches;

    public RecordFilter(TimeFilter timeFilter, List<FieldMatch> fieldMatches) {
        this.timeFilter = timeFilter != null && timeFilter.isActive() ? timeFilter : null;
        this.fieldMatches = fieldMatches == null ? Collections.emptyList() : new ArrayList<>(fieldMatches);
    }

    public boolean matches(FlatRecord record) {
        if (timeFilter != null && !timeFilter.matches(record)) {
            return false;
        }
        for (FieldMatch match : fieldMatches) {
            if (!match.matches(record)) {
                return false;
            }
        }
        return true;
    }

    public List<FlatRecord> filter(List<FlatRecord> records) {
        List<FlatRecord> result = new ArrayList<>();
        for (FlatRecord record : records) {
            if (matches(record)) {
                result.add(record);
            }
        }
        return result;
    }

    public boolean hasTimeFilter() {
        return timeFilter != null;
    }

    public List<FieldMatch> getFieldMatches() {
        return Collections.unmodifiableList(fieldMatches);
    }

    /**
     * Parses {@code field=value}. The value may be empty or contain further '=' characters.
     * @throws IllegalArgumentException if there is no '=' or the field name is empty
     */
    public static FieldMatch parseFieldMatch(String expression) {
        int eq = expression.indexOf('=');
        if (eq <= 0) {
            throw new IllegalArgumentException("Invalid field filter format (expected field=value): " + expression);
        }
        return new FieldMatch(expression.substring(0, eq), expression.substring(eq + 1));
    }

    /**
     * A single field=value condition. The record must carry the field; a null value only
     * matches "null", other values match exactly or as equal numbers.
     */
    public static class FieldMatch {
        private final String field;
        private final String value;

        public FieldMatch(String field, String value) {
            this.field = field;
            this.value = value;
        }

        public boolean matches(FlatRecord record) {
            if (!record.has(field)) {
                return false;
            }
            String actual = record.get(field);
            if (actual == null) {
                return NULL_VALUE.equals(value);
            }
            if (actual.equals(value)) {
                return true;
            }
            BigDecimal actualNumber = toNumber(actual);
            BigDecimal expectedNumber = toNumber(value);
            return actualNumber != null && expectedNumber != null && actualNumber.compareTo(expectedNumber) == 0;
        }

        private static BigDecimal toNumber(String s) {
            try {
                return new BigDecimal(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }

        public String getField() {
            return field;
        }

        public String getValue() {
            return value;
        }

        @Override
        public String toString() {
            return field + "=" + value;
        }
    }
}
