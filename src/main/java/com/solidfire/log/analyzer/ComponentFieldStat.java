package com.solidfire.log.analyzer;

import java.util.Collections;
import java.util.List;

/**
 * Usage of one field within one component: how many of the component's records carry a
 * non-null value for it, and a few sample values when the field is common.
 */
public class ComponentFieldStat {

    private final String component;
    private final String field;
    private final long count;
    private final long totalRecords;
    private final List<String> sampleValues;

    public ComponentFieldStat(String component, String field, long count, long totalRecords, List<String> sampleValues) {
        this.component = component;
        this.field = field;
        this.count = count;
        this.totalRecords = totalRecords;
        this.sampleValues = Collections.unmodifiableList(sampleValues);
    }

    public String getComponent() {
        return component;
    }

    public String getField() {
        return field;
    }

    public long getCount() {
        return count;
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    /**
     * Frequency as a percentage rounded to one decimal place.
     */
    public double getFrequency() {
        return Percentages.of(count, totalRecords);
    }

    /**
     * True when more than half of the component's records carry the field.
     */
    public boolean isFrequent() {
        return count * 2 > totalRecords;
    }

    /**
     * Up to three distinct values in first-seen order; empty unless {@link #isFrequent()}.
     */
    public List<String> getSampleValues() {
        return sampleValues;
    }

    public String toCsvString() {
        return String.format("%s,%s,%d,%d,%s,%s",
            escapeCsv(component),
            escapeCsv(field),
            count,
            totalRecords,
            Percentages.format(getFrequency()),
            escapeCsv(String.join("|", sampleValues)));
    }

    private static String escapeCsv(String value) {
        if (value == null) {
            return "";
        }
        if (value.contains(",") || value.contains("\"") || value.contains("\n")) {
            return "\"" + value.replace("\"", "\"\"") + "\"";
        }
        return value;
    }

    @Override
    public String toString() {
        return String.format("%s: %d/%d records (%s%%)", field, count, totalRecords, Percentages.format(getFrequency()));
    }
}
