package com.solidfire.log.analyzer;

import java.io.IOException;
import java.io.PrintStream;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;

/**
 * Result of a field-mapping analysis run: per-component field statistics, the
 * exclusive and shared field mappings, and summary counts.
 */
public class FieldMappingReport {

    public static final int TOP_FIELD_LIMIT = 5;

    private String[] headers = new String[] {
        "Component", "Field", "Count", "TotalRecords", "FrequencyPct", "SampleValues"
    };

    private final long totalRecords;
    private final long recordsWithComponent;
    private final List<String> components;
    private final Map<String, Long> componentRecordCounts;
    private final Map<String, List<ComponentFieldStat>> componentStats;
    private final SortedMap<String, String> exclusiveFields;
    private final SortedMap<String, List<String>> sharedFields;
    private final List<FieldUsage> topFields;

    FieldMappingReport(long totalRecords, long recordsWithComponent, List<String> components,
            Map<String, Long> componentRecordCounts, Map<String, List<ComponentFieldStat>> componentStats,
            SortedMap<String, String> exclusiveFields, SortedMap<String, List<String>> sharedFields,
            List<FieldUsage> topFields) {
        this.totalRecords = totalRecords;
        this.recordsWithComponent = recordsWithComponent;
        this.components = Collections.unmodifiableList(components);
        this.componentRecordCounts = Collections.unmodifiableMap(componentRecordCounts);
        this.componentStats = Collections.unmodifiableMap(componentStats);
        this.exclusiveFields = Collections.unmodifiableSortedMap(exclusiveFields);
        this.sharedFields = Collections.unmodifiableSortedMap(sharedFields);
        this.topFields = Collections.unmodifiableList(topFields);
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public long getRecordsWithComponent() {
        return recordsWithComponent;
    }

    /**
     * Component names in ascending order.
     */
    public List<String> getComponents() {
        return components;
    }

    public long getComponentRecordCount(String component) {
        return componentRecordCounts.getOrDefault(component, 0L);
    }

    /**
     * Field statistics of one component, sorted by frequency descending then field name.
     */
    public List<ComponentFieldStat> getFieldStats(String component) {
        return componentStats.getOrDefault(component, Collections.emptyList());
    }

    public Map<String, List<ComponentFieldStat>> getComponentStats() {
        return componentStats;
    }

    /**
     * Field to the single component that uses it.
     */
    public SortedMap<String, String> getExclusiveFields() {
        return exclusiveFields;
    }

    /**
     * Field to the sorted components that use it, for fields used by more than one component.
     */
    public SortedMap<String, List<String>> getSharedFields() {
        return sharedFields;
    }

    public int getTotalFields() {
        return exclusiveFields.size() + sharedFields.size();
    }

    public int getExclusiveCount() {
        return exclusiveFields.size();
    }

    public int getSharedCount() {
        return sharedFields.size();
    }

    public double getExclusivePercentage() {
        return Percentages.of(getExclusiveCount(), getTotalFields());
    }

    public double getSharedPercentage() {
        return Percentages.of(getSharedCount(), getTotalFields());
    }

    /**
     * The most widely used fields, by number of components, ties broken by field name.
     */
    public List<FieldUsage> getTopFields() {
        return topFields;
    }

    public boolean isEmpty() {
        return components.isEmpty();
    }

    /**
     * Prints a human readable report.
     */
    public void report(PrintStream out) {
        out.println("Total log entries: " + totalRecords);
        out.println("Unique components found: " + components);

        out.println("\n=== Component-Field Mapping Analysis ===");
        for (String component : components) {
            out.println("\nCOMPONENT: " + component);
            out.println("Total Records: " + getComponentRecordCount(component));
            out.println("-".repeat(40));

            List<ComponentFieldStat> stats = getFieldStats(component);
            if (stats.isEmpty()) {
                out.println("   No component-specific fields found (only standard log fields)");
                continue;
            }
            out.println("Fields with data:");
            for (ComponentFieldStat stat : stats) {
                out.println("   " + stat);
                if (!stat.getSampleValues().isEmpty()) {
                    out.println("     Sample values: " + String.join(", ", stat.getSampleValues()));
                }
            }
        }

        out.println("\n=== Field Exclusivity Analysis ===");
        if (exclusiveFields.isEmpty()) {
            out.println("   No fields are exclusive to a single component");
        } else {
            out.println("Fields exclusive to specific components:");
            exclusiveFields.forEach((field, component) -> out.println("   " + field + " -> " + component + " only"));
        }
        if (!sharedFields.isEmpty()) {
            out.println("\nFields shared across components:");
            sharedFields.forEach((field, users) -> out.println("   " + field + " -> used by: " + String.join(", ", users)));
        }

        out.println("\n=== Summary Statistics ===");
        out.println("Total unique fields found: " + getTotalFields());
        out.println(String.format("Exclusive fields: %d (%s%%)", getExclusiveCount(), Percentages.format(getExclusivePercentage())));
        out.println(String.format("Shared fields: %d (%s%%)", getSharedCount(), Percentages.format(getSharedPercentage())));

        if (!topFields.isEmpty()) {
            out.println("\nMost widely used fields:");
            for (FieldUsage usage : topFields) {
                out.println("   " + usage);
            }
        }
    }

    /**
     * Exports the per-component field statistics to CSV.
     */
    public void reportCsv(String fileName) throws IOException {
        PrintWriter writer = new PrintWriter(fileName, StandardCharsets.UTF_8);
        writer.println(String.join(",", headers));
        for (String component : components) {
            for (ComponentFieldStat stat : getFieldStats(component)) {
                writer.println(stat.toCsvString());
            }
        }
        writer.close();
    }

    /**
     * How many components use a field, and which.
     */
    public static class FieldUsage {
        private final String field;
        private final List<String> components;

        public FieldUsage(String field, List<String> components) {
            this.field = field;
            this.components = Collections.unmodifiableList(components);
        }

        public String getField() {
            return field;
        }

        public int getComponentCount() {
            return components.size();
        }

        public List<String> getComponents() {
            return components;
        }

        @Override
        public String toString() {
            return String.format("%s: used by %d components (%s)", field, components.size(), String.join(", ", components));
        }
    }
}
