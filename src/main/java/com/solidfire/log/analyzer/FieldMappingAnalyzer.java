package com.solidfire.log.analyzer;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.solidfire.log.analyzer.FieldMappingReport.FieldUsage;
import com.solidfire.log.parser.ParserConfig;
import com.solidfire.log.parser.model.FlatRecord;

/**
 * Accumulates flat records grouped by their component and works out which
 * non-standard fields each component uses, and whether a field is exclusive to one
 * component or shared.
 * <p>
 * Records are folded in one at a time; per component only the record count and, per
 * field, a non-null count plus the first few distinct values are kept.
 */
public class FieldMappingAnalyzer {

    private static final Logger logger = LoggerFactory.getLogger(FieldMappingAnalyzer.class);

    public static final int MAX_SAMPLES = 3;

    private final Set<String> standardFields;

    private final Map<String, ComponentAccumulator> components = new HashMap<>();

    private long totalRecords = 0;
    private long recordsWithoutComponent = 0;

    public FieldMappingAnalyzer() {
        this(ParserConfig.DEFAULT_STANDARD_FIELDS);
    }

    public FieldMappingAnalyzer(Collection<String> standardFields) {
        this.standardFields = new LinkedHashSet<>(standardFields);
    }

    public FieldMappingAnalyzer(ParserConfig config) {
        this(config.getStandardFields());
    }

    public void accumulate(FlatRecord record) {
        totalRecords++;
        String component = record.get(FlatRecord.COMPONENT);
        if (component == null || component.isEmpty()) {
            recordsWithoutComponent++;
            return;
        }

        ComponentAccumulator acc = components.computeIfAbsent(component, ComponentAccumulator::new);
        acc.recordCount++;
        for (Map.Entry<String, String> entry : record.asMap().entrySet()) {
            if (standardFields.contains(entry.getKey())) {
                continue;
            }
            acc.accumulate(entry.getKey(), entry.getValue());
        }
    }

    public FieldMappingReport analyze(Iterable<FlatRecord> records) {
        for (FlatRecord record : records) {
            accumulate(record);
        }
        return buildReport();
    }

    public FieldMappingReport buildReport() {
        if (recordsWithoutComponent > 0) {
            logger.info("{} of {} records have no component and were ignored", recordsWithoutComponent, totalRecords);
        }

        List<String> componentNames = new ArrayList<>(new TreeSet<>(components.keySet()));
        Map<String, Long> recordCounts = new LinkedHashMap<>();
        Map<String, List<ComponentFieldStat>> componentStats = new LinkedHashMap<>();
        SortedMap<String, Set<String>> fieldUsers = new TreeMap<>();

        for (String name : componentNames) {
            ComponentAccumulator acc = components.get(name);
            recordCounts.put(name, acc.recordCount);

            List<ComponentFieldStat> stats = new ArrayList<>();
            for (FieldAccumulator field : acc.fields.values()) {
                if (field.count == 0) {
                    continue;
                }
                boolean frequent = field.count * 2 > acc.recordCount;
                List<String> samples = frequent ? new ArrayList<>(field.samples) : new ArrayList<>();
                stats.add(new ComponentFieldStat(name, field.name, field.count, acc.recordCount, samples));
                fieldUsers.computeIfAbsent(field.name, k -> new TreeSet<>()).add(name);
            }
            stats.sort(Comparator.comparingLong(ComponentFieldStat::getCount).reversed()
                    .thenComparing(ComponentFieldStat::getField));
            componentStats.put(name, stats);
        }

        SortedMap<String, String> exclusive = new TreeMap<>();
        SortedMap<String, List<String>> shared = new TreeMap<>();
        List<FieldUsage> usages = new ArrayList<>();
        for (Map.Entry<String, Set<String>> entry : fieldUsers.entrySet()) {
            List<String> users = new ArrayList<>(entry.getValue());
            if (users.size() == 1) {
                exclusive.put(entry.getKey(), users.get(0));
            } else {
                shared.put(entry.getKey(), users);
            }
            usages.add(new FieldUsage(entry.getKey(), users));
        }

        usages.sort(Comparator.comparingInt(FieldUsage::getComponentCount).reversed()
                .thenComparing(FieldUsage::getField));
        List<FieldUsage> top = new ArrayList<>(usages.subList(0, Math.min(FieldMappingReport.TOP_FIELD_LIMIT, usages.size())));

        return new FieldMappingReport(totalRecords, totalRecords - recordsWithoutComponent, componentNames,
                recordCounts, componentStats, exclusive, shared, top);
    }

    public long getTotalRecords() {
        return totalRecords;
    }

    public long getRecordsWithoutComponent() {
        return recordsWithoutComponent;
    }

    public Set<String> getStandardFields() {
        return standardFields;
    }

    private static class ComponentAccumulator {
        private final String component;
        private long recordCount = 0;
        private final Map<String, FieldAccumulator> fields = new LinkedHashMap<>();

        ComponentAccumulator(String component) {
            this.component = component;
        }

        void accumulate(String field, String value) {
            FieldAccumulator acc = fields.computeIfAbsent(field, FieldAccumulator::new);
            if (value != null) {
                acc.count++;
                if (acc.samples.size() < MAX_SAMPLES) {
                    acc.samples.add(value);
                }
            }
        }

        @Override
        public String toString() {
            return component + " (" + recordCount + " records, " + fields.size() + " fields)";
        }
    }

    private static class FieldAccumulator {
        private final String name;
        private long count = 0;
        // distinct values, first seen order
        private final Set<String> samples = new LinkedHashSet<>();

        FieldAccumulator(String name) {
            this.name = name;
        }
    }
}
