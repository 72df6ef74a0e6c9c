package com.solidfire.log.analyzer;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solidfire.log.analyzer.FieldMappingReport.FieldUsage;

/**
 * Generates a structured JSON report from a field-mapping analysis
 */
public class JsonReportGenerator {

    private static final ObjectMapper mapper = new ObjectMapper();

    public static void generateReport(String fileName, FieldMappingReport report) throws IOException {
        try (Writer writer = Files.newBufferedWriter(Paths.get(fileName), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, toJson(report));
        }
    }

    static ObjectNode toJson(FieldMappingReport report) {
        ObjectNode root = mapper.createObjectNode();

        ObjectNode metadata = mapper.createObjectNode();
        metadata.put("generatedAt", java.time.Instant.now().toString());
        metadata.put("totalRecords", report.getTotalRecords());
        metadata.put("recordsWithComponent", report.getRecordsWithComponent());
        root.set("metadata", metadata);

        root.set("components", generateComponentsJson(report));

        ObjectNode exclusive = mapper.createObjectNode();
        report.getExclusiveFields().forEach(exclusive::put);
        root.set("exclusiveFields", exclusive);

        ObjectNode shared = mapper.createObjectNode();
        for (Map.Entry<String, List<String>> entry : report.getSharedFields().entrySet()) {
            ArrayNode users = shared.putArray(entry.getKey());
            entry.getValue().forEach(users::add);
        }
        root.set("sharedFields", shared);

        root.set("summary", generateSummaryJson(report));
        return root;
    }

    private static ObjectNode generateComponentsJson(FieldMappingReport report) {
        ObjectNode components = mapper.createObjectNode();
        for (String component : report.getComponents()) {
            ObjectNode node = mapper.createObjectNode();
            node.put("totalRecords", report.getComponentRecordCount(component));

            ArrayNode fields = node.putArray("fields");
            for (ComponentFieldStat stat : report.getFieldStats(component)) {
                ObjectNode field = mapper.createObjectNode();
                field.put("field", stat.getField());
                field.put("count", stat.getCount());
                field.put("frequencyPct", stat.getFrequency());
                if (!stat.getSampleValues().isEmpty()) {
                    ArrayNode samples = field.putArray("sampleValues");
                    stat.getSampleValues().forEach(samples::add);
                }
                fields.add(field);
            }
            components.set(component, node);
        }
        return components;
    }

    private static ObjectNode generateSummaryJson(FieldMappingReport report) {
        ObjectNode summary = mapper.createObjectNode();
        summary.put("totalFields", report.getTotalFields());
        summary.put("exclusiveCount", report.getExclusiveCount());
        summary.put("sharedCount", report.getSharedCount());
        summary.put("exclusivePct", report.getExclusivePercentage());
        summary.put("sharedPct", report.getSharedPercentage());

        ArrayNode top = summary.putArray("topFields");
        for (FieldUsage usage : report.getTopFields()) {
            ObjectNode node = mapper.createObjectNode();
            node.put("field", usage.getField());
            node.put("componentCount", usage.getComponentCount());
            ArrayNode users = node.putArray("components");
            usage.getComponents().forEach(users::add);
            top.add(node);
        }
        return summary;
    }
}
