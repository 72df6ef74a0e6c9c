package com.solidfire.log.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solidfire.log.parser.model.FlatRecord;

public class JsonReportGeneratorTest {

    @TempDir
    File tempDir;

    private static FlatRecord record(String component, String field, String value) {
        Map<String, String> values = new LinkedHashMap<>();
        values.put("component", component);
        values.put(field, value);
        return FlatRecord.fromMap(values);
    }

    @Test
    public void testGenerateReport() throws Exception {
        FieldMappingReport report = new FieldMappingAnalyzer().analyze(List.of(
                record("MS", "serviceID", "230"),
                record("MS", "serviceID", "231"),
                record("Api", "serviceID", "5"),
                record("Api", "method", "GetClusterInfo")));

        File out = new File(tempDir, "report.json");
        JsonReportGenerator.generateReport(out.getPath(), report);

        JsonNode root = new ObjectMapper().readTree(out);
        assertEquals(4, root.path("metadata").path("totalRecords").asLong());

        JsonNode ms = root.path("components").path("MS");
        assertEquals(2, ms.path("totalRecords").asLong());
        JsonNode serviceId = ms.path("fields").get(0);
        assertEquals("serviceID", serviceId.path("field").asText());
        assertEquals(100.0, serviceId.path("frequencyPct").asDouble());
        assertEquals(2, serviceId.path("sampleValues").size());

        assertEquals("Api", root.path("exclusiveFields").path("method").asText());
        assertEquals("Api", root.path("sharedFields").path("serviceID").get(0).asText());
        assertEquals("MS", root.path("sharedFields").path("serviceID").get(1).asText());

        JsonNode summary = root.path("summary");
        assertEquals(2, summary.path("totalFields").asInt());
        assertEquals(50.0, summary.path("sharedPct").asDouble());
        assertEquals("serviceID", summary.path("topFields").get(0).path("field").asText());
    }

    @Test
    public void testEmptyReport() {
        JsonNode root = JsonReportGenerator.toJson(new FieldMappingAnalyzer().analyze(List.of()));
        assertEquals(0, root.path("summary").path("totalFields").asInt());
        assertEquals(0.0, root.path("summary").path("exclusivePct").asDouble());
        assertEquals(0, root.path("components").size());
    }

    @Test
    public void testNonAsciiWrittenAsUtf8() throws Exception {
        FieldMappingReport report = new FieldMappingAnalyzer().analyze(List.of(
                record("Überwachung", "zustand", "grün")));

        File out = new File(tempDir, "report.json");
        JsonReportGenerator.generateReport(out.getPath(), report);

        String written = new String(Files.readAllBytes(out.toPath()), StandardCharsets.UTF_8);
        assertTrue(written.contains("Überwachung"));
        JsonNode root = new ObjectMapper().readTree(out);
        assertEquals("grün", root.path("components").path("Überwachung").path("fields").get(0)
                .path("sampleValues").get(0).asText());
    }
}
