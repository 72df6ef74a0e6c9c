package com.solidfire.log.analyzer;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solidfire.log.parser.LogParser;

import picocli.CommandLine;

public class FieldMappingAppTest {

    @TempDir
    File tempDir;

    @Test
    public void testAnalyzeChunksOfParserRun() throws Exception {
        File log = new File(tempDir, "sf.log");
        Files.write(log.toPath(), List.of(
                "2025-06-05T00:20:07.858372Z n1 master-1[1]: [APP-5] [MS] 2 C a.cpp:1:f| S={{id=1, state=ok}} used=5",
                "2025-06-05T00:20:08.000000Z n1 master-1[1]: [APP-5] [Api] 3 C b.cpp:2:g| S={{id=2}} method=List",
                "",
                "2025-06-05T00:20:09.000000Z n1 master-1[1]: [APP-5] [MS] 2 C a.cpp:1:f| S={{id=3, state=bad}}"),
                StandardCharsets.UTF_8);
        String base = new File(tempDir, "sf").getPath();
        assertEquals(0, new CommandLine(new LogParser()).execute("-f", log.getPath(), "-o", base, "-c", "2"));

        File config = new File(tempDir, "analyzer.properties");
        Files.write(config.toPath(), List.of("analyzer.standard.fields.add=line_number"), StandardCharsets.UTF_8);
        File json = new File(tempDir, "mapping.json");
        File csv = new File(tempDir, "mapping.csv");

        int exitCode = new CommandLine(new FieldMappingApp()).execute("-b", base, "--config", config.getPath(),
                "--json", json.getPath(), "--csv", csv.getPath());

        assertEquals(0, exitCode);
        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals(3, root.path("metadata").path("totalRecords").asLong());
        assertEquals("MS", root.path("exclusiveFields").path("S_state").asText());
        assertEquals("MS", root.path("exclusiveFields").path("used").asText());
        assertEquals("Api", root.path("exclusiveFields").path("method").asText());
        assertEquals(2, root.path("sharedFields").path("S_id").size());
        assertEquals(4, root.path("summary").path("totalFields").asInt());
        assertTrue(csv.exists());
    }

    @Test
    public void testNoInput() {
        assertEquals(1, new CommandLine(new FieldMappingApp()).execute("-b", new File(tempDir, "none").getPath()));
    }

    @Test
    public void testSeveralFilesAfterOneOption() throws Exception {
        File first = new File(tempDir, "a.jsonl");
        Files.write(first.toPath(), List.of("{\"line_number\":1,\"component\":\"MS\",\"used\":\"5\"}"),
                StandardCharsets.UTF_8);
        File second = new File(tempDir, "b.jsonl");
        Files.write(second.toPath(), List.of("{\"line_number\":2,\"component\":\"Api\",\"method\":\"List\"}"),
                StandardCharsets.UTF_8);
        File json = new File(tempDir, "mapping.json");

        int exitCode = new CommandLine(new FieldMappingApp()).execute("-f", first.getPath(), second.getPath(),
                "--json", json.getPath());

        assertEquals(0, exitCode);
        JsonNode root = new ObjectMapper().readTree(json);
        assertEquals(2, root.path("metadata").path("totalRecords").asLong());
        assertEquals("MS", root.path("exclusiveFields").path("used").asText());
        assertEquals("Api", root.path("exclusiveFields").path("method").asText());
    }
}
