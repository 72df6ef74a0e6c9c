package com.solidfire.log.filter;

import static org.junit.jupiter.api.Assertions.*;

import java.io.File;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.solidfire.log.parser.model.FlatRecord;
import com.solidfire.log.parser.sink.RecordSource;

import picocli.CommandLine;

public class LogFilterTest {

    @TempDir
    File tempDir;

    @Test
    public void testFilterWithCompleteSchema() throws Exception {
        File input = new File(tempDir, "sf.chunk_1.jsonl");
        Files.write(input.toPath(), List.of(
                "{\"line_number\":1,\"date\":\"2025-06-05\",\"time\":\"10:15:00.000000\",\"component\":\"MS\",\"a\":\"1\"}",
                "{\"line_number\":2,\"date\":\"2025-06-05\",\"time\":\"12:00:00.000000\",\"component\":\"MS\"}",
                "{\"line_number\":3,\"date\":\"2025-06-05\",\"time\":\"10:20:00.000000\",\"component\":\"MS\",\"b\":\"2\"}",
                "{\"line_number\":4,\"date\":\"2025-06-05\",\"time\":\"10:30:00.000000\",\"component\":\"Api\"}"),
                StandardCharsets.UTF_8);
        File output = new File(tempDir, "filtered.json");

        int exitCode = new CommandLine(new LogFilter()).execute("-f", input.getPath(), "-o", output.getPath(),
                "--start-time", "10:00", "--end-time", "11:00", "--field", "component=MS", "--complete-schema");

        assertEquals(0, exitCode);
        List<FlatRecord> records = RecordSource.readAll(List.of(output));
        assertEquals(2, records.size());
        assertEquals(1, records.get(0).getLineNumber());
        assertEquals(3, records.get(1).getLineNumber());
        assertTrue(records.get(0).has("b"));
        assertNull(records.get(0).get("b"));
        assertNull(records.get(1).get("a"));
    }

    @Test
    public void testInvalidArguments() {
        File output = new File(tempDir, "out.json");
        assertEquals(2, new CommandLine(new LogFilter()).execute("-f", "x.jsonl", "-o", output.getPath(),
                "--start-date", "yesterday"));
        assertEquals(2, new CommandLine(new LogFilter()).execute("-f", "x.jsonl", "-o", output.getPath(),
                "--field", "novalue"));
        assertFalse(output.exists());
    }

    @Test
    public void testMissingInput() {
        File output = new File(tempDir, "out.json");
        assertEquals(1, new CommandLine(new LogFilter()).execute("-f", new File(tempDir, "none.jsonl").getPath(),
                "-o", output.getPath()));
    }

    @Test
    public void testSeveralInputsAndNonAsciiValues() throws Exception {
        File first = new File(tempDir, "sf.chunk_1.jsonl");
        Files.write(first.toPath(), List.of(
                "{\"line_number\":1,\"component\":\"MS\",\"note\":\"café\"}",
                "{\"line_number\":2,\"component\":\"Api\",\"note\":\"skip\"}"),
                StandardCharsets.UTF_8);
        File second = new File(tempDir, "sf.chunk_3.jsonl");
        Files.write(second.toPath(), List.of("{\"line_number\":3,\"component\":\"MS\",\"note\":\"東京\"}"),
                StandardCharsets.UTF_8);
        File output = new File(tempDir, "filtered.json");

        int exitCode = new CommandLine(new LogFilter()).execute("-f", first.getPath(), second.getPath(),
                "-o", output.getPath(), "--field", "component=MS");

        assertEquals(0, exitCode);
        String written = new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8);
        assertTrue(written.contains("café"));
        assertTrue(written.contains("東京"));

        List<FlatRecord> records = RecordSource.readAll(List.of(output));
        assertEquals(2, records.size());
        assertEquals("café", records.get(0).get("note"));
        assertEquals("東京", records.get(1).get("note"));
    }
}
