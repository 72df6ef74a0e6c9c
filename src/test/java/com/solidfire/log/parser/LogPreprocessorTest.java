package com.solidfire.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.StringReader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.zip.GZIPOutputStream;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.solidfire.log.parser.model.Chunk;
import com.solidfire.log.parser.model.FlatRecord;
import com.solidfire.log.parser.sink.CollectingChunkSink;

public class LogPreprocessorTest {

    @TempDir
    File tempDir;

    private static LogPreprocessor preprocessor(int chunkSize) {
        ParserConfig config = new ParserConfig();
        config.setChunkSize(chunkSize);
        config.setProgressInterval(0);
        return new LogPreprocessor(config);
    }

    @Test
    public void testBlankLinesKeepNumbering() throws Exception {
        String input = "a=1\n\n   \n  b=2  \nc=3\n";
        CollectingChunkSink sink = new CollectingChunkSink();
        ProcessingStats stats = preprocessor(2).process(new BufferedReader(new StringReader(input)), sink);

        assertEquals(5, stats.linesRead);
        assertEquals(2, stats.blankLines);
        assertEquals(3, stats.records);
        assertEquals(2, stats.chunks);

        List<FlatRecord> records = sink.getRecords();
        assertEquals(List.of(1L, 4L, 5L), List.of(records.get(0).getLineNumber(),
                records.get(1).getLineNumber(), records.get(2).getLineNumber()));
        assertEquals("2", records.get(1).get("b"));

        // chunk tag is the first record's line, not a computed offset
        List<Chunk> chunks = sink.getChunks();
        assertEquals(1, chunks.get(0).getStartLine());
        assertEquals(5, chunks.get(1).getStartLine());
    }

    @Test
    public void testEmptyInput() throws Exception {
        CollectingChunkSink sink = new CollectingChunkSink();
        ProcessingStats stats = preprocessor(10).process(new BufferedReader(new StringReader("")), sink);
        assertEquals(0, stats.records);
        assertTrue(sink.getChunks().isEmpty());
    }

    @Test
    public void testProcessGzipFile() throws Exception {
        File input = new File(tempDir, "sf.log.gz");
        try (OutputStream out = new GZIPOutputStream(Files.newOutputStream(input.toPath()));
                Writer writer = new OutputStreamWriter(out, StandardCharsets.UTF_8)) {
            writer.write("2025-01-01T00:00:00Z A={{x=1}}\nB={{y=é}}\n");
        }

        CollectingChunkSink sink = new CollectingChunkSink();
        ProcessingStats stats = preprocessor(50000).process(input, sink);

        assertEquals(2, stats.records);
        assertEquals(1, stats.chunks);
        assertEquals("1", sink.getRecords().get(0).get("A_x"));
        assertEquals("é", sink.getRecords().get(1).get("B_y"));
    }

    @Test
    public void testMissingFile() {
        CollectingChunkSink sink = new CollectingChunkSink();
        assertThrows(FileNotFoundException.class,
                () -> preprocessor(10).process(new File(tempDir, "missing.log"), sink));
        assertTrue(sink.getChunks().isEmpty());
    }

    @Test
    public void testDirectoryIsNotReadable() {
        assertThrows(FileNotFoundException.class,
                () -> preprocessor(10).process(tempDir, new CollectingChunkSink()));
    }
}
