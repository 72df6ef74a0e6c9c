package com.solidfire.log.parser;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.zip.GZIPInputStream;
import java.util.zip.ZipInputStream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.solidfire.log.parser.model.FlatRecord;
import com.solidfire.log.parser.sink.ChunkSink;

/**
 * Streams a SolidFire log through extraction, record building and chunked emission,
 * one line at a time. Lines are trimmed; blank lines are skipped but still counted
 * for line numbering.
 */
public class LogPreprocessor {

    private static final Logger logger = LoggerFactory.getLogger(LogPreprocessor.class);

    private final ParserConfig config;
    private final RecordBuilder recordBuilder;

    public LogPreprocessor(ParserConfig config) {
        this.config = config;
        this.recordBuilder = new RecordBuilder(config);
    }

    /**
     * Processes a log file. Plain, gzip and zip inputs are supported.
     * @throws FileNotFoundException if the input is missing or unreadable, before any output is produced
     */
    public ProcessingStats process(File input, ChunkSink sink) throws IOException {
        checkReadable(input);
        try (BufferedReader in = createReader(input)) {
            return process(in, sink);
        }
    }

    public ProcessingStats process(BufferedReader in, ChunkSink sink) throws IOException {
        ChunkedEmitter emitter = new ChunkedEmitter(sink, config.getChunkSize());
        int progressInterval = config.getProgressInterval();

        long start = System.currentTimeMillis();
        long lineNum = 0;
        long blankLines = 0;
        String currentLine;

        while ((currentLine = in.readLine()) != null) {
            lineNum++;
            String line = currentLine.strip();
            if (line.isEmpty()) {
                blankLines++;
            } else {
                FlatRecord record = recordBuilder.build(line, lineNum);
                emitter.append(record);
            }

            if (progressInterval > 0 && lineNum % progressInterval == 0) {
                logger.info("Processed {} lines...", lineNum);
            }
        }
        emitter.flush();

        long duration = System.currentTimeMillis() - start;
        ProcessingStats stats = new ProcessingStats(lineNum, blankLines, emitter.getRecordCount(),
                emitter.getChunkCount(), duration);
        logger.info("Preprocessing complete - {}", stats);
        return stats;
    }

    public static void checkReadable(File input) throws FileNotFoundException {
        if (!input.exists()) {
            throw new FileNotFoundException("File not found: " + input);
        }
        if (!input.isFile() || !input.canRead()) {
            throw new FileNotFoundException("Cannot read file: " + input);
        }
    }

    static BufferedReader createReader(File file) throws IOException {
        String name = file.getName().toLowerCase();
        if (name.endsWith(".gz")) {
            return new BufferedReader(
                new InputStreamReader(new GZIPInputStream(new FileInputStream(file)), StandardCharsets.UTF_8));
        } else if (name.endsWith(".zip")) {
            ZipInputStream zis = new ZipInputStream(new FileInputStream(file));
            if (zis.getNextEntry() == null) {
                zis.close();
                throw new IOException("Zip archive has no entries: " + file);
            }
            return new BufferedReader(new InputStreamReader(zis, StandardCharsets.UTF_8));
        } else {
            return new BufferedReader(new InputStreamReader(new FileInputStream(file), StandardCharsets.UTF_8));
        }
    }

    public ParserConfig getConfig() {
        return config;
    }
}
