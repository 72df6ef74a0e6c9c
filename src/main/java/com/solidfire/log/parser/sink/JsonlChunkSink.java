package com.solidfire.log.parser.sink;

import java.io.BufferedWriter;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.solidfire.log.parser.model.Chunk;
import com.solidfire.log.parser.model.FlatRecord;

/**
 * Writes every chunk to its own JSON Lines file named
 * <code>&lt;base&gt;.chunk_&lt;startLine&gt;.jsonl</code>, one object per record.
 * Each file carries exactly the fields of its own records.
 */
public class JsonlChunkSink implements ChunkSink {

    private static final Logger logger = LoggerFactory.getLogger(JsonlChunkSink.class);

    public static final String CHUNK_INFIX = ".chunk_";
    public static final String EXTENSION = ".jsonl";

    private static final ObjectMapper mapper = new ObjectMapper();

    private final String outputBase;
    private final List<File> writtenFiles = new ArrayList<>();

    public JsonlChunkSink(String outputBase) {
        this.outputBase = outputBase;
    }

    public static File chunkFile(String outputBase, long startLine) {
        return new File(outputBase + CHUNK_INFIX + startLine + EXTENSION);
    }

    @Override
    public void write(Chunk chunk) throws ChunkSinkException {
        File file = chunkFile(outputBase, chunk.getStartLine());
        try (BufferedWriter writer = Files.newBufferedWriter(file.toPath(), StandardCharsets.UTF_8)) {
            for (FlatRecord record : chunk.getRecords()) {
                writer.write(mapper.writeValueAsString(toJson(record)));
                writer.newLine();
            }
        } catch (IOException e) {
            throw new ChunkSinkException(chunk.getStartLine(),
                    "Failed to write chunk starting at line " + chunk.getStartLine() + " to " + file, e);
        }
        writtenFiles.add(file);
        logger.info("Saved chunk: {} ({} records)", file, chunk.size());
    }

    /**
     * Deletes the chunk files a previous run left under this output base, so that a rerun
     * with a different chunk size does not leave stale chunks next to the new ones.
     *
     * @return the number of files deleted
     */
    public int removeExistingChunks() throws IOException {
        List<File> stale = RecordSource.findChunkFiles(outputBase);
        for (File file : stale) {
            Files.delete(file.toPath());
        }
        if (!stale.isEmpty()) {
            logger.info("Removed {} chunk files of a previous run for base {}", stale.size(), outputBase);
        }
        return stale.size();
    }

    public static ObjectNode toJson(FlatRecord record) {
        ObjectNode node = mapper.createObjectNode();
        for (Map.Entry<String, String> entry : record.asMap().entrySet()) {
            if (FlatRecord.LINE_NUMBER.equals(entry.getKey()) && record.getLineNumber() >= 0) {
                node.put(entry.getKey(), record.getLineNumber());
            } else if (entry.getValue() == null) {
                node.putNull(entry.getKey());
            } else {
                node.put(entry.getKey(), entry.getValue());
            }
        }
        return node;
    }

    public List<File> getWrittenFiles() {
        return Collections.unmodifiableList(writtenFiles);
    }
}
