package com.solidfire.log.parser.sink;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.solidfire.log.parser.model.Chunk;
import com.solidfire.log.parser.model.FlatRecord;

/**
 * Keeps emitted chunks in memory.
 */
public class CollectingChunkSink implements ChunkSink {

    private final List<Chunk> chunks = new ArrayList<>();

    @Override
    public void write(Chunk chunk) {
        chunks.add(chunk);
    }

    public List<Chunk> getChunks() {
        return Collections.unmodifiableList(chunks);
    }

    public List<FlatRecord> getRecords() {
        List<FlatRecord> records = new ArrayList<>();
        for (Chunk chunk : chunks) {
            records.addAll(chunk.getRecords());
        }
        return records;
    }
}
