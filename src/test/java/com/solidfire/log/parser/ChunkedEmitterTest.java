package com.solidfire.log.parser;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import com.solidfire.log.parser.model.Chunk;
import com.solidfire.log.parser.model.FlatRecord;
import com.solidfire.log.parser.sink.ChunkSinkException;
import com.solidfire.log.parser.sink.CollectingChunkSink;

public class ChunkedEmitterTest {

    private static void appendLines(ChunkedEmitter emitter, int lines) throws ChunkSinkException {
        for (int i = 1; i <= lines; i++) {
            FlatRecord record = new FlatRecord(i);
            record.put("n", Integer.toString(i));
            emitter.append(record);
        }
    }

    @Test
    public void testChunkBoundaries() throws Exception {
        CollectingChunkSink sink = new CollectingChunkSink();
        ChunkedEmitter emitter = new ChunkedEmitter(sink, 4);
        appendLines(emitter, 10);

        assertEquals(2, sink.getChunks().size());
        assertEquals(2, emitter.getBufferedCount());
        emitter.flush();

        List<Chunk> chunks = sink.getChunks();
        assertEquals(3, chunks.size());
        assertEquals(List.of(4, 4, 2), List.of(chunks.get(0).size(), chunks.get(1).size(), chunks.get(2).size()));
        assertEquals(List.of(1L, 5L, 9L),
                List.of(chunks.get(0).getStartLine(), chunks.get(1).getStartLine(), chunks.get(2).getStartLine()));
        assertEquals(List.of(1, 2, 3), List.of(chunks.get(0).getIndex(), chunks.get(1).getIndex(), chunks.get(2).getIndex()));
        assertEquals(3, emitter.getChunkCount());
        assertEquals(10, emitter.getRecordCount());
    }

    @Test
    public void testExactMultiple() throws Exception {
        CollectingChunkSink sink = new CollectingChunkSink();
        ChunkedEmitter emitter = new ChunkedEmitter(sink, 5);
        appendLines(emitter, 10);
        emitter.flush();

        assertEquals(2, sink.getChunks().size());
        assertEquals(5, sink.getChunks().get(1).size());
    }

    @Test
    public void testFlushEmptyBuffer() throws Exception {
        CollectingChunkSink sink = new CollectingChunkSink();
        ChunkedEmitter emitter = new ChunkedEmitter(sink, 5);
        emitter.flush();
        assertTrue(sink.getChunks().isEmpty());
        assertEquals(0, emitter.getChunkCount());
    }

    @Test
    public void testRecordsFrozenOnAppend() throws Exception {
        CollectingChunkSink sink = new CollectingChunkSink();
        ChunkedEmitter emitter = new ChunkedEmitter(sink, 2);
        FlatRecord record = new FlatRecord(1);
        emitter.append(record);

        assertTrue(record.isFrozen());
        assertThrows(IllegalStateException.class, () -> record.put("late", "x"));
    }

    @Test
    public void testSinkFailureCarriesStartLine() throws Exception {
        List<Long> written = new ArrayList<>();
        ChunkedEmitter emitter = new ChunkedEmitter(chunk -> {
            if (chunk.getStartLine() == 4) {
                throw new ChunkSinkException(chunk.getStartLine(), "disk full");
            }
            written.add(chunk.getStartLine());
        }, 3);

        ChunkSinkException e = assertThrows(ChunkSinkException.class, () -> appendLines(emitter, 7));
        assertEquals(4, e.getStartLine());
        assertEquals(List.of(1L), written);
        assertEquals(1, emitter.getChunkCount());
    }

    @Test
    public void testInvalidChunkSize() {
        assertThrows(IllegalArgumentException.class, () -> new ChunkedEmitter(new CollectingChunkSink(), 0));
    }
}
