package com.solidfire.log.parser;

import java.util.ArrayList;
import java.util.List;

import com.solidfire.log.parser.model.Chunk;
import com.solidfire.log.parser.model.FlatRecord;
import com.solidfire.log.parser.sink.ChunkSink;
import com.solidfire.log.parser.sink.ChunkSinkException;

/**
 * Buffers records and hands them to a {@link ChunkSink} in chunks of at most
 * <code>chunkSize</code> records. At most one chunk worth of records is held at a time.
 *
 * <p>{@link #flush()} must be called once at end of stream, otherwise the trailing
 * partial chunk is never written. Sink failures propagate to the caller of
 * {@link #append(FlatRecord)} or {@link #flush()}; nothing is retried.</p>
 */
public class ChunkedEmitter {

    private final ChunkSink sink;
    private final int chunkSize;

    private List<FlatRecord> buffer;
    private int chunkCount = 0;
    private long recordCount = 0;

    public ChunkedEmitter(ChunkSink sink, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.sink = sink;
        this.chunkSize = chunkSize;
        this.buffer = new ArrayList<>(Math.min(chunkSize, 10000));
    }

    public void append(FlatRecord record) throws ChunkSinkException {
        buffer.add(record.freeze());
        if (buffer.size() >= chunkSize) {
            emit();
        }
    }

    public void flush() throws ChunkSinkException {
        if (!buffer.isEmpty()) {
            emit();
        }
    }

    private void emit() throws ChunkSinkException {
        List<FlatRecord> records = buffer;
        buffer = new ArrayList<>(Math.min(chunkSize, 10000));
        Chunk chunk = new Chunk(chunkCount + 1, records.get(0).getLineNumber(), records);
        sink.write(chunk);
        chunkCount++;
        recordCount += chunk.size();
    }

    public int getChunkCount() {
        return chunkCount;
    }

    public long getRecordCount() {
        return recordCount;
    }

    public int getBufferedCount() {
        return buffer.size();
    }

    public int getChunkSize() {
        return chunkSize;
    }
}
