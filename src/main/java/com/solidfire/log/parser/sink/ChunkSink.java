package com.solidfire.log.parser.sink;

import com.solidfire.log.parser.model.Chunk;

/**
 * Destination for completed chunks. Implementations must tolerate a different set of
 * field names in every chunk.
 */
public interface ChunkSink {

    /**
     * Persists one chunk. Called once per chunk, in increasing start line order.
     * @throws ChunkSinkException if the chunk could not be persisted
     */
    void write(Chunk chunk) throws ChunkSinkException;
}
