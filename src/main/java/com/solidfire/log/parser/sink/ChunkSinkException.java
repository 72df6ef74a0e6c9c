package com.solidfire.log.parser.sink;

import java.io.IOException;

/**
 * Raised when a chunk cannot be persisted. Carries the start line of the failed chunk.
 */
public class ChunkSinkException extends IOException {

    private static final long serialVersionUID = 1L;

    private final long startLine;

    public ChunkSinkException(long startLine, String message) {
        super(message);
        this.startLine = startLine;
    }

    public ChunkSinkException(long startLine, String message, Throwable cause) {
        super(message, cause);
        this.startLine = startLine;
    }

    public long getStartLine() {
        return startLine;
    }
}
