package com.solidfire.log.parser;

/**
 * Counters collected while preprocessing one input.
 */
public class ProcessingStats {
    public final long linesRead;
    public final long blankLines;
    public final long records;
    public final int chunks;
    public final long durationMillis;

    public ProcessingStats(long linesRead, long blankLines, long records, int chunks, long durationMillis) {
        this.linesRead = linesRead;
        this.blankLines = blankLines;
        this.records = records;
        this.chunks = chunks;
        this.durationMillis = durationMillis;
    }

    public double getLinesPerSecond() {
        return durationMillis > 0 ? linesRead * 1000.0 / durationMillis : 0.0;
    }

    @Override
    public String toString() {
        return String.format("Lines: %d read, %d blank | Records: %d | Chunks: %d | Duration: %dms",
                linesRead, blankLines, records, chunks, durationMillis);
    }
}
