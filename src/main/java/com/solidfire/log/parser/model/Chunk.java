package com.solidfire.log.parser.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * An immutable, ordered batch of records handed to a sink as one unit. Tagged with the
 * line number of its first record.
 */
public class Chunk {

    private final int index;
    private final long startLine;
    private final List<FlatRecord> records;

    public Chunk(int index, long startLine, List<FlatRecord> records) {
        this.index = index;
        this.startLine = startLine;
        this.records = Collections.unmodifiableList(new ArrayList<>(records));
    }

    public int getIndex() {
        return index;
    }

    public long getStartLine() {
        return startLine;
    }

    public List<FlatRecord> getRecords() {
        return records;
    }

    public int size() {
        return records.size();
    }

    /**
     * Field names used anywhere in this chunk, in order of first appearance.
     */
    public Set<String> getFieldNames() {
        Set<String> names = new LinkedHashSet<>();
        for (FlatRecord record : records) {
            names.addAll(record.getFieldNames());
        }
        return names;
    }

    @Override
    public String toString() {
        return "Chunk[" + index + ", startLine=" + startLine + ", records=" + records.size() + "]";
    }
}
