package com.solidfire.log.parser.model;

import java.util.Collections;
import java.util.List;

/**
 * An embedded <code>name={{...}}</code> block. The optional details payload is the raw
 * content of a <code>details=[...]</code> span and is never tokenized further.
 */
public class NestedObject {

    private final String name;
    private final List<KeyValue> pairs;
    private final String details;

    public NestedObject(String name, List<KeyValue> pairs, String details) {
        this.name = name;
        this.pairs = Collections.unmodifiableList(pairs);
        this.details = details;
    }

    public String getName() {
        return name;
    }

    public List<KeyValue> getPairs() {
        return pairs;
    }

    public String getDetails() {
        return details;
    }

    public boolean hasDetails() {
        return details != null;
    }

    @Override
    public String toString() {
        return name + "={{" + pairs + (details != null ? " details=[" + details + "]" : "") + "}}";
    }
}
