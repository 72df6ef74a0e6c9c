package com.solidfire.log.parser.model;

import java.util.Collections;
import java.util.List;

/**
 * Everything the token extractor found on one line.
 */
public class LineTokens {

    private static final LineTokens EMPTY = new LineTokens(null, Collections.emptyList(), Collections.emptyList());

    private final String timestamp;
    private final List<NestedObject> nestedObjects;
    private final List<KeyValue> loosePairs;

    public LineTokens(String timestamp, List<NestedObject> nestedObjects, List<KeyValue> loosePairs) {
        this.timestamp = timestamp;
        this.nestedObjects = Collections.unmodifiableList(nestedObjects);
        this.loosePairs = Collections.unmodifiableList(loosePairs);
    }

    public static LineTokens empty() {
        return EMPTY;
    }

    public String getTimestamp() {
        return timestamp;
    }

    public List<NestedObject> getNestedObjects() {
        return nestedObjects;
    }

    public List<KeyValue> getLoosePairs() {
        return loosePairs;
    }

    public boolean isEmpty() {
        return timestamp == null && nestedObjects.isEmpty() && loosePairs.isEmpty();
    }
}
