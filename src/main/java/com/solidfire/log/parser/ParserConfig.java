package com.solidfire.log.parser;

import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Properties;
import java.util.Set;

/**
 * Configuration shared by the preprocessor and the field-mapping analyzer.
 *
 * Supported properties:
 * <ul>
 * <li>parser.chunk.size: records per emitted chunk (positive, default 50000)</li>
 * <li>parser.header.enabled: parse the SolidFire line header (default true)</li>
 * <li>parser.rawLine.enabled: keep the original line as raw_line (default false)</li>
 * <li>parser.progress.interval: log progress every N lines, 0 disables (default 10000)</li>
 * <li>analyzer.standard.fields: comma-separated list (replaces defaults)</li>
 * <li>analyzer.standard.fields.add: comma-separated list (adds to defaults)</li>
 * <li>analyzer.standard.fields.remove: comma-separated list (removes from current set)</li>
 * </ul>
 */
public class ParserConfig {

    public static final int DEFAULT_CHUNK_SIZE = 50000;
    public static final int DEFAULT_PROGRESS_INTERVAL = 10000;

    public static final List<String> DEFAULT_STANDARD_FIELDS = List.of(
            "line_num", "date", "time", "timestamp", "hostname", "process", "pid",
            "level", "component", "thread", "class", "source", "content", "raw_line", "parse_error");

    private int chunkSize = DEFAULT_CHUNK_SIZE;
    private boolean headerEnabled = true;
    private boolean rawLineEnabled = false;
    private int progressInterval = DEFAULT_PROGRESS_INTERVAL;
    private Set<String> standardFields = new LinkedHashSet<>();

    public ParserConfig() {
        initializeDefaults();
    }

    private void initializeDefaults() {
        standardFields.addAll(DEFAULT_STANDARD_FIELDS);
    }

    public static ParserConfig load(String fileName) throws IOException {
        ParserConfig config = new ParserConfig();
        try (InputStream in = new FileInputStream(fileName)) {
            Properties props = new Properties();
            props.load(in);
            config.loadFromProperties(props);
        }
        return config;
    }

    public void loadFromProperties(Properties props) {
        String size = props.getProperty("parser.chunk.size");
        if (size != null && !size.trim().isEmpty()) {
            setChunkSize(parseInt("parser.chunk.size", size));
        }

        String header = props.getProperty("parser.header.enabled");
        if (header != null && !header.trim().isEmpty()) {
            headerEnabled = Boolean.parseBoolean(header.trim());
        }

        String rawLine = props.getProperty("parser.rawLine.enabled");
        if (rawLine != null && !rawLine.trim().isEmpty()) {
            rawLineEnabled = Boolean.parseBoolean(rawLine.trim());
        }

        String interval = props.getProperty("parser.progress.interval");
        if (interval != null && !interval.trim().isEmpty()) {
            setProgressInterval(parseInt("parser.progress.interval", interval));
        }

        // Replace entire list if specified
        String fieldList = props.getProperty("analyzer.standard.fields");
        if (fieldList != null && !fieldList.trim().isEmpty()) {
            standardFields.clear();
            addFields(fieldList);
        }

        String additional = props.getProperty("analyzer.standard.fields.add");
        if (additional != null && !additional.trim().isEmpty()) {
            addFields(additional);
        }

        String remove = props.getProperty("analyzer.standard.fields.remove");
        if (remove != null && !remove.trim().isEmpty()) {
            for (String field : remove.split(",")) {
                standardFields.remove(field.trim());
            }
        }
    }

    private void addFields(String fieldList) {
        for (String field : fieldList.split(",")) {
            String trimmed = field.trim();
            if (!trimmed.isEmpty()) {
                standardFields.add(trimmed);
            }
        }
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": " + value, e);
        }
    }

    public int getChunkSize() {
        return chunkSize;
    }

    public void setChunkSize(int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive: " + chunkSize);
        }
        this.chunkSize = chunkSize;
    }

    public boolean isHeaderEnabled() {
        return headerEnabled;
    }

    public void setHeaderEnabled(boolean headerEnabled) {
        this.headerEnabled = headerEnabled;
    }

    public boolean isRawLineEnabled() {
        return rawLineEnabled;
    }

    public void setRawLineEnabled(boolean rawLineEnabled) {
        this.rawLineEnabled = rawLineEnabled;
    }

    public int getProgressInterval() {
        return progressInterval;
    }

    public void setProgressInterval(int progressInterval) {
        if (progressInterval < 0) {
            throw new IllegalArgumentException("Progress interval must not be negative: " + progressInterval);
        }
        this.progressInterval = progressInterval;
    }

    public Set<String> getStandardFields() {
        return new LinkedHashSet<>(standardFields);
    }

    public void setStandardFields(Set<String> standardFields) {
        this.standardFields = new LinkedHashSet<>(standardFields);
    }
}
