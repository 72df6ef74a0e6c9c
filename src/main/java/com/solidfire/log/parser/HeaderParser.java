package com.solidfire.log.parser;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses the fixed SolidFire line header, e.g.
 * <pre>
 * 2025-06-05T00:20:07.858372Z host01 master-1[112875]: [APP-5] [MS] 2069182 BSDirector ms/ClusterStatistics.cpp:1452:GetBlockDriveUsageFromStats| serviceID=230
 * </pre>
 * into the standard fields date, time, hostname, process, pid, level, component,
 * thread, class, source and content.
 * <p>
 * A line without that header falls back to a minimal split on whitespace: the first
 * token is read as the timestamp, the second as hostname, the third as process and the
 * rest as content. Such lines carry a <code>parse_error</code> field saying so.
 */
public final class HeaderParser {

    private static final Logger logger = LoggerFactory.getLogger(HeaderParser.class);

    public static final String DATE = "date";
    public static final String TIME = "time";
    public static final String HOSTNAME = "hostname";
    public static final String PROCESS = "process";
    public static final String PID = "pid";
    public static final String LEVEL = "level";
    public static final String COMPONENT = "component";
    public static final String THREAD = "thread";
    public static final String CLASS = "class";
    public static final String SOURCE = "source";
    public static final String CONTENT = "content";
    public static final String PARSE_ERROR = "parse_error";

    public static final String MINIMAL_PARSING = "Minimal parsing used";
    public static final String INSUFFICIENT_PARTS = "Failed to parse - insufficient parts";

    private static final Pattern HEADER_PATTERN = Pattern.compile(
            "^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\.\\d+Z)\\s+(\\S+)\\s+([^\\[]+)\\[(\\d+)\\]:\\s+"
            + "\\[([^\\]]+)\\]\\s+\\[([^\\]]+)\\]\\s+(\\d+)\\s+(\\S+)\\s+([^|]+)\\|\\s*(.*)");

    private static final DateTimeFormatter DATE_FORMAT =
            DateTimeFormatter.ofPattern("yyyy-MM-dd").withZone(ZoneOffset.UTC);
    private static final DateTimeFormatter TIME_FORMAT =
            DateTimeFormatter.ofPattern("HH:mm:ss.SSSSSS").withZone(ZoneOffset.UTC);

    private HeaderParser() {
    }

    /**
     * Returns the header fields of the line in a stable order. Lines without a SolidFire
     * header get the minimal fields and a <code>parse_error</code>; a null line yields an
     * empty map.
     */
    public static Map<String, String> parse(String line) {
        if (line == null) {
            return Collections.emptyMap();
        }
        Matcher m = HEADER_PATTERN.matcher(line);
        if (!m.matches()) {
            return parseMinimal(line);
        }

        Map<String, String> fields = new LinkedHashMap<>();
        putDateTime(fields, m.group(1));
        fields.put(HOSTNAME, m.group(2));
        fields.put(PROCESS, m.group(3).trim());
        fields.put(PID, m.group(4));
        fields.put(LEVEL, m.group(5));
        fields.put(COMPONENT, m.group(6));
        fields.put(THREAD, m.group(7));
        fields.put(CLASS, m.group(8));
        fields.put(SOURCE, m.group(9).trim());
        fields.put(CONTENT, m.group(10));
        return fields;
    }

    static Map<String, String> parseMinimal(String line) {
        String[] parts = line.trim().split("\\s+");
        Map<String, String> fields = new LinkedHashMap<>();
        if (parts.length < 3) {
            fields.put(CONTENT, line);
            fields.put(PARSE_ERROR, INSUFFICIENT_PARTS);
            return fields;
        }
        putDateTime(fields, parts[0]);
        fields.put(HOSTNAME, parts[1]);
        fields.put(PROCESS, parts[2]);
        fields.put(CONTENT, String.join(" ", Arrays.asList(parts).subList(3, parts.length)));
        fields.put(PARSE_ERROR, MINIMAL_PARSING);
        return fields;
    }

    private static void putDateTime(Map<String, String> fields, String timestamp) {
        try {
            Instant instant = Instant.parse(timestamp);
            fields.put(DATE, DATE_FORMAT.format(instant));
            fields.put(TIME, TIME_FORMAT.format(instant));
        } catch (DateTimeParseException e) {
            logger.debug("Unparseable header timestamp: {}", timestamp);
        }
    }
}
