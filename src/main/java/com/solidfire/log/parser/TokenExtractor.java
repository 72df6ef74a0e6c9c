package com.solidfire.log.parser;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.solidfire.log.parser.model.KeyValue;
import com.solidfire.log.parser.model.LineTokens;
import com.solidfire.log.parser.model.NestedObject;

/**
 * Locates the tokens of one SolidFire log line: the leading timestamp, embedded
 * <code>name={{...}}</code> blocks and loose key=value pairs outside those blocks.
 *
 * <p>Nested blocks are matched first against the whole line; loose pairs are then
 * extracted from the line with every block removed, so text consumed by a block is
 * never counted twice.</p>
 *
 * <p>A block payload tolerates a single level of <code>{...}</code>. Deeper nesting
 * yields a truncated or missing capture; existing outputs depend on this, so it is
 * kept as is.</p>
 *
 * <p>Payloads are located by {@link #findPayloadEnd(String, int)}, a linear scan, rather
 * than a repeated regex group: the regex engine recurses once per inner span and
 * overflows the stack on long payloads.</p>
 */
public final class TokenExtractor {

    private static final int FLAGS = Pattern.UNICODE_CHARACTER_CLASS;

    static final Pattern BLOCK_START_PATTERN = Pattern.compile("(\\w+)=\\{\\{", FLAGS);

    static final Pattern KEY_VALUE_PATTERN =
            Pattern.compile("(\\w+)=(\\[[^\\]]*\\]|[^}\\s]+)", FLAGS);

    static final Pattern TIMESTAMP_PATTERN =
            Pattern.compile("^(\\d{4}-\\d{2}-\\d{2}T\\d{2}:\\d{2}:\\d{2}\\S*)", FLAGS);

    static final Pattern DETAILS_PATTERN = Pattern.compile("details=\\[([^\\]]*)\\]");

    private TokenExtractor() {
    }

    /**
     * Extracts all tokens from a line. Blank input yields {@link LineTokens#empty()}.
     */
    public static LineTokens extract(String line) {
        if (line == null || line.isBlank()) {
            return LineTokens.empty();
        }
        List<NestedObject> nestedObjects = extractNestedObjects(line);
        List<KeyValue> loosePairs = extractKeyValues(stripNestedObjects(line));
        return new LineTokens(extractTimestamp(line), nestedObjects, loosePairs);
    }

    /**
     * Returns the leading timestamp token, or null if the line does not start with one.
     */
    public static String extractTimestamp(String line) {
        Matcher matcher = TIMESTAMP_PATTERN.matcher(line);
        if (matcher.find()) {
            return matcher.group(1);
        }
        return null;
    }

    public static List<NestedObject> extractNestedObjects(String line) {
        List<NestedObject> result = new ArrayList<>();
        for (BlockSpan block : findBlocks(line)) {
            String name = block.name;
            String payload = line.substring(block.payloadStart, block.payloadEnd);

            String details = null;
            Matcher detailsMatcher = DETAILS_PATTERN.matcher(payload);
            if (detailsMatcher.find()) {
                details = detailsMatcher.group(1);
            }
            String remainder = DETAILS_PATTERN.matcher(payload).replaceAll("");
            result.add(new NestedObject(name, extractKeyValues(remainder), details));
        }
        return result;
    }

    /**
     * Applies the key=value rule to a piece of text. A value is either a bracketed span or a
     * run without '}' and whitespace; a trailing ',' separator is not part of the latter.
     */
    public static List<KeyValue> extractKeyValues(String text) {
        List<KeyValue> result = new ArrayList<>();
        Matcher matcher = KEY_VALUE_PATTERN.matcher(text);
        while (matcher.find()) {
            String value = matcher.group(2);
            if (value.length() > 1 && value.charAt(0) != '[' && value.endsWith(",")) {
                value = value.substring(0, value.length() - 1);
            }
            result.add(new KeyValue(matcher.group(1), value));
        }
        return result;
    }

    /**
     * Removes every nested block span from the line.
     */
    public static String stripNestedObjects(String line) {
        List<BlockSpan> blocks = findBlocks(line);
        if (blocks.isEmpty()) {
            return line;
        }
        StringBuilder sb = new StringBuilder(line.length());
        int pos = 0;
        for (BlockSpan block : blocks) {
            sb.append(line, pos, block.start);
            pos = block.end;
        }
        sb.append(line, pos, line.length());
        return sb.toString();
    }

    /**
     * Finds the non-overlapping <code>name={{payload}}</code> blocks of a line, left to right.
     */
    static List<BlockSpan> findBlocks(String line) {
        List<BlockSpan> blocks = new ArrayList<>();
        Matcher matcher = BLOCK_START_PATTERN.matcher(line);
        int from = 0;
        while (from < line.length() && matcher.find(from)) {
            int payloadStart = matcher.end();
            int payloadEnd = findPayloadEnd(line, payloadStart);
            if (payloadEnd < 0) {
                // a shorter name from the same word has the same payload, so skip past it
                from = payloadStart;
                continue;
            }
            blocks.add(new BlockSpan(matcher.group(1), matcher.start(), payloadStart, payloadEnd, payloadEnd + 2));
            from = payloadEnd + 2;
        }
        return blocks;
    }

    /**
     * Returns the index of the closing <code>}}</code> of a payload starting at
     * <code>from</code>, or -1 if the payload is not closed.
     * <p>
     * The payload is cut at its '}' characters. It ends at the first "}}", and every
     * '}' passed before that must close a '{' opened since the previous '}'.
     */
    static int findPayloadEnd(String line, int from) {
        int segmentStart = from;
        while (true) {
            int close = line.indexOf('}', segmentStart);
            if (close < 0) {
                return -1;
            }
            if (close + 1 < line.length() && line.charAt(close + 1) == '}') {
                return close;
            }
            int open = line.indexOf('{', segmentStart);
            if (open < 0 || open > close) {
                return -1;
            }
            segmentStart = close + 1;
        }
    }

    static class BlockSpan {
        final String name;
        final int start;
        final int payloadStart;
        final int payloadEnd;
        final int end;

        BlockSpan(String name, int start, int payloadStart, int payloadEnd, int end) {
            this.name = name;
            this.start = start;
            this.payloadStart = payloadStart;
            this.payloadEnd = payloadEnd;
            this.end = end;
        }
    }
}
