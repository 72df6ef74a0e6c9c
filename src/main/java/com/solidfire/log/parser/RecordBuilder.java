package com.solidfire.log.parser;

import java.util.Map;

import com.solidfire.log.parser.model.FlatRecord;
import com.solidfire.log.parser.model.KeyValue;
import com.solidfire.log.parser.model.LineTokens;
import com.solidfire.log.parser.model.NestedObject;

/**
 * Turns the tokens of one line into exactly one {@link FlatRecord}.
 *
 * <p>Fields are written in phases with a fixed precedence:</p>
 * <ol>
 * <li>line_number, then timestamp when present</li>
 * <li>nested object fields <code>name_key</code> and <code>name_details</code>; a later
 * block with the same name overwrites an earlier one at colliding keys</li>
 * <li>header fields and raw_line (when enabled), only where the field is still unset</li>
 * <li>loose key=value pairs, only where the field is still unset</li>
 * </ol>
 * Nested object data therefore always wins over a loose pair of the same literal name.
 * Building never fails; malformed lines simply produce fewer fields.
 */
public class RecordBuilder {

    private final boolean headerEnabled;
    private final boolean rawLineEnabled;

    public RecordBuilder() {
        this(false, false);
    }

    public RecordBuilder(boolean headerEnabled, boolean rawLineEnabled) {
        this.headerEnabled = headerEnabled;
        this.rawLineEnabled = rawLineEnabled;
    }

    public RecordBuilder(ParserConfig config) {
        this(config.isHeaderEnabled(), config.isRawLineEnabled());
    }

    /**
     * Extracts and builds in one step.
     */
    public FlatRecord build(String line, long lineNumber) {
        return build(line, TokenExtractor.extract(line), lineNumber);
    }

    /**
     * Builds a record from already extracted tokens. Header and raw_line fields are
     * not available this way since they need the line itself.
     */
    public FlatRecord build(LineTokens tokens, long lineNumber) {
        return build(null, tokens, lineNumber);
    }

    private FlatRecord build(String line, LineTokens tokens, long lineNumber) {
        FlatRecord record = new FlatRecord(lineNumber);

        if (tokens.getTimestamp() != null) {
            record.put(FlatRecord.TIMESTAMP, tokens.getTimestamp());
        }

        for (NestedObject nested : tokens.getNestedObjects()) {
            String prefix = nested.getName() + "_";
            if (nested.hasDetails()) {
                record.put(prefix + FlatRecord.DETAILS_SUFFIX, nested.getDetails());
            }
            for (KeyValue kv : nested.getPairs()) {
                record.put(prefix + kv.getKey(), kv.getValue());
            }
        }

        if (line != null) {
            if (headerEnabled) {
                for (Map.Entry<String, String> entry : HeaderParser.parse(line).entrySet()) {
                    record.putIfAbsent(entry.getKey(), entry.getValue());
                }
            }
            if (rawLineEnabled) {
                record.putIfAbsent(FlatRecord.RAW_LINE, line);
            }
        }

        for (KeyValue kv : tokens.getLoosePairs()) {
            record.putIfAbsent(kv.getKey(), kv.getValue());
        }

        return record;
    }
}
