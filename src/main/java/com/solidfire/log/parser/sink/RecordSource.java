package com.solidfire.log.parser.sink;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import java.util.zip.GZIPInputStream;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.solidfire.log.parser.model.FlatRecord;

/**
 * Reads previously emitted records back. Two layouts are understood:
 * JSON Lines chunk files (one object per line) and JSON array files as written by the
 * record filter. Either may be gzip compressed. Scalar values come back as strings,
 * JSON null stays null.
 */
public class RecordSource {

    private static final ObjectMapper mapper = new ObjectMapper();

    private RecordSource() {
    }

    /**
     * Streams every record of the given files, in file order, to the consumer.
     * @return number of records read
     */
    public static long forEachRecord(List<File> files, Consumer<FlatRecord> consumer) throws IOException {
        long count = 0;
        for (File file : files) {
            count += forEachRecord(file, consumer);
        }
        return count;
    }

    public static long forEachRecord(File file, Consumer<FlatRecord> consumer) throws IOException {
        if (!file.exists() || !file.canRead()) {
            throw new FileNotFoundException("Cannot read record file: " + file);
        }
        try (BufferedReader reader = createReader(file)) {
            if (isJsonArrayFile(file)) {
                return readArray(file, reader, consumer);
            }
            return readLines(file, reader, consumer);
        }
    }

    public static List<FlatRecord> readAll(List<File> files) throws IOException {
        List<FlatRecord> records = new ArrayList<>();
        forEachRecord(files, records::add);
        return records;
    }

    private static long readLines(File file, BufferedReader reader, Consumer<FlatRecord> consumer) throws IOException {
        long count = 0;
        int lineNum = 0;
        String line;
        while ((line = reader.readLine()) != null) {
            lineNum++;
            if (line.isBlank()) {
                continue;
            }
            JsonNode node;
            try {
                node = mapper.readTree(line);
            } catch (JsonProcessingException e) {
                throw new IOException("Invalid JSON record at " + file + ":" + lineNum, e);
            }
            consumer.accept(toRecord(node, file));
            count++;
        }
        return count;
    }

    private static long readArray(File file, BufferedReader reader, Consumer<FlatRecord> consumer) throws IOException {
        long count = 0;
        try (JsonParser parser = mapper.getFactory().createParser(reader)) {
            if (parser.nextToken() != JsonToken.START_ARRAY) {
                throw new IOException("Expected a JSON array of records in " + file);
            }
            while (parser.nextToken() == JsonToken.START_OBJECT) {
                JsonNode node = mapper.readTree(parser);
                consumer.accept(toRecord(node, file));
                count++;
            }
        } catch (JsonProcessingException e) {
            throw new IOException("Invalid JSON in " + file + ": " + e.getOriginalMessage(), e);
        }
        return count;
    }

    static FlatRecord toRecord(JsonNode node, File file) throws IOException {
        if (!node.isObject()) {
            throw new IOException("Expected a JSON object record in " + file + " but found " + node.getNodeType());
        }
        Map<String, String> values = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            JsonNode value = field.getValue();
            if (value == null || value.isNull()) {
                values.put(field.getKey(), null);
            } else if (value.isValueNode()) {
                values.put(field.getKey(), value.asText());
            } else {
                values.put(field.getKey(), value.toString());
            }
        }
        return FlatRecord.fromMap(values);
    }

    private static boolean isJsonArrayFile(File file) {
        String name = stripGzip(file.getName());
        return name.endsWith(".json");
    }

    private static String stripGzip(String name) {
        return name.endsWith(".gz") ? name.substring(0, name.length() - 3) : name;
    }

    private static BufferedReader createReader(File file) throws IOException {
        InputStream in = new FileInputStream(file);
        if (file.getName().endsWith(".gz")) {
            in = new GZIPInputStream(in);
        }
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }

    /**
     * Lists the chunk files written for an output base, ordered by start line.
     */
    public static List<File> findChunkFiles(String outputBase) {
        File baseFile = new File(outputBase);
        File dir = baseFile.getAbsoluteFile().getParentFile();
        String prefix = baseFile.getName() + JsonlChunkSink.CHUNK_INFIX;
        File[] matches = dir == null ? null : dir.listFiles((d, name) ->
                name.startsWith(prefix) && name.endsWith(JsonlChunkSink.EXTENSION)
                && isNumeric(name.substring(prefix.length(), name.length() - JsonlChunkSink.EXTENSION.length())));
        if (matches == null) {
            return new ArrayList<>();
        }
        List<File> result = new ArrayList<>(Arrays.asList(matches));
        result.sort(Comparator.comparingLong(f -> startLineOf(f.getName(), prefix)));
        return result;
    }

    private static long startLineOf(String name, String prefix) {
        return Long.parseLong(name.substring(prefix.length(), name.length() - JsonlChunkSink.EXTENSION.length()));
    }

    private static boolean isNumeric(String s) {
        if (s.isEmpty()) {
            return false;
        }
        for (int i = 0; i < s.length(); i++) {
            if (!Character.isDigit(s.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
