package com.solidfire.log.filter;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.solidfire.log.filter.RecordFilter.FieldMatch;
import com.solidfire.log.parser.model.FlatRecord;
import com.solidfire.log.parser.sink.JsonlChunkSink;
import com.solidfire.log.parser.sink.RecordSource;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * Time-range and field filter over parsed SolidFire records
 */
@Command(name = "recordFilter", mixinStandardHelpOptions = true, version = "1.0",
         description = "Filter parsed SolidFire records by date/time range and field values")
public class LogFilter implements Callable<Integer> {

    private static Logger logger = LoggerFactory.getLogger(LogFilter.class);

    private static final ObjectMapper mapper = new ObjectMapper();

    @Option(names = { "-f", "--files" }, arity = "1..*", required = true,
            description = "Record files (.jsonl, .json, optionally .gz)")
    private List<String> files;

    @Option(names = { "-o", "--output" }, required = true, description = "Output JSON file")
    private String outputFile;

    @Option(names = "--start-date", description = "Start date (YYYY-MM-DD)")
    private String startDate;

    @Option(names = "--end-date", description = "End date (YYYY-MM-DD)")
    private String endDate;

    @Option(names = "--start-time", description = "Start time (HH:MM:SS or HH:MM)")
    private String startTime;

    @Option(names = "--end-time", description = "End time (HH:MM:SS or HH:MM)")
    private String endTime;

    @Option(names = "--field", description = "Field filter field=value, repeatable; 'null' matches null values")
    private List<String> fieldFilters = new ArrayList<>();

    @Option(names = "--complete-schema", description = "Give every output record the full set of fields, missing ones as null")
    private boolean completeSchema = false;

    @Override
    public Integer call() throws Exception {
        RecordFilter filter;
        try {
            filter = buildFilter();
        } catch (IllegalArgumentException e) {
            System.err.println(e.getMessage());
            return 2;
        }

        List<File> inputs = new ArrayList<>();
        for (String name : files) {
            inputs.add(new File(name));
        }

        long start = System.currentTimeMillis();
        List<FlatRecord> matched = new ArrayList<>();
        long total;
        try {
            total = RecordSource.forEachRecord(inputs, record -> {
                if (filter.matches(record)) {
                    matched.add(record);
                }
            });
        } catch (FileNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Failed to read records: " + e.getMessage());
            return 1;
        }

        List<FlatRecord> output = completeSchema ? SchemaReconciler.reconcile(matched) : matched;
        write(output, outputFile);

        long duration = System.currentTimeMillis() - start;
        double pct = total > 0 ? matched.size() * 100.0 / total : 0.0;
        System.out.printf("Filtered %,d of %,d records (%.1f%%) in %.1f seconds%n",
                matched.size(), total, pct, duration / 1000.0);
        System.out.println("Output: " + outputFile);
        return 0;
    }

    RecordFilter buildFilter() {
        TimeFilter timeFilter = new TimeFilter(startDate, endDate, startTime, endTime);
        List<FieldMatch> matches = new ArrayList<>();
        for (String expression : fieldFilters) {
            matches.add(RecordFilter.parseFieldMatch(expression));
        }
        if (timeFilter.isActive()) {
            logger.info("Time filter: {}", timeFilter);
        }
        if (!matches.isEmpty()) {
            logger.info("Field filters: {}", matches);
        }
        return new RecordFilter(timeFilter, matches);
    }

    static void write(List<FlatRecord> records, String fileName) throws IOException {
        ArrayNode array = mapper.createArrayNode();
        for (FlatRecord record : records) {
            array.add(JsonlChunkSink.toJson(record));
        }
        try (Writer writer = Files.newBufferedWriter(Paths.get(fileName), StandardCharsets.UTF_8)) {
            mapper.writerWithDefaultPrettyPrinter().writeValue(writer, array);
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LogFilter()).execute(args);
        System.exit(exitCode);
    }
}
