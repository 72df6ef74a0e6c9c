package com.solidfire.log.analyzer;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.solidfire.log.parser.ParserConfig;
import com.solidfire.log.parser.sink.RecordSource;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(name = "fieldMappings", mixinStandardHelpOptions = true, version = "1.0",
         description = "Analyze which fields belong to which SolidFire component")
public class FieldMappingApp implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(FieldMappingApp.class);

    @Option(names = { "-f", "--files" }, arity = "1..*", description = "Record files (.jsonl, .json, optionally .gz)")
    private List<String> fileNames = new ArrayList<>();

    @Option(names = { "-b", "--base" }, description = "Output base of a preprocessing run; reads all of its chunk files")
    private String outputBase;

    @Option(names = { "--config" }, description = "Configuration properties file (standard field set)")
    private String configFile;

    @Option(names = { "--json" }, description = "Write the report as JSON to this file")
    private String jsonReportFile;

    @Option(names = { "--csv" }, description = "Write per-component field statistics as CSV to this file")
    private String csvReportFile;

    @Override
    public Integer call() throws Exception {
        List<File> files = resolveInputFiles();
        if (files.isEmpty()) {
            System.err.println("No input files. Use -f <files> or -b <output base>");
            return 1;
        }

        ParserConfig config;
        try {
            config = loadConfiguration();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        FieldMappingAnalyzer analyzer = new FieldMappingAnalyzer(config);
        System.out.println("Loading " + files.size() + " record file(s)");
        try {
            long count = RecordSource.forEachRecord(files, analyzer::accumulate);
            logger.info("Read {} records from {} files", count, files.size());
        } catch (FileNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (IOException e) {
            System.err.println("Failed to read records: " + e.getMessage());
            return 1;
        }

        FieldMappingReport report = analyzer.buildReport();
        if (report.getTotalRecords() == 0) {
            System.out.println("No data found");
        }
        report.report(System.out);

        if (jsonReportFile != null) {
            JsonReportGenerator.generateReport(jsonReportFile, report);
            System.out.println("\nJSON report written to: " + jsonReportFile);
        }
        if (csvReportFile != null) {
            report.reportCsv(csvReportFile);
            System.out.println("CSV report written to: " + csvReportFile);
        }
        return 0;
    }

    List<File> resolveInputFiles() {
        List<File> files = new ArrayList<>();
        for (String name : fileNames) {
            files.add(new File(name));
        }
        if (outputBase != null) {
            List<File> chunks = RecordSource.findChunkFiles(outputBase);
            if (chunks.isEmpty()) {
                logger.warn("No chunk files found for base {}", outputBase);
            }
            files.addAll(chunks);
        }
        return files;
    }

    private ParserConfig loadConfiguration() {
        if (configFile == null) {
            return new ParserConfig();
        }
        try {
            ParserConfig config = ParserConfig.load(configFile);
            logger.info("Loaded configuration from: {}", configFile);
            return config;
        } catch (IOException e) {
            logger.warn("Could not load config file: {}. Using defaults.", configFile);
            return new ParserConfig();
        }
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new FieldMappingApp()).execute(args);
        System.exit(exitCode);
    }
}
