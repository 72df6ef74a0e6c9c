package com.solidfire.log.parser;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.solidfire.log.parser.sink.ChunkSinkException;
import com.solidfire.log.parser.sink.JsonlChunkSink;

import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

/**
 * SolidFire log preprocessor: converts a log file into chunked JSON Lines files of flat records.
 */
@Command(name = "sfParser", mixinStandardHelpOptions = true, version = "1.0",
         description = "Convert SolidFire log lines into flat records written as chunk files <output>.chunk_<line>.jsonl")
public class LogParser implements Callable<Integer> {

    static final Logger logger = LoggerFactory.getLogger(LogParser.class);

    @Option(names = { "-f", "--file" }, description = "SolidFire log file (plain, .gz or .zip)", required = true)
    private String fileName;

    @Option(names = { "-o", "--output" }, description = "Output base name (default: input file name without extension)")
    private String outputBase;

    @Option(names = { "-c", "--chunk-size" }, description = "Records per chunk file (default: 50000)")
    private Integer chunkSize;

    @Option(names = { "--config" }, description = "Parser configuration properties file")
    private String configFile;

    @Option(names = { "--no-header" }, description = "Do not parse the SolidFire line header into standard fields")
    private boolean noHeader = false;

    @Option(names = { "--raw-line" }, description = "Keep the original line in a raw_line field")
    private boolean rawLine = false;

    @Option(names = { "--progress" }, description = "Log progress every N lines, 0 disables (default: 10000)")
    private Integer progressInterval;

    @Override
    public Integer call() throws Exception {
        System.out.println("SolidFire Log Preprocessor");

        ParserConfig config;
        try {
            config = loadConfiguration();
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            return 2;
        }

        File input = new File(fileName);
        String base = outputBase != null ? outputBase : defaultOutputBase(input);
        System.out.println("Parsing " + input + " to " + base + JsonlChunkSink.CHUNK_INFIX + "*" + JsonlChunkSink.EXTENSION);

        JsonlChunkSink sink = new JsonlChunkSink(base);
        LogPreprocessor preprocessor = new LogPreprocessor(config);
        ProcessingStats stats;
        try {
            LogPreprocessor.checkReadable(input);
            int removed = sink.removeExistingChunks();
            if (removed > 0) {
                System.out.println("Removed " + removed + " chunk files from a previous run");
            }
            stats = preprocessor.process(input, sink);
        } catch (FileNotFoundException e) {
            System.err.println(e.getMessage());
            return 1;
        } catch (ChunkSinkException e) {
            System.err.println("Failed to save chunk starting at line " + e.getStartLine() + ": " + e.getMessage());
            logger.error("Chunk sink failure", e);
            return 1;
        } catch (IOException e) {
            System.err.println("Failed to remove previous chunk files: " + e.getMessage());
            logger.error("Could not clear output base {}", base, e);
            return 1;
        }

        System.out.printf("Processed %,d lines into %,d records (%d chunk files) in %.1f seconds (%.0f lines/sec)%n",
                stats.linesRead, stats.records, stats.chunks, stats.durationMillis / 1000.0, stats.getLinesPerSecond());
        for (File written : sink.getWrittenFiles()) {
            System.out.println("  " + written);
        }
        System.out.println("Preprocessing complete! Output: " + base);
        return 0;
    }

    ParserConfig loadConfiguration() {
        ParserConfig config = new ParserConfig();
        if (configFile != null) {
            try {
                config = ParserConfig.load(configFile);
                logger.info("Loaded parser configuration from: {}", configFile);
            } catch (IOException e) {
                logger.warn("Could not load config file: {}. Using defaults.", configFile);
            }
        }
        if (chunkSize != null) {
            config.setChunkSize(chunkSize);
        }
        if (progressInterval != null) {
            config.setProgressInterval(progressInterval);
        }
        if (noHeader) {
            config.setHeaderEnabled(false);
        }
        if (rawLine) {
            config.setRawLineEnabled(true);
        }
        return config;
    }

    static String defaultOutputBase(File input) {
        String name = input.getName();
        if (name.endsWith(".gz") || name.endsWith(".zip")) {
            name = name.substring(0, name.lastIndexOf('.'));
        }
        int dotIndex = name.lastIndexOf('.');
        if (dotIndex > 0) {
            name = name.substring(0, dotIndex);
        }
        File parent = input.getParentFile();
        return parent != null ? new File(parent, name).getPath() : name;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new LogParser()).execute(args);
        System.exit(exitCode);
    }
}
