package org.dxworks.pagecanvas;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.dxworks.pagecanvas.analysis.PageAnalysis;
import org.dxworks.pagecanvas.analysis.PageAnalyzer;

import java.io.BufferedWriter;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Stream;

public class App {
    private static final ObjectMapper MAPPER = new ObjectMapper();

    public static void main(String[] args) throws Exception {
        if (args.length < 2) {
            System.err.println("Usage: java -jar page-canvas.jar <input-folder> <output-file>");
            System.err.println("  <input-folder>: Path to a directory of canvas markup files, or a single file");
            System.err.println("  <output-file>:  Path to output JSONL file");
            System.exit(2);
        }

        Path input = Paths.get(args[0]);
        if (!Files.exists(input)) {
            System.err.println("Error: Input path does not exist: " + input);
            System.exit(1);
        }

        Path jsonlOutput = Paths.get(args[1]);
        if (jsonlOutput.getParent() != null) {
            Files.createDirectories(jsonlOutput.getParent());
        }

        System.out.println("Starting page canvas analysis...");
        System.out.println("Input: " + input.toAbsolutePath());

        PageCanvasConfig config = PageCanvasConfig.load();
        PageAnalyzer analyzer = new PageAnalyzer(config);
        List<Path> files = collectMarkupFiles(input, config);
        System.out.println("Found " + files.size() + " markup files");

        Instant startTime = Instant.now();
        AtomicInteger successCount = new AtomicInteger(0);
        AtomicInteger errorCount = new AtomicInteger(0);
        AtomicInteger progressCounter = new AtomicInteger(0);

        try (BufferedWriter writer = Files.newBufferedWriter(jsonlOutput, StandardCharsets.UTF_8)) {
            Map<String, Object> runInfo = new HashMap<>();
            runInfo.put("kind", "run");
            runInfo.put("started_at", startTime.toString());
            runInfo.put("input_path", input.toString());
            runInfo.put("total_files", files.size());
            runInfo.put("data_version", config.getDataVersion());
            writer.write(MAPPER.writeValueAsString(runInfo));
            writer.newLine();

            // one page per file, nothing shared between them
            files.parallelStream().forEach(file -> {
                int current = progressCounter.incrementAndGet();

                synchronized (System.out) {
                    System.out.println("[" + current + "/" + files.size() + "] Parsing " + file.getFileName());
                }

                try {
                    PageAnalysis analysis = analyzeFile(file, analyzer);

                    synchronized (writer) {
                        writer.write(MAPPER.writeValueAsString(analysis));
                        writer.newLine();
                        writer.flush();
                    }

                    successCount.incrementAndGet();
                } catch (Exception e) {
                    Map<String, String> error = new HashMap<>();
                    error.put("kind", "error");
                    error.put("file", file.toString());
                    error.put("error_type", e.getClass().getSimpleName());
                    error.put("error", e.getMessage());

                    try {
                        synchronized (writer) {
                            writer.write(MAPPER.writeValueAsString(error));
                            writer.newLine();
                            writer.flush();
                        }
                    } catch (IOException ioException) {
                        System.err.println("Failed to write error for " + file + ": " + ioException.getMessage());
                    }

                    errorCount.incrementAndGet();
                    synchronized (System.err) {
                        System.err.println("  Error parsing " + file.getFileName() + ": " + e.getMessage());
                    }
                }
            });

            Instant endTime = Instant.now();
            Map<String, Object> doneInfo = new HashMap<>();
            doneInfo.put("kind", "done");
            doneInfo.put("ended_at", endTime.toString());
            doneInfo.put("pages_parsed", successCount.get());
            doneInfo.put("pages_with_errors", errorCount.get());
            doneInfo.put("duration_seconds", Duration.between(startTime, endTime).getSeconds());
            writer.write(MAPPER.writeValueAsString(doneInfo));
            writer.newLine();
        }

        System.out.println("\n" + "=".repeat(60));
        System.out.println("Analysis complete!");
        System.out.println("Successfully parsed: " + successCount.get() + " pages");
        if (errorCount.get() > 0) {
            System.out.println("Errors: " + errorCount.get());
        }
        System.out.println("Output written to: " + jsonlOutput.toAbsolutePath());
        System.out.println("=".repeat(60));
    }

    static List<Path> collectMarkupFiles(Path input, PageCanvasConfig config) throws IOException {
        List<Path> files = new ArrayList<>();
        int maxFileLines = config.getMaxFileLines();

        if (Files.isDirectory(input)) {
            try (Stream<Path> stream = Files.walk(input)) {
                stream.filter(Files::isRegularFile)
                      .filter(p -> config.acceptsFileName(p.getFileName().toString()))
                      .filter(p -> withinMaxLines(p, maxFileLines))
                      .sorted()
                      .forEach(files::add);
            }
        } else if (Files.isRegularFile(input)) {
            if (config.acceptsFileName(input.getFileName().toString()) && withinMaxLines(input, maxFileLines)) {
                files.add(input);
            }
        }

        return files;
    }

    private static boolean withinMaxLines(Path path, int maxFileLines) {
        try (Stream<String> lines = Files.lines(path, StandardCharsets.UTF_8)) {
            long count = lines.limit((long) maxFileLines + 1L).count();
            return count <= maxFileLines;
        } catch (IOException | UncheckedIOException e) {
            // let the parse report it
            return true;
        }
    }

    public static PageAnalysis analyzeFile(Path filePath, PageAnalyzer analyzer) throws IOException {
        String markup = Files.readString(filePath, StandardCharsets.UTF_8);

        // Remove BOM if present
        if (markup.startsWith("\uFEFF")) {
            markup = markup.substring(1);
        }

        return analyzer.analyze(filePath.toString(), markup);
    }
}
