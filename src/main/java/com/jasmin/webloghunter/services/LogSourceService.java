package com.jasmin.webloghunter.services;

import com.jasmin.webloghunter.config.HunterProperties;
import com.jasmin.webloghunter.exceptions.LogSourceException;
import com.jasmin.webloghunter.models.FileReadResult;
import com.jasmin.webloghunter.models.LogEvent;
import com.jasmin.webloghunter.models.ReadSummary;
import com.jasmin.webloghunter.parser.CombinedLogParser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.zip.GZIPInputStream;

/**
 * Resolves an input location into log files and parses them into events.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LogSourceService {

    private static final List<String> LOG_SUFFIXES = List.of(".log", ".log.gz", ".txt", ".gz");

    private final CombinedLogParser parser;
    private final HunterProperties properties;

    /**
     * A regular file resolves to itself; a directory to every log-like file below it, sorted by path.
     * Subdirectories and files that cannot be visited are skipped with a warning.
     */
    public List<Path> resolve(Path input) {
        if (!Files.isDirectory(input)) {
            return List.of(input);
        }
        LogFileCollector collector = new LogFileCollector();
        try {
            Files.walkFileTree(input, collector);
        } catch (IOException e) {
            throw new LogSourceException("Cannot list log directory " + input, e);
        }
        List<Path> files = collector.getFiles();
        Collections.sort(files);
        return files;
    }

    /**
     * Parses one file, gunzipping names ending in {@code .gz}. Undecodable bytes are replaced,
     * blank lines skipped, and non-matching lines counted as failures.
     */
    public FileReadResult readFile(Path file) throws IOException {
        List<LogEvent> events = new ArrayList<>();
        int failures = 0;

        try (BufferedReader reader = open(file)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (line.isEmpty()) {
                    continue;
                }
                Optional<LogEvent> event = parser.parseLine(line);
                if (event.isPresent()) {
                    events.add(event.get());
                } else {
                    failures++;
                }
            }
        }

        log.debug("Parsed {} events ({} failures) from {}", events.size(), failures, file);
        return new FileReadResult(file, events, failures);
    }

    /**
     * Reads every resolved file on a pool of {@code hunter.threads} workers. Results are joined in
     * resolution order, so the merged event list is the same as a sequential read.
     * <p>
     * An unreadable file is skipped with a warning when the input is a directory; for a single
     * file input it fails the read.
     */
    public ReadSummary readAll(Path input) {
        boolean directory = Files.isDirectory(input);
        List<Path> files = resolve(input);
        log.info("Resolved {} log file(s) from {}", files.size(), input);

        int workers = Math.max(1, Math.min(properties.getThreads(), files.size()));
        ExecutorService pool = Executors.newFixedThreadPool(workers);
        try {
            List<Future<FileReadResult>> futures = new ArrayList<>(files.size());
            for (Path file : files) {
                futures.add(pool.submit(() -> readFile(file)));
            }

            List<LogEvent> events = new ArrayList<>();
            int failures = 0;
            int filesRead = 0;
            for (int i = 0; i < futures.size(); i++) {
                Path file = files.get(i);
                FileReadResult result;
                try {
                    result = futures.get(i).get();
                } catch (ExecutionException e) {
                    Throwable cause = e.getCause() != null ? e.getCause() : e;
                    if (!directory) {
                        throw new LogSourceException("Cannot read log file " + file, cause);
                    }
                    log.warn("Skipping unreadable log file {}: {}", file, cause.toString());
                    continue;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    throw new LogSourceException("Interrupted while reading " + file, e);
                }
                events.addAll(result.getEvents());
                failures += result.getFailures();
                filesRead++;
            }
            return new ReadSummary(events, failures, filesRead);
        } finally {
            pool.shutdownNow();
        }
    }

    static boolean isLogFile(Path file) {
        String name = file.getFileName().toString();
        return LOG_SUFFIXES.stream().anyMatch(name::endsWith);
    }

    /**
     * Collects log-like regular files during a directory walk.
     */
    static class LogFileCollector extends SimpleFileVisitor<Path> {
        private final List<Path> files = new ArrayList<>();

        List<Path> getFiles() {
            return files;
        }

        @Override
        public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) {
            if (attrs.isRegularFile() && isLogFile(file)) {
                files.add(file);
            }
            return FileVisitResult.CONTINUE;
        }

        @Override
        public FileVisitResult visitFileFailed(Path file, IOException e) {
            log.warn("Skipping unreadable path {}: {}", file, e.toString());
            return FileVisitResult.CONTINUE;
        }
    }

    private static BufferedReader open(Path file) throws IOException {
        InputStream in = Files.newInputStream(file);
        try {
            if (file.getFileName().toString().endsWith(".gz")) {
                in = new GZIPInputStream(in);
            }
        } catch (IOException e) {
            in.close();
            throw e;
        }
        // InputStreamReader with a Charset substitutes malformed input
        return new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8));
    }
}
