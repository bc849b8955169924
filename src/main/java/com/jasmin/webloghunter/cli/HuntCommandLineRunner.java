package com.jasmin.webloghunter.cli;

import com.jasmin.webloghunter.config.HunterProperties;
import com.jasmin.webloghunter.constants.Constants;
import com.jasmin.webloghunter.models.AddressProfile;
import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.reporters.ReportWriter;
import com.jasmin.webloghunter.services.HuntService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Batch entry point: {@code --input=<file|dir> [--out=report.md] [--json=report.json]
 * [--html=report.html] [--format=md|json|html|all] [--top=N] [--min-req=N]}.
 * <p>
 * Does nothing when {@code --input} is absent, which is how the HTTP mode starts.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HuntCommandLineRunner implements ApplicationRunner, ExitCodeGenerator {

    static final String USAGE = "Usage: weblog-hunter --input=<access.log|dir> [--out=report.md] [--json=report.json] "
            + "[--html=report.html] [--format=md|json|html|all] [--top=10] [--min-req=50]";

    private final HuntService huntService;
    private final HunterProperties properties;
    private final List<ReportWriter> writers;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        if (!args.containsOption("input")) {
            return;
        }

        String input = option(args, "input", null);
        if (input == null || input.isBlank()) {
            System.err.println(USAGE);
            exitCode = 2;
            return;
        }

        try {
            int topN = intOption(args, "top", properties.getTopIps());
            int minRequests = intOption(args, "min-req", properties.getMinRequests());

            log.info("Parsing logs from: {}", input);
            AnalysisResult result = huntService.hunt(Path.of(input), minRequests, topN);

            for (Map.Entry<ReportWriter, Path> target : reportTargets(args).entrySet()) {
                target.getKey().write(result, target.getValue());
                log.info("Wrote {} report: {}", target.getKey().format().toUpperCase(Locale.ROOT), target.getValue());
            }

            if (!result.getTopSuspiciousIps().isEmpty()) {
                AddressProfile top = result.getTopSuspiciousIps().get(0);
                log.info("Top suspicious IP: {} (score: {})", top.getAddress(), String.format(Locale.ROOT, "%.2f", top.getScore()));
            }
        } catch (Exception e) {
            log.error("Hunt failed for {}", input, e);
            exitCode = 1;
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }

    /**
     * Report writers to run and where each one writes.
     */
    Map<ReportWriter, Path> reportTargets(ApplicationArguments args) {
        String format = option(args, "format", null);
        String out = option(args, "out", "report.md");
        String json = option(args, "json", null);
        String html = option(args, "html", null);

        Map<ReportWriter, Path> targets = new LinkedHashMap<>();
        if (Constants.FORMAT_ALL.equalsIgnoreCase(format)) {
            String stem = stem(out);
            for (ReportWriter w : writers) {
                targets.put(w, Path.of(stem + w.extension()));
            }
            return targets;
        }

        if (format != null) {
            ReportWriter w = writer(format);
            targets.put(w, Path.of(singleFormatPath(w.format(), out, json, html)));
            return targets;
        }

        targets.put(writer(Constants.FORMAT_MARKDOWN), Path.of(out));
        if (json != null) {
            targets.put(writer(Constants.FORMAT_JSON), Path.of(json));
        }
        if (html != null) {
            targets.put(writer(Constants.FORMAT_HTML), Path.of(html));
        }
        return targets;
    }

    private static String singleFormatPath(String format, String out, String json, String html) {
        if (Constants.FORMAT_JSON.equals(format)) {
            return json != null ? json : "report.json";
        }
        if (Constants.FORMAT_HTML.equals(format)) {
            return html != null ? html : "report.html";
        }
        return out;
    }

    private ReportWriter writer(String format) {
        return writers.stream()
                .filter(w -> w.format().equalsIgnoreCase(format))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown report format: " + format));
    }

    private static String stem(String out) {
        String name = out;
        int dot = name.lastIndexOf('.');
        int sep = Math.max(name.lastIndexOf('/'), name.lastIndexOf('\\'));
        return dot > sep ? name.substring(0, dot) : name;
    }

    private static String option(ApplicationArguments args, String name, String defaultValue) {
        List<String> values = args.getOptionValues(name);
        if (values == null || values.isEmpty()) {
            return defaultValue;
        }
        return values.get(values.size() - 1);
    }

    private static int intOption(ApplicationArguments args, String name, int defaultValue) {
        String v = option(args, name, null);
        if (v == null || v.isBlank()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(v.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("--" + name + " must be an integer, got: " + v, e);
        }
    }
}
