package com.jasmin.webloghunter.controllers;

import com.jasmin.webloghunter.config.HunterProperties;
import com.jasmin.webloghunter.exceptions.LogSourceException;
import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.reporters.JsonReportWriter;
import com.jasmin.webloghunter.services.HuntService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/hunt")
@RequiredArgsConstructor
public class HuntController {

    private final HuntService huntService;
    private final JsonReportWriter jsonReportWriter;
    private final HunterProperties properties;

    @GetMapping
    public Map<String, Object> hunt(
            @RequestParam String input,
            @RequestParam(required = false) Integer minRequests,
            @RequestParam(required = false) Integer top) {
        return jsonReportWriter.toDocument(run(input, minRequests, top));
    }

    @GetMapping("/summary")
    public Map<String, Object> summary(
            @RequestParam String input,
            @RequestParam(required = false) Integer minRequests,
            @RequestParam(required = false) Integer top) {
        return jsonReportWriter.summary(run(input, minRequests, top));
    }

    private AnalysisResult run(String input, Integer minRequests, Integer top) {
        int min = minRequests != null ? minRequests : properties.getMinRequests();
        int topN = top != null ? top : properties.getTopIps();
        if (min < 1 || topN < 1) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "minRequests and top must be positive");
        }

        try {
            return huntService.hunt(resolveInput(input), min, topN);
        } catch (LogSourceException | InvalidPathException e) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, e.getMessage(), e);
        }
    }

    /**
     * Resolves {@code input} against {@code hunter.log-root}. Anything that normalises to a path
     * outside the root is rejected.
     */
    Path resolveInput(String input) {
        Path root = Path.of(properties.getLogRoot()).toAbsolutePath().normalize();
        Path resolved = root.resolve(input).normalize();
        if (!resolved.startsWith(root)) {
            log.warn("Rejected hunt input outside the log root: {}", input);
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "input must be inside the log root");
        }
        return resolved;
    }
}
