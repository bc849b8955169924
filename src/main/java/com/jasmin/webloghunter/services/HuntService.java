package com.jasmin.webloghunter.services;

import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.models.ReadSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;

@Slf4j
@Service
@RequiredArgsConstructor
public class HuntService {
    private final LogSourceService logSourceService;
    private final ThreatAnalyzer threatAnalyzer;

    public AnalysisResult hunt(Path input, int minRequests, int topN) {
        ReadSummary read = logSourceService.readAll(input);
        log.info("Parsed {} events from {} file(s), {} line(s) failed to parse",
                read.getEvents().size(), read.getFilesRead(), read.getFailures());

        return threatAnalyzer.analyze(read.getEvents(), minRequests, topN).toBuilder()
                .filesRead(read.getFilesRead())
                .parseFailures(read.getFailures())
                .build();
    }
}
