package com.jasmin.webloghunter.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder(toBuilder = true)
public class AnalysisResult {
    int filesRead;
    int parsedEvents;
    int parseFailures;

    List<AddressProfile> topSuspiciousIps;
    List<ToolSighting> toolsFirstSeen;
    List<EndpointExposure> vulnerableEndpoints;

    // null when no top address touched an identity endpoint
    String inferredScrapeSection;

    List<LogEvent> allEvents;
}
