package com.jasmin.webloghunter.reporters;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.jasmin.webloghunter.config.HunterProperties;
import com.jasmin.webloghunter.constants.Constants;
import com.jasmin.webloghunter.detectors.AttackCategory;
import com.jasmin.webloghunter.detectors.DetectorUtils;
import com.jasmin.webloghunter.models.AddressProfile;
import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.models.EndpointExposure;
import com.jasmin.webloghunter.models.LogEvent;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JSON projection of an analysis: a {@code summary} block, per-address detail, endpoints and a
 * capped dump of raw events. Field names are snake_case.
 */
@Component
@RequiredArgsConstructor
public class JsonReportWriter implements ReportWriter {
    private final ObjectMapper objectMapper;
    private final HunterProperties properties;

    @Override
    public String format() {
        return Constants.FORMAT_JSON;
    }

    @Override
    public String extension() {
        return ".json";
    }

    @Override
    public String render(AnalysisResult result) {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(toDocument(result));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise analysis report", e);
        }
    }

    public Map<String, Object> toDocument(AnalysisResult result) {
        Map<String, Object> doc = new LinkedHashMap<>();
        doc.put("summary", summary(result));
        doc.put("top_ips_detail", result.getTopSuspiciousIps().stream().map(JsonReportWriter::address).collect(Collectors.toList()));
        doc.put("vulnerable_endpoints", result.getVulnerableEndpoints().stream().map(JsonReportWriter::endpoint).collect(Collectors.toList()));
        doc.put("events", result.getAllEvents().stream()
                .limit(properties.getEventDumpCap())
                .map(JsonReportWriter::event)
                .collect(Collectors.toList()));
        return doc;
    }

    public Map<String, Object> summary(AnalysisResult result) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("files_read", result.getFilesRead());
        summary.put("parsed_events", result.getParsedEvents());
        summary.put("parse_failures", result.getParseFailures());
        summary.put("top_suspicious_ips", result.getTopSuspiciousIps().stream()
                .map(AddressProfile::getAddress)
                .collect(Collectors.toList()));
        summary.put("tools_by_first_seen", result.getToolsFirstSeen().stream()
                .map(t -> List.of(t.getTool(), DetectorUtils.isoTimestamp(t.getFirstSeen())))
                .collect(Collectors.toList()));
        summary.put("top_sqli_endpoints", result.getVulnerableEndpoints().stream()
                .limit(properties.getEndpointSummaryCap())
                .map(EndpointExposure::getEndpoint)
                .collect(Collectors.toList()));
        summary.put("inferred_scrape_section", result.getInferredScrapeSection());
        return summary;
    }

    private static Map<String, Object> address(AddressProfile p) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ip", p.getAddress());
        m.put("request_count", p.getRequestCount());
        m.put("score", p.getScore());
        m.put("status_codes", p.getStatusCodes());
        m.put("abnormal_count", p.getAbnormalCount());
        m.put("login_attempts", p.getLoginAttempts());
        m.put("identity_queries", p.getIdentityQueries());
        m.put("max_requests_per_minute", p.getMaxRequestsPerMinute());
        m.put("top_paths", p.getTopPaths().stream()
                .map(pc -> List.of(pc.getPath(), pc.getCount()))
                .collect(Collectors.toList()));
        m.put("abnormal_examples", p.getAbnormalExamples().stream().map(JsonReportWriter::event).collect(Collectors.toList()));
        m.put("tools_used", List.copyOf(p.getToolsUsed()));
        return m;
    }

    private static Map<String, Object> endpoint(EndpointExposure ep) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("endpoint", ep.getEndpoint());
        m.put("score", ep.getScore());
        m.put("sqli_hits", ep.getSqliHits());
        m.put("sqli_500", ep.getSqliServerErrors());
        m.put("unique_payloads", ep.getUniquePayloads());
        m.put("examples", ep.getExamples());
        return m;
    }

    private static Map<String, Object> event(LogEvent e) {
        Map<String, Object> m = new LinkedHashMap<>();
        m.put("ip", e.getAddress());
        m.put("timestamp", DetectorUtils.isoTimestamp(e.getTimestamp()));
        m.put("method", e.getMethod());
        m.put("url", e.getRequestTarget());
        m.put("path", e.getPath());
        m.put("query", e.getQuery());
        m.put("status", e.getStatus());
        m.put("bytes", e.getByteCount());
        m.put("user_agent", e.getUserAgent());
        m.put("referer", e.getReferer());
        m.put("tool", e.getDetectedTool());
        m.put("abnormal", e.getAttackTags().stream().map(AttackCategory::getLabel).collect(Collectors.toList()));
        return m;
    }
}
