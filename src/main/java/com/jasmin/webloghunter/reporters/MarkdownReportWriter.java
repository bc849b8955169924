package com.jasmin.webloghunter.reporters;

import com.jasmin.webloghunter.config.HunterProperties;
import com.jasmin.webloghunter.constants.Constants;
import com.jasmin.webloghunter.detectors.AttackCategory;
import com.jasmin.webloghunter.detectors.DetectorUtils;
import com.jasmin.webloghunter.models.AddressProfile;
import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.models.EndpointExposure;
import com.jasmin.webloghunter.models.LogEvent;
import com.jasmin.webloghunter.models.PathCount;
import com.jasmin.webloghunter.models.ToolSighting;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

@Component
@RequiredArgsConstructor
public class MarkdownReportWriter implements ReportWriter {
    private final HunterProperties properties;

    @Override
    public String format() {
        return Constants.FORMAT_MARKDOWN;
    }

    @Override
    public String extension() {
        return ".md";
    }

    @Override
    public String render(AnalysisResult result) {
        List<String> lines = new ArrayList<>();

        lines.add("# Web Log Recon Report\n");
        lines.add("- Files read: **" + result.getFilesRead() + "**");
        lines.add("- Parsed events: **" + result.getParsedEvents() + "**");
        lines.add("- Parse failures (non-matching lines): **" + result.getParseFailures() + "**\n");

        addressTable(result, lines);
        tools(result, lines);
        endpoints(result, lines);
        scrapeSection(result, lines);
        perAddress(result, lines);

        return String.join("\n", lines);
    }

    private void addressTable(AnalysisResult result, List<String> lines) {
        lines.add("## Top suspicious IPs (auto-scored)\n");
        if (result.getTopSuspiciousIps().isEmpty()) {
            lines.add("No IPs found matching the minimum request threshold.\n");
            return;
        }
        lines.add("| Rank | IP | Score | Requests |\n|---:|---|---:|---:|");
        int rank = 1;
        for (AddressProfile p : result.getTopSuspiciousIps()) {
            lines.add(String.format(Locale.ROOT, "| %d | %s | %.2f | %d |",
                    rank++, p.getAddress(), p.getScore(), p.getRequestCount()));
        }
        lines.add("");
    }

    private void tools(AnalysisResult result, List<String> lines) {
        lines.add("## Attacker tools (by first appearance in logs)\n");
        if (result.getToolsFirstSeen().isEmpty()) {
            lines.add("- No tool fingerprints found in User-Agent fields.");
        }
        for (ToolSighting t : result.getToolsFirstSeen()) {
            lines.add("- **" + t.getTool() + "**: first seen " + DetectorUtils.isoTimestamp(t.getFirstSeen()));
        }
        lines.add("");
    }

    private void endpoints(AnalysisResult result, List<String> lines) {
        lines.add("## Likely vulnerable SQLi endpoints (ranked)\n");
        List<EndpointExposure> endpoints = result.getVulnerableEndpoints();
        if (endpoints.isEmpty()) {
            lines.add("- No SQLi signatures found.\n");
            return;
        }
        lines.add("| Rank | Endpoint | Score | SQLi hits | SQLi+500 | Unique payloads |\n"
                + "|---:|---|---:|---:|---:|---:|");
        int rank = 1;
        for (EndpointExposure ep : endpoints.subList(0, Math.min(properties.getEndpointSummaryCap(), endpoints.size()))) {
            lines.add(String.format(Locale.ROOT, "| %d | `%s` | %d | %d | %d | %d |",
                    rank++, ep.getEndpoint(), ep.getScore(), ep.getSqliHits(), ep.getSqliServerErrors(), ep.getUniquePayloads()));
        }
        lines.add("");

        EndpointExposure top = endpoints.get(0);
        lines.add("### Example SQLi requests targeting `" + top.getEndpoint() + "`");
        for (String url : top.getExamples()) {
            lines.add("- `" + url + "`");
        }
        lines.add("");
    }

    private void scrapeSection(AnalysisResult result, List<String> lines) {
        lines.add("## Inferred section used for email scraping\n");
        if (result.getInferredScrapeSection() != null) {
            lines.add("- Most likely section: **`" + result.getInferredScrapeSection() + "`** "
                    + "(identity/user-related endpoint repeatedly hit by top suspicious IPs)\n");
        } else {
            lines.add("- Could not infer a scraping section (no strong identity endpoint hits "
                    + "among top suspicious IPs).\n");
        }
    }

    private void perAddress(AnalysisResult result, List<String> lines) {
        lines.add("## Per-IP movement (top suspicious IPs)\n");
        for (AddressProfile p : result.getTopSuspiciousIps()) {
            lines.add("### " + p.getAddress());
            lines.add("- Requests: **" + p.getRequestCount() + "**");
            lines.add("- Status codes: " + p.getStatusCodes().entrySet().stream()
                    .map(en -> en.getKey() + ":" + en.getValue())
                    .collect(Collectors.joining(", ")));
            if (!p.getToolsUsed().isEmpty()) {
                lines.add("- Tools: " + String.join(", ", p.getToolsUsed()));
            }

            lines.add("- Top endpoints:");
            for (PathCount pc : p.getTopPaths()) {
                lines.add("  - `" + pc.getPath() + "`: " + pc.getCount());
            }

            if (!p.getAbnormalExamples().isEmpty()) {
                lines.add("- Abnormal query examples:");
                for (LogEvent e : p.getAbnormalExamples()) {
                    String tags = e.getAttackTags().stream().map(AttackCategory::getLabel).collect(Collectors.joining(","));
                    lines.add("  - **" + tags + "** `" + e.getRequestTarget() + "` (status " + e.getStatus() + ")");
                }
            }
            lines.add("");
        }
    }
}
