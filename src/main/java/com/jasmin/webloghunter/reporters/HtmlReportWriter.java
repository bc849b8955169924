package com.jasmin.webloghunter.reporters;

import com.jasmin.webloghunter.config.HunterProperties;
import com.jasmin.webloghunter.constants.Constants;
import com.jasmin.webloghunter.detectors.DetectorUtils;
import com.jasmin.webloghunter.models.AddressProfile;
import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.models.EndpointExposure;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;
import org.thymeleaf.ITemplateEngine;
import org.thymeleaf.context.Context;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Standalone HTML page rendered from {@code templates/report.html}.
 * <p>
 * Numbers and timestamps are formatted here so the template only places text.
 */
@Component
@RequiredArgsConstructor
public class HtmlReportWriter implements ReportWriter {
    static final String TEMPLATE = "report";

    private final ITemplateEngine templateEngine;
    private final HunterProperties properties;

    @Override
    public String format() {
        return Constants.FORMAT_HTML;
    }

    @Override
    public String extension() {
        return ".html";
    }

    @Override
    public String render(AnalysisResult result) {
        List<EndpointExposure> endpoints = result.getVulnerableEndpoints();

        Context context = new Context(Locale.ROOT);
        context.setVariable("result", result);
        context.setVariable("addresses", result.getTopSuspiciousIps().stream()
                .map(AddressRow::of)
                .collect(Collectors.toList()));
        context.setVariable("tools", result.getToolsFirstSeen().stream()
                .map(t -> new ToolRow(t.getTool(), DetectorUtils.isoTimestamp(t.getFirstSeen())))
                .collect(Collectors.toList()));
        context.setVariable("endpoints", endpoints.subList(0, Math.min(properties.getEndpointSummaryCap(), endpoints.size())));
        context.setVariable("topEndpoint", endpoints.isEmpty() ? null : endpoints.get(0));
        return templateEngine.process(TEMPLATE, context);
    }

    @Value
    public static class ToolRow {
        String tool;
        String firstSeen;
    }

    @Value
    public static class AddressRow {
        AddressProfile profile;
        String score;
        String scoreClass;
        String statusCodes;

        static AddressRow of(AddressProfile p) {
            String scoreClass = p.getScore() > 10 ? "high-score" : p.getScore() > 5 ? "medium-score" : "low-score";
            String statusCodes = p.getStatusCodes().entrySet().stream()
                    .map(en -> en.getKey() + ":" + en.getValue())
                    .collect(Collectors.joining(", "));
            return new AddressRow(p, String.format(Locale.ROOT, "%.2f", p.getScore()), scoreClass, statusCodes);
        }
    }
}
