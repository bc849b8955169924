package com.jasmin.webloghunter.detectors;

import com.jasmin.webloghunter.constants.Constants;
import org.springframework.stereotype.Component;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Classifies request targets against the attack catalog and user-agents against known clients.
 */
@Component
public class SignatureCatalog {

    private static final List<String> BROWSER_MARKERS = List.of("Mozilla/", "Chrome/", "Safari/", "Firefox/");

    /**
     * Every category whose patterns match the percent-decoded target. Categories are independent,
     * so all of them are evaluated; iteration order of the result is catalog order.
     */
    public Set<AttackCategory> detectAttacks(String rawRequestTarget) {
        String decoded = DetectorUtils.percentDecode(rawRequestTarget);
        Set<AttackCategory> detected = EnumSet.noneOf(AttackCategory.class);
        for (AttackCategory category : AttackCategory.values()) {
            if (category.matches(decoded)) {
                detected.add(category);
            }
        }
        return detected;
    }

    /**
     * Client identity for a user-agent: a known tool name, {@code browser}, {@code bot} or {@code null}.
     */
    public String detectTool(String userAgent) {
        if (userAgent == null || userAgent.isEmpty()) {
            return null;
        }

        for (ToolSignature tool : ToolSignature.values()) {
            if (tool.matches(userAgent)) {
                return tool.getToolName();
            }
        }

        if (BROWSER_MARKERS.stream().anyMatch(userAgent::contains)) {
            return Constants.BROWSER;
        }

        if (isBotUserAgent(userAgent)) {
            return Constants.BOT;
        }
        return null;
    }

    public boolean isBotUserAgent(String userAgent) {
        return userAgent != null && EndpointHints.BOT_USER_AGENTS.matcher(userAgent).find();
    }

    public boolean isApiEndpoint(String path) {
        return path != null && EndpointHints.API.matcher(path).find();
    }

    public boolean isSensitiveEndpoint(String path) {
        return path != null && EndpointHints.SENSITIVE.matcher(path).find();
    }

    public boolean hasSessionParameter(String url) {
        return url != null && EndpointHints.SESSION_PARAMS.matcher(url).find();
    }
}
