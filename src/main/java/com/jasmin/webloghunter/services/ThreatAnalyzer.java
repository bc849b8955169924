package com.jasmin.webloghunter.services;

import com.jasmin.webloghunter.constants.Constants;
import com.jasmin.webloghunter.detectors.AttackCategory;
import com.jasmin.webloghunter.detectors.DetectorUtils;
import com.jasmin.webloghunter.detectors.EndpointHints;
import com.jasmin.webloghunter.models.AddressProfile;
import com.jasmin.webloghunter.models.AnalysisResult;
import com.jasmin.webloghunter.models.EndpointExposure;
import com.jasmin.webloghunter.models.LogEvent;
import com.jasmin.webloghunter.models.PathCount;
import com.jasmin.webloghunter.models.ToolSighting;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.OffsetDateTime;
import java.util.*;
import java.util.stream.Collectors;

/**
 * Scores source addresses and endpoints over a fully materialised event list.
 * <p>
 * Every ranking here is a stable sort over insertion-ordered groupings, so ties keep the order in
 * which keys were first encountered.
 */
@Slf4j
@Service
public class ThreatAnalyzer {

    // address score weights
    static final double W_VOLUME = 0.002;
    static final double W_SERVER_ERROR = 0.02;
    static final double W_CLIENT_ERROR = 0.01;
    static final double W_ABNORMAL = 0.05;
    static final double W_LOGIN = 0.03;
    static final double W_IDENTITY = 0.02;
    static final double W_BURST = 0.01;

    // endpoint score weights
    static final int W_SQLI_HIT = 3;
    static final int W_SQLI_SERVER_ERROR = 2;

    public AnalysisResult analyze(List<LogEvent> events, int minRequests, int topN) {
        List<LogEvent> all = events == null ? List.of() : events;

        Map<String, List<LogEvent>> byAddress = groupByAddress(all);
        List<AddressProfile> ranked = scoreAddresses(byAddress, minRequests);
        List<AddressProfile> top = new ArrayList<>(ranked.subList(0, Math.min(Math.max(topN, 0), ranked.size())));

        List<ToolSighting> tools = findToolsFirstSeen(all);
        List<EndpointExposure> endpoints = rankVulnerableEndpoints(all);
        String scrapeSection = inferScrapeSection(byAddress, top);

        log.info("Analyzed {} events from {} address(es): {} scored, {} SQLi endpoint(s), {} tool(s)",
                all.size(), byAddress.size(), ranked.size(), endpoints.size(), tools.size());

        return AnalysisResult.builder()
                .parsedEvents(all.size())
                .topSuspiciousIps(top)
                .toolsFirstSeen(tools)
                .vulnerableEndpoints(endpoints)
                .inferredScrapeSection(scrapeSection)
                .allEvents(all)
                .build();
    }

    Map<String, List<LogEvent>> groupByAddress(List<LogEvent> events) {
        Map<String, List<LogEvent>> byAddress = new LinkedHashMap<>();
        for (LogEvent e : events) {
            byAddress.computeIfAbsent(e.getAddress(), k -> new ArrayList<>()).add(e);
        }
        return byAddress;
    }

    List<AddressProfile> scoreAddresses(Map<String, List<LogEvent>> byAddress, int minRequests) {
        List<AddressProfile> scored = new ArrayList<>();
        for (Map.Entry<String, List<LogEvent>> en : byAddress.entrySet()) {
            if (en.getValue().size() < minRequests) {
                continue;
            }
            scored.add(profile(en.getKey(), en.getValue()));
        }
        scored.sort(Comparator.comparingDouble(AddressProfile::getScore).reversed());
        return scored;
    }

    AddressProfile profile(String address, List<LogEvent> events) {
        int n = events.size();

        Map<Integer, Integer> statusCodes = new TreeMap<>();
        for (LogEvent e : events) {
            statusCodes.merge(e.getStatus(), 1, Integer::sum);
        }
        int clientErrors = sumStatusRange(statusCodes, 400, 499);
        int serverErrors = sumStatusRange(statusCodes, 500, 599);

        int abnormal = (int) events.stream().filter(LogEvent::isAbnormal).count();
        int loginAttempts = (int) events.stream().filter(e -> EndpointHints.isLoginPath(e.getPath())).count();
        int identityQueries = (int) events.stream().filter(e -> EndpointHints.isIdentityPath(e.getPath())).count();
        int maxRpm = maxRequestsPerMinute(events);

        double score = W_VOLUME * n
                + W_SERVER_ERROR * serverErrors
                + W_CLIENT_ERROR * clientErrors
                + W_ABNORMAL * abnormal
                + W_LOGIN * loginAttempts
                + W_IDENTITY * identityQueries
                + W_BURST * maxRpm;

        List<LogEvent> abnormalExamples = events.stream()
                .filter(LogEvent::isAbnormal)
                .limit(Constants.ABNORMAL_EXAMPLES_LIMIT)
                .collect(Collectors.toList());

        Set<String> tools = new LinkedHashSet<>();
        for (LogEvent e : events) {
            if (e.getDetectedTool() != null) {
                tools.add(e.getDetectedTool());
            }
        }

        return AddressProfile.builder()
                .address(address)
                .requestCount(n)
                .score(score)
                .statusCodes(Collections.unmodifiableMap(statusCodes))
                .clientErrorCount(clientErrors)
                .serverErrorCount(serverErrors)
                .abnormalCount(abnormal)
                .loginAttempts(loginAttempts)
                .identityQueries(identityQueries)
                .maxRequestsPerMinute(maxRpm)
                .topPaths(List.copyOf(mostCommon(events.stream().map(LogEvent::getPath).collect(Collectors.toList()),
                        Constants.TOP_PATHS_LIMIT)))
                .abnormalExamples(List.copyOf(abnormalExamples))
                .toolsUsed(Collections.unmodifiableSet(tools))
                .build();
    }

    /**
     * Earliest timestamp per detected tool, ordered by that timestamp.
     */
    List<ToolSighting> findToolsFirstSeen(List<LogEvent> events) {
        Map<String, OffsetDateTime> firstSeen = new LinkedHashMap<>();
        for (LogEvent e : events) {
            if (e.getDetectedTool() == null || e.getTimestamp() == null) {
                continue;
            }
            OffsetDateTime known = firstSeen.get(e.getDetectedTool());
            if (known == null || e.getTimestamp().isBefore(known)) {
                firstSeen.put(e.getDetectedTool(), e.getTimestamp());
            }
        }

        return firstSeen.entrySet().stream()
                .map(en -> new ToolSighting(en.getKey(), en.getValue()))
                .sorted(Comparator.comparing(ToolSighting::getFirstSeen, OffsetDateTime.timeLineOrder()))
                .collect(Collectors.toList());
    }

    /**
     * Paths hit by SQLi-tagged requests, scored by hits, hits answered with a 5xx, and distinct
     * payloads (first 200 characters of the raw target).
     */
    List<EndpointExposure> rankVulnerableEndpoints(List<LogEvent> events) {
        Map<String, EndpointStats> byPath = new LinkedHashMap<>();
        for (LogEvent e : events) {
            if (!e.hasTag(AttackCategory.SQLI)) {
                continue;
            }
            EndpointStats stats = byPath.computeIfAbsent(e.getPath(), k -> new EndpointStats());
            stats.hits++;
            if (isServerError(e.getStatus())) {
                stats.serverErrors++;
            }
            stats.payloads.add(DetectorUtils.truncate(e.getRequestTarget(), Constants.PAYLOAD_SIGNATURE_LENGTH));
            if (stats.examples.size() < Constants.ENDPOINT_EXAMPLES_LIMIT) {
                stats.examples.add(e.getRequestTarget());
            }
        }

        List<EndpointExposure> exposures = new ArrayList<>(byPath.size());
        for (Map.Entry<String, EndpointStats> en : byPath.entrySet()) {
            EndpointStats s = en.getValue();
            exposures.add(EndpointExposure.builder()
                    .endpoint(en.getKey())
                    .score((long) W_SQLI_HIT * s.hits + (long) W_SQLI_SERVER_ERROR * s.serverErrors + s.payloads.size())
                    .sqliHits(s.hits)
                    .sqliServerErrors(s.serverErrors)
                    .uniquePayloads(s.payloads.size())
                    .examples(List.copyOf(s.examples))
                    .build());
        }
        exposures.sort(Comparator.comparingLong(EndpointExposure::getScore).reversed());
        return exposures;
    }

    /**
     * Identity endpoint most likely harvested by the top addresses.
     * <p>
     * Candidates are compared on (identity hits, 2xx identity hits, mean identity response size);
     * the first candidate in rank order wins a full tie.
     */
    String inferScrapeSection(Map<String, List<LogEvent>> byAddress, List<AddressProfile> top) {
        String inferred = null;
        ScrapeCandidate best = null;

        for (AddressProfile profile : top) {
            List<LogEvent> events = byAddress.getOrDefault(profile.getAddress(), List.of());

            ScrapeCandidate candidate = new ScrapeCandidate();
            List<String> identityPaths = new ArrayList<>();
            for (LogEvent e : events) {
                if (!EndpointHints.isIdentityPath(e.getPath())) {
                    continue;
                }
                candidate.hits++;
                if (e.getStatus() >= 200 && e.getStatus() <= 299) {
                    candidate.ok++;
                }
                candidate.bytes += e.getByteCount();
                identityPaths.add(e.getPath());
            }
            if (candidate.hits == 0) {
                continue;
            }

            if (best == null || candidate.compareTo(best) > 0) {
                best = candidate;
                inferred = mostCommon(identityPaths, 1).get(0).getPath();
            }
        }
        return inferred;
    }

    int maxRequestsPerMinute(List<LogEvent> events) {
        Map<String, Integer> perMinute = new HashMap<>();
        for (LogEvent e : events) {
            if (e.getTimestamp() != null) {
                perMinute.merge(DetectorUtils.minuteBucket(e.getTimestamp()), 1, Integer::sum);
            }
        }
        return perMinute.values().stream().mapToInt(Integer::intValue).max().orElse(0);
    }

    /**
     * The {@code limit} most frequent values, ties ordered by first occurrence.
     */
    static List<PathCount> mostCommon(List<String> values, int limit) {
        Map<String, Long> counts = new LinkedHashMap<>();
        for (String v : values) {
            counts.merge(v, 1L, Long::sum);
        }
        return counts.entrySet().stream()
                .sorted(Map.Entry.<String, Long>comparingByValue().reversed())
                .limit(limit)
                .map(en -> new PathCount(en.getKey(), en.getValue()))
                .collect(Collectors.toList());
    }

    private static int sumStatusRange(Map<Integer, Integer> statusCodes, int from, int to) {
        return statusCodes.entrySet().stream()
                .filter(en -> en.getKey() >= from && en.getKey() <= to)
                .mapToInt(Map.Entry::getValue)
                .sum();
    }

    private static boolean isServerError(int status) {
        return status >= 500 && status <= 599;
    }

    private static class EndpointStats {
        int hits;
        int serverErrors;
        final Set<String> payloads = new HashSet<>();
        final List<String> examples = new ArrayList<>();
    }

    private static class ScrapeCandidate implements Comparable<ScrapeCandidate> {
        int hits;
        int ok;
        long bytes;

        double meanBytes() {
            return hits == 0 ? 0.0 : (double) bytes / hits;
        }

        @Override
        public int compareTo(ScrapeCandidate o) {
            int c = Integer.compare(hits, o.hits);
            if (c != 0) {
                return c;
            }
            c = Integer.compare(ok, o.ok);
            if (c != 0) {
                return c;
            }
            return Double.compare(meanBytes(), o.meanBytes());
        }
    }
}
