package com.jasmin.webloghunter.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Behavioural summary of one source address for a single analysis run.
 */
@Value
@Builder
public class AddressProfile {
    String address;
    int requestCount;
    double score;

    // status code -> occurrences, ascending by code
    Map<Integer, Integer> statusCodes;

    int clientErrorCount;
    int serverErrorCount;
    int abnormalCount;
    int loginAttempts;
    int identityQueries;
    int maxRequestsPerMinute;

    List<PathCount> topPaths;
    List<LogEvent> abnormalExamples;
    Set<String> toolsUsed;
}
