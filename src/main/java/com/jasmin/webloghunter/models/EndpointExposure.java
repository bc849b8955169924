package com.jasmin.webloghunter.models;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * SQL-injection exposure of one path.
 */
@Value
@Builder
public class EndpointExposure {
    String endpoint;
    long score;
    int sqliHits;
    int sqliServerErrors;
    int uniquePayloads;
    List<String> examples;
}
