package com.jasmin.webloghunter.models;

import lombok.Value;

import java.util.List;

/**
 * Events and counters gathered from every file of one input location.
 */
@Value
public class ReadSummary {
    List<LogEvent> events;
    int failures;
    int filesRead;
}
