package com.jasmin.webloghunter.models;

import lombok.Value;

import java.nio.file.Path;
import java.util.List;

@Value
public class FileReadResult {
    Path file;
    List<LogEvent> events;
    int failures;
}
