package com.jasmin.webloghunter.models;

import lombok.Value;

import java.time.OffsetDateTime;

@Value
public class ToolSighting {
    String tool;
    OffsetDateTime firstSeen;
}
