package com.jasmin.webloghunter.models;

import lombok.Value;

@Value
public class PathCount {
    String path;
    long count;
}
