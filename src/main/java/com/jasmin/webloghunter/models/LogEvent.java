package com.jasmin.webloghunter.models;

import com.jasmin.webloghunter.detectors.AttackCategory;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.OffsetDateTime;
import java.util.EnumSet;
import java.util.Set;

/**
 * One parsed access-log line.
 */
@Data
@AllArgsConstructor
@NoArgsConstructor
@Builder
public class LogEvent {
    private String address;

    // null when the bracketed timestamp could not be parsed
    private OffsetDateTime timestamp;

    private String method;

    // request target exactly as logged, not decoded
    private String requestTarget;
    private String path;
    private String query;

    private int status;
    private long byteCount;

    private String userAgent;
    private String referer;

    private String detectedTool;

    @Builder.Default
    private Set<AttackCategory> attackTags = EnumSet.noneOf(AttackCategory.class);

    public boolean isAbnormal() {
        return attackTags != null && !attackTags.isEmpty();
    }

    public boolean hasTag(AttackCategory category) {
        return attackTags != null && attackTags.contains(category);
    }
}
