package com.jasmin.webloghunter.detectors;

import com.fasterxml.jackson.annotation.JsonValue;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Attack categories recognised in decoded request targets.
 * <p>
 * Declaration order is the evaluation order, and therefore the order tags appear in on an event.
 */
@Getter
public enum AttackCategory {
    SQLI("SQLi",
            "(\\bunion\\b|\\bselect\\b|\\binformation_schema\\b|\\bsleep\\s*\\(|\\bbenchmark\\s*\\("
                    + "|--|/\\*|\\*/|%27|'|\\bor\\s+1=1\\b|\\band\\s+1=1\\b)"),
    TRAVERSAL("Traversal/LFI",
            "(\\.\\./|%2e%2e%2f|%2e%2e\\\\|/etc/passwd|win\\.ini|\\.\\.\\\\|%5c%2e%2e)"),
    XSS("XSS",
            "(<script|%3cscript|onerror=|onload=|alert\\s*\\(|javascript:|<iframe|"
                    + "<img\\s+src|eval\\s*\\(|<svg|onmouseover=)"),
    SSRF("SSRF",
            "(https?://|%3a%2f%2f|169\\.254\\.169\\.254|localhost|127\\.0\\.0\\.1|"
                    + "0\\.0\\.0\\.0|::1|\\[::1\\]|metadata\\.google\\.internal)"),
    CMDI("CMDi/Shell",
            "(\\bcat\\b|\\bwget\\b|\\bcurl\\b|;|\\|\\||&&|\\b/bin/sh\\b|\\bpowershell\\b|"
                    + "\\bexec\\b|\\bsystem\\b|\\$\\(|`|<\\(|>\\()"),
    RCE("RCE",
            "(eval\\(|exec\\(|system\\(|passthru\\(|shell_exec\\(|phpinfo\\(|"
                    + "assert\\(|preg_replace\\s*\\(.*/e[\"']?\\s*,|create_function\\()"),
    XXE("XXE",
            "(<!ENTITY\\s+\\w+\\s+SYSTEM|<!DOCTYPE.*ENTITY|SYSTEM\\s+[\"']file:|SYSTEM\\s+[\"']http)"),
    LDAP("LDAP Injection", "(\\*\\)|\\(\\||&\\(|\\|\\()"),
    NOSQL("NoSQL Injection", "(\\$ne|\\$gt|\\$lt|\\$where|\\$regex|\\[\\$)");

    private final String label;
    private final Pattern pattern;

    AttackCategory(String label, String regex) {
        this.label = label;
        this.pattern = Pattern.compile(regex, Pattern.CASE_INSENSITIVE);
    }

    public boolean matches(String decoded) {
        return pattern.matcher(decoded).find();
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
