package com.jasmin.webloghunter.detectors;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.regex.Pattern;

/**
 * Known scanner and automation clients, in matching priority order.
 */
@Getter
@AllArgsConstructor
public enum ToolSignature {
    SQLMAP("sqlmap", word("sqlmap")),
    CURL("curl", versioned("curl")),
    PYTHON_REQUESTS("python-requests", word("python-requests")),
    GO_HTTP_CLIENT("go-http-client", word("go-http-client")),
    NIKTO("nikto", word("nikto")),
    ACUNETIX("acunetix", word("acunetix")),
    NMAP("nmap", word("nmap")),
    MASSCAN("masscan", word("masscan")),
    WGET("wget", versioned("wget")),
    GOBUSTER("gobuster", word("gobuster")),
    DIRBUSTER("dirbuster", word("dirbuster")),
    BURPSUITE("burpsuite", word("burp")),
    ZAPROXY("zaproxy", word("zap")),
    WPSCAN("wpscan", word("wpscan")),
    METASPLOIT("metasploit", word("metasploit")),
    NUCLEI("nuclei", word("nuclei")),
    SQLNINJA("sqlninja", word("sqlninja")),
    HAVIJ("havij", word("havij")),
    HTTPERF("httperf", word("httperf")),
    JMETER("jmeter", word("jmeter"));

    private final String toolName;
    private final Pattern pattern;

    public boolean matches(String userAgent) {
        return pattern.matcher(userAgent).find();
    }

    private static Pattern word(String token) {
        return Pattern.compile("\\b" + Pattern.quote(token) + "\\b", Pattern.CASE_INSENSITIVE);
    }

    /** Client names that are common words need a version suffix, e.g. {@code curl/8.4.0}. */
    private static Pattern versioned(String token) {
        return Pattern.compile("\\b" + Pattern.quote(token) + "/\\d", Pattern.CASE_INSENSITIVE);
    }
}
