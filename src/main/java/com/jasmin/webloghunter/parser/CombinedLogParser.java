package com.jasmin.webloghunter.parser;

import com.jasmin.webloghunter.detectors.SignatureCatalog;
import com.jasmin.webloghunter.models.LogEvent;
import lombok.RequiredArgsConstructor;
import lombok.Value;
import org.springframework.stereotype.Component;

import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeFormatterBuilder;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for Apache/Nginx "combined" access-log lines.
 * <p>
 * Example: {@code 10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] "GET /path?q=1 HTTP/1.1" 200 1234 "-" "UA"}
 */
@Component
@RequiredArgsConstructor
public class CombinedLogParser {

    private static final Pattern COMBINED_LINE = Pattern.compile(
            "^(?<ip>\\S+)\\s+\\S+\\s+\\S+\\s+\\[(?<ts>[^\\]]+)\\]\\s+"
                    + "\"(?<method>[A-Z]+)\\s+(?<url>\\S+)(?:\\s+HTTP/(?<httpver>[^\"]+))?\"\\s+"
                    + "(?<status>\\d{3})\\s+(?<bytes>\\S+)"
                    + "(?:\\s+\"(?<ref>[^\"]*)\"\\s+\"(?<ua>[^\"]*)\")?");

    // offset as +HHMM or +HH:MM, month name in any case
    private static final DateTimeFormatter TS_WITH_OFFSET = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("dd/MMM/yyyy:HH:mm:ss [xxx][xx]")
            .toFormatter(Locale.ENGLISH);
    private static final DateTimeFormatter TS_LOCAL = new DateTimeFormatterBuilder()
            .parseCaseInsensitive()
            .appendPattern("dd/MMM/yyyy:HH:mm:ss")
            .toFormatter(Locale.ENGLISH);

    private final SignatureCatalog catalog;

    /**
     * Parses one line; an empty result means the line does not have the combined-log shape.
     */
    public Optional<LogEvent> parseLine(String line) {
        if (line == null) {
            return Optional.empty();
        }
        Matcher m = COMBINED_LINE.matcher(line);
        if (!m.lookingAt()) {
            return Optional.empty();
        }

        String url = m.group("url");
        String userAgent = m.group("ua") == null ? "" : m.group("ua");

        RequestTarget target = RequestTarget.split(url);
        String path = target.getPath().isEmpty() ? url : target.getPath();

        return Optional.of(LogEvent.builder()
                .address(m.group("ip"))
                .timestamp(parseTimestamp(m.group("ts")))
                .method(m.group("method"))
                .requestTarget(url)
                .path(path)
                .query(target.getQuery())
                .status(Integer.parseInt(m.group("status")))
                .byteCount(parseBytes(m.group("bytes")))
                .userAgent(userAgent)
                .referer(m.group("ref"))
                .detectedTool(catalog.detectTool(userAgent))
                .attackTags(catalog.detectAttacks(url))
                .build());
    }

    /**
     * Apache timestamp with numeric offset ({@code +0200} or {@code +02:00}), falling back to the same layout without one (taken as UTC).
     *
     * @return the parsed timestamp, or {@code null} when neither layout matches
     */
    public OffsetDateTime parseTimestamp(String raw) {
        if (raw == null) {
            return null;
        }
        OffsetDateTime withOffset = tryParseWithOffset(raw);
        if (withOffset != null) {
            return withOffset;
        }
        try {
            return LocalDateTime.parse(raw, TS_LOCAL).atOffset(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static OffsetDateTime tryParseWithOffset(String raw) {
        try {
            return OffsetDateTime.parse(raw, TS_WITH_OFFSET);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    /** "-", empty or non-numeric byte fields count as zero. */
    static long parseBytes(String raw) {
        if (raw == null || raw.isEmpty() || raw.equals("-")) {
            return 0L;
        }
        try {
            return Math.max(0L, Long.parseLong(raw));
        } catch (NumberFormatException e) {
            return 0L;
        }
    }

    /**
     * Path and query of a request target. Absolute-form targets ({@code scheme://host/path}) lose
     * their scheme and authority; the fragment is dropped.
     */
    @Value
    static class RequestTarget {
        String path;
        String query;

        static RequestTarget split(String target) {
            String rest = target;
            int hash = rest.indexOf('#');
            if (hash >= 0) {
                rest = rest.substring(0, hash);
            }

            String query = "";
            int q = rest.indexOf('?');
            if (q >= 0) {
                query = rest.substring(q + 1);
                rest = rest.substring(0, q);
            }

            int scheme = rest.indexOf("://");
            if (scheme > 0 && isSchemeName(rest.substring(0, scheme))) {
                int slash = rest.indexOf('/', scheme + 3);
                rest = slash >= 0 ? rest.substring(slash) : "";
            }
            return new RequestTarget(rest, query);
        }

        private static boolean isSchemeName(String s) {
            return s.chars().allMatch(c -> Character.isLetterOrDigit(c) || c == '+' || c == '-' || c == '.');
        }
    }
}
