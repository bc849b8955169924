package com.jasmin.webloghunter.detectors;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.time.OffsetDateTime;
import java.time.format.DateTimeFormatter;

public class DetectorUtils {
    private static final DateTimeFormatter MINUTE_BUCKET_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm");
    private static final DateTimeFormatter REPORT_TIMESTAMP_FMT = DateTimeFormatter.ofPattern("uuuu-MM-dd'T'HH:mm:ssxxx");

    /**
     * Percent-decodes {@code s} the way browsers and servers do for request targets.
     * <p>
     * Consecutive {@code %XX} escapes are decoded together as UTF-8, with invalid byte sequences
     * replaced by U+FFFD. A {@code %} not followed by two hex digits is kept literally, and
     * {@code +} is not translated.
     *
     * @param s raw request text, may be {@code null}
     * @return the decoded text, or {@code ""} for {@code null}
     */
    public static String percentDecode(String s) {
        if (s == null || s.indexOf('%') < 0) {
            return getValueOrEmptyString(s);
        }

        StringBuilder out = new StringBuilder(s.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int i = 0;
        while (i < s.length()) {
            char c = s.charAt(i);
            if (c == '%' && i + 2 < s.length() && isHex(s.charAt(i + 1)) && isHex(s.charAt(i + 2))) {
                pending.write(Character.digit(s.charAt(i + 1), 16) * 16 + Character.digit(s.charAt(i + 2), 16));
                i += 3;
                continue;
            }
            flush(pending, out);
            out.append(c);
            i++;
        }
        flush(pending, out);
        return out.toString();
    }

    /**
     * Minute bucket key ({@code yyyy-MM-dd HH:mm}) in the timestamp's own offset.
     */
    public static String minuteBucket(OffsetDateTime ts) {
        return ts.format(MINUTE_BUCKET_FMT);
    }

    /**
     * Report rendering of a timestamp, always with seconds and a numeric offset
     * ({@code 2021-04-10T12:01:00+00:00}).
     *
     * @return the formatted timestamp, or {@code null} for {@code null}
     */
    public static String isoTimestamp(OffsetDateTime ts) {
        return ts == null ? null : ts.format(REPORT_TIMESTAMP_FMT);
    }

    /** Never-null string. */
    public static String getValueOrEmptyString(String s) {
        return (s == null) ? "" : s;
    }

    /** Leading {@code max} characters of {@code s}. */
    public static String truncate(String s, int max) {
        if (s == null) {
            return "";
        }
        return s.length() <= max ? s : s.substring(0, max);
    }

    private static boolean isHex(char c) {
        return Character.digit(c, 16) >= 0 && c < 128;
    }

    private static void flush(ByteArrayOutputStream pending, StringBuilder out) {
        if (pending.size() == 0) {
            return;
        }
        out.append(new String(pending.toByteArray(), StandardCharsets.UTF_8));
        pending.reset();
    }
}
