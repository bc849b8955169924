package com.jasmin.webloghunter.parser;

import com.jasmin.webloghunter.detectors.AttackCategory;
import com.jasmin.webloghunter.detectors.SignatureCatalog;
import com.jasmin.webloghunter.models.LogEvent;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

public class CombinedLogParserTest {

    private final CombinedLogParser parser = new CombinedLogParser(new SignatureCatalog());

    @Test
    @DisplayName("a full combined line is split into every field")
    public void testParseFullLine() {
        String line = "203.0.113.9 - frank [10/Apr/2021:12:01:55 +0200] \"GET /shop/item.php?id=7&ref=home HTTP/1.1\" 200 1234 "
                + "\"https://example.com/\" \"curl/7.68.0\"";

        LogEvent e = parser.parseLine(line).orElseThrow();

        assertEquals("203.0.113.9", e.getAddress());
        assertEquals(OffsetDateTime.of(2021, 4, 10, 12, 1, 55, 0, ZoneOffset.ofHours(2)), e.getTimestamp());
        assertEquals("GET", e.getMethod());
        assertEquals("/shop/item.php?id=7&ref=home", e.getRequestTarget());
        assertEquals("/shop/item.php", e.getPath());
        assertEquals("id=7&ref=home", e.getQuery());
        assertEquals(200, e.getStatus());
        assertEquals(1234L, e.getByteCount());
        assertEquals("https://example.com/", e.getReferer());
        assertEquals("curl/7.68.0", e.getUserAgent());
        assertEquals("curl", e.getDetectedTool());
        assertTrue(e.getAttackTags().isEmpty());
    }

    @Test
    @DisplayName("the raw target is kept undecoded while tags come from the decoded form")
    public void testRawTargetAndTags() {
        String line = "10.0.0.5 - - [10/Apr/2021:12:01:55 +0000] \"GET /admin.php?id=1%27%20UNION%20SELECT%201,2-- HTTP/1.1\" 500 0 \"-\" \"sqlmap/1.0\"";

        LogEvent e = parser.parseLine(line).orElseThrow();

        assertEquals("/admin.php?id=1%27%20UNION%20SELECT%201,2--", e.getRequestTarget());
        assertEquals("/admin.php", e.getPath());
        assertTrue(e.hasTag(AttackCategory.SQLI));
        assertEquals("sqlmap", e.getDetectedTool());
    }

    @Test
    @DisplayName("referer and user-agent are optional; HTTP version is optional")
    public void testOptionalTrailingFields() {
        LogEvent e = parser.parseLine("10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] \"GET /index.html\" 304 -").orElseThrow();

        assertEquals("", e.getUserAgent());
        assertNull(e.getReferer());
        assertNull(e.getDetectedTool());
        assertEquals(0L, e.getByteCount());
        assertEquals("", e.getQuery());
    }

    @Test
    @DisplayName("non-numeric byte count becomes zero without failing the line")
    public void testBadByteCount() {
        Optional<LogEvent> e = parser.parseLine("10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] \"GET / HTTP/1.1\" 200 abc \"-\" \"x\"");

        assertTrue(e.isPresent());
        assertEquals(0L, e.get().getByteCount());
    }

    @Test
    @DisplayName("an unparseable timestamp leaves the event without a timestamp")
    public void testBadTimestamp() {
        LogEvent e = parser.parseLine("10.0.0.1 - - [yesterday at noon] \"GET / HTTP/1.1\" 200 10 \"-\" \"x\"").orElseThrow();

        assertNull(e.getTimestamp());
        assertEquals(200, e.getStatus());
    }

    @Test
    @DisplayName("timestamps without an offset are read as UTC")
    public void testTimestampWithoutOffset() {
        assertEquals(OffsetDateTime.of(2021, 4, 10, 12, 1, 55, 0, ZoneOffset.UTC),
                parser.parseTimestamp("10/Apr/2021:12:01:55"));
        assertNull(parser.parseTimestamp("2021-04-10T12:01:55Z"));
    }

    @Test
    @DisplayName("colon offsets and upper-case month names are accepted")
    public void testLenientTimestampForms() {
        assertEquals(OffsetDateTime.of(2021, 4, 10, 12, 1, 0, 0, ZoneOffset.UTC),
                parser.parseTimestamp("10/Apr/2021:12:01:00 +00:00"));
        assertEquals(OffsetDateTime.of(2021, 4, 10, 12, 1, 0, 0, ZoneOffset.ofHoursMinutes(5, 30)),
                parser.parseTimestamp("10/APR/2021:12:01:00 +0530"));
        assertEquals(OffsetDateTime.of(2021, 4, 10, 12, 1, 0, 0, ZoneOffset.ofHours(-7)),
                parser.parseTimestamp("10/apr/2021:12:01:00 -07:00"));
    }

    @Test
    @DisplayName("lines that break the grammar are rejected")
    public void testRejectsMalformedLines() {
        assertTrue(parser.parseLine("").isEmpty());
        assertTrue(parser.parseLine("not a log line").isEmpty());
        assertTrue(parser.parseLine("10.0.0.1 - - 10/Apr/2021:12:01:55 +0000 \"GET / HTTP/1.1\" 200 10").isEmpty());
        assertTrue(parser.parseLine("10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] \"GET / HTTP/1.1\" OK 10").isEmpty());
        assertTrue(parser.parseLine("10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] \"get / HTTP/1.1\" 200 10").isEmpty());
        assertTrue(parser.parseLine("10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] \"GET / HTTP/1.1\" 200").isEmpty());
    }

    @Test
    @DisplayName("absolute-form targets keep only the path")
    public void testAbsoluteFormTarget() {
        LogEvent e = parser.parseLine("10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] \"GET http://example.com/a/b?c=1 HTTP/1.1\" 200 10").orElseThrow();

        assertEquals("/a/b", e.getPath());
        assertEquals("c=1", e.getQuery());
    }

    @Test
    @DisplayName("a target with no path falls back to the raw target")
    public void testPathFallback() {
        LogEvent e = parser.parseLine("10.0.0.1 - - [10/Apr/2021:12:01:55 +0000] \"GET ?debug=1 HTTP/1.1\" 200 10").orElseThrow();

        assertEquals("?debug=1", e.getPath());
        assertEquals("debug=1", e.getQuery());
    }

    @Test
    public void testParseBytes() {
        assertEquals(0L, CombinedLogParser.parseBytes("-"));
        assertEquals(0L, CombinedLogParser.parseBytes(""));
        assertEquals(0L, CombinedLogParser.parseBytes("12k"));
        assertEquals(4096L, CombinedLogParser.parseBytes("4096"));
    }
}
